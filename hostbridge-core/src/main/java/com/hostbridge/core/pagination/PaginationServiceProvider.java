package com.hostbridge.core.pagination;

import com.hostbridge.api.container.Container;
import com.hostbridge.api.provider.ServiceProvider;

/**
 * 分页子系统提供者（无启动阶段）
 */
public class PaginationServiceProvider implements ServiceProvider {

    @Override
    public void register(Container container) {
        PaginationState.resolveUsing(container);
    }
}
