package com.hostbridge.core.pagination;

import com.hostbridge.api.container.Container;
import com.hostbridge.core.http.Request;
import com.hostbridge.core.http.RequestContextHolder;

/**
 * 分页器全局解析器的安装与复位
 */
public final class PaginationState {

    private PaginationState() {
    }

    /**
     * 当前请求优先取线程上的请求，否则取容器中的 request
     */
    public static void resolveUsing(Container container) {
        AbstractPaginator.currentPathResolver(() -> currentRequest(container).url());

        AbstractPaginator.currentPageResolver(pageName -> {
            String page = currentRequest(container).input(pageName);
            if (page == null) {
                return 1;
            }
            try {
                int value = Integer.parseInt(page.trim());
                return value >= 1 ? value : 1;
            } catch (NumberFormatException e) {
                return 1;
            }
        });
    }

    public static void reset() {
        AbstractPaginator.currentPathResolver(() -> "/");
        AbstractPaginator.currentPageResolver(pageName -> 1);
    }

    private static Request currentRequest(Container container) {
        Request request = RequestContextHolder.get();
        return request != null ? request : container.make("request", Request.class);
    }
}
