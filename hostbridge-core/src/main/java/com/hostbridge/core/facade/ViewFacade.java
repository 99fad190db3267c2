package com.hostbridge.core.facade;

import com.hostbridge.core.view.View;
import com.hostbridge.core.view.ViewFactory;

import java.util.Map;

/**
 * 视图门面，默认以别名 "View" 安装
 */
public final class ViewFacade extends Facade {

    public static final String ACCESSOR = "view";

    private ViewFacade() {
    }

    public static ViewFactory getFacadeRoot() {
        return resolveFacadeInstance(ACCESSOR, ViewFactory.class);
    }

    public static View make(String name, Map<String, ?> data) {
        return getFacadeRoot().make(name, data);
    }

    public static String render(String name, Map<String, ?> data) {
        return make(name, data).render();
    }

    public static boolean exists(String name) {
        return getFacadeRoot().exists(name);
    }

    public static void share(String key, Object value) {
        getFacadeRoot().share(key, value);
    }
}
