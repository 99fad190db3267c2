package com.hostbridge.core.container;

public enum BindingType {
    INSTANCE, // 现成实例
    SINGLETON, // 延迟构造，记忆化
    FACTORY // 每次解析都重新构造
}
