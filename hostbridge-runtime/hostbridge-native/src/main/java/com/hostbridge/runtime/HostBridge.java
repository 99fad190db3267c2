package com.hostbridge.runtime;

import com.hostbridge.api.container.Container;
import com.hostbridge.api.container.ServiceLocator;
import com.hostbridge.api.exception.EntryNotFoundException;
import com.hostbridge.api.exception.InvalidArgumentException;
import com.hostbridge.api.provider.BootableServiceProvider;
import com.hostbridge.api.provider.ServiceProvider;
import com.hostbridge.core.config.ConfigRepository;
import com.hostbridge.core.container.ServiceContainer;
import com.hostbridge.core.database.DatabaseManager;
import com.hostbridge.core.database.DatabaseServiceProvider;
import com.hostbridge.core.database.FetchMode;
import com.hostbridge.core.database.event.QueryExecutedEvent;
import com.hostbridge.core.diagnostics.DatabasePanel;
import com.hostbridge.core.diagnostics.DiagnosticsBar;
import com.hostbridge.core.event.EventDispatcher;
import com.hostbridge.core.exception.UndefinedOperationException;
import com.hostbridge.core.facade.AliasLoader;
import com.hostbridge.core.facade.Facade;
import com.hostbridge.core.facade.ViewFacade;
import com.hostbridge.core.filesystem.Filesystem;
import com.hostbridge.core.http.Request;
import com.hostbridge.core.pagination.PaginationServiceProvider;
import com.hostbridge.core.pagination.PaginationState;
import com.hostbridge.core.translation.TranslationServiceProvider;
import com.hostbridge.core.view.ViewServiceProvider;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * HostBridge 启动器
 * <p>
 * 宿主应用通过此类获得一个进程级的服务容器，并按需接入视图、数据库、分页、翻译与诊断子系统：
 *
 * <pre>
 * HostBridge.getInstance()
 *         .setupView("templates", "build/views")
 *         .setupDatabase(connections)
 *         .setupTranslator("lang")
 *         .setupLocale("zh_CN");
 * </pre>
 *
 * 状态只有两种：未启动 / 已启动。{@link #flash()} 回到未启动状态，供测试隔离使用。
 */
@Slf4j
public class HostBridge implements ServiceLocator {

    private static final ReentrantLock INSTANCE_LOCK = new ReentrantLock();
    private static volatile HostBridge instance;

    private final ServiceContainer app;
    private final Map<String, Class<?>> aliases = new LinkedHashMap<>();
    private final List<String> installedAliases = new ArrayList<>();
    private final List<ServiceProvider> loadedProviders = new CopyOnWriteArrayList<>();

    private final ReentrantLock stateLock = new ReentrantLock();
    private volatile boolean bootstrapped = false;

    public HostBridge() {
        this(new ServiceContainer());
    }

    public HostBridge(ServiceContainer app) {
        this.app = app;
        this.aliases.put("View", ViewFacade.class);
    }

    // ==================== 全局实例 ====================

    /**
     * 获取进程级实例，首次访问时创建并启动
     */
    public static HostBridge getInstance() {
        HostBridge current = instance;
        if (current != null && current.isBootstrapped()) {
            return current;
        }
        INSTANCE_LOCK.lock();
        try {
            if (instance == null) {
                instance = new HostBridge();
            }
            if (!instance.isBootstrapped()) {
                instance.bootstrap();
            }
            return instance;
        } finally {
            INSTANCE_LOCK.unlock();
        }
    }

    /**
     * 重置进程级实例的启动状态，实例对象本身保留
     */
    public static void flashInstance() {
        getInstance().flash();
    }

    // ==================== 启动与重置 ====================

    public HostBridge bootstrap() {
        stateLock.lock();
        try {
            if (bootstrapped) {
                log.warn("HostBridge is already bootstrapped.");
                return this;
            }
            long start = System.currentTimeMillis();

            app.instance("config", new ConfigRepository());
            app.singleton("request", c -> Request.capture());
            app.singleton("events", EventDispatcher.class);
            app.singleton("files", Filesystem.class);

            Facade.clearResolvedInstances();
            Facade.setFacadeApplication(app);
            installAliases();

            bootstrapped = true;
            log.info("HostBridge bootstrapped in {} ms", System.currentTimeMillis() - start);
            return this;
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isBootstrapped() {
        return bootstrapped;
    }

    /**
     * 清空容器并撤销本实例安装的门面与别名，回到未启动状态
     */
    public HostBridge flash() {
        stateLock.lock();
        try {
            if (app.resolved("db")) {
                app.make("db", DatabaseManager.class).disconnectAll();
            }
            app.flush();

            Facade.clearResolvedInstances();
            if (Facade.getFacadeApplication() == app) {
                Facade.setFacadeApplication(null);
            }
            uninstallAliases();
            PaginationState.reset();
            loadedProviders.clear();

            bootstrapped = false;
            log.info("HostBridge flashed");
            return this;
        } finally {
            stateLock.unlock();
        }
    }

    private void installAliases() {
        aliases.forEach((alias, target) -> {
            if (AliasLoader.define(alias, target)) {
                installedAliases.add(alias);
            } else {
                log.info("Alias [{}] already exists, keeping the existing definition", alias);
            }
        });
    }

    private void uninstallAliases() {
        for (String alias : installedAliases) {
            AliasLoader.remove(alias, aliases.get(alias));
        }
        installedAliases.clear();
    }

    /**
     * 添加一个在启动时安装的别名；已启动的实例需要 flash 后重新启动才会生效
     */
    public HostBridge alias(String alias, Class<?> target) {
        aliases.put(alias, target);
        return this;
    }

    public Map<String, Class<?>> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }

    // ==================== 服务定位 ====================

    @Override
    public boolean has(String id) {
        return app.bound(id);
    }

    @Override
    public Object get(String id) {
        try {
            return app.make(id);
        } catch (RuntimeException e) {
            // 失败之后再检查是否已绑定：已绑定说明是构造失败，原样抛出
            if (has(id)) {
                throw e;
            }
            throw new EntryNotFoundException(id, e);
        }
    }

    public ServiceContainer getApp() {
        return app;
    }

    public Request getRequest() {
        return app.make("request", Request.class);
    }

    public EventDispatcher getEvents() {
        return app.make("events", EventDispatcher.class);
    }

    public ConfigRepository getConfig() {
        return app.make("config", ConfigRepository.class);
    }

    public Filesystem getFiles() {
        return app.make("files", Filesystem.class);
    }

    public List<ServiceProvider> getLoadedProviders() {
        return Collections.unmodifiableList(loadedProviders);
    }

    /**
     * 按名称委托给容器的有限操作集合
     *
     * @throws UndefinedOperationException 操作名不在支持列表中
     */
    public Object call(String operation, Object... args) {
        switch (operation) {
            case "bound":
                return app.bound(stringArg(operation, args, 0));
            case "make":
                return app.make(stringArg(operation, args, 0));
            case "instance":
                requireArgs(operation, args, 2);
                return app.instance(stringArg(operation, args, 0), args[1]);
            case "resolved":
                return app.resolved(stringArg(operation, args, 0));
            case "flush":
                app.flush();
                return null;
            case "runningInConsole":
                return app.runningInConsole();
            default:
                throw new UndefinedOperationException(operation);
        }
    }

    private static String stringArg(String operation, Object[] args, int index) {
        requireArgs(operation, args, index + 1);
        if (!(args[index] instanceof String value)) {
            throw new InvalidArgumentException("args", args[index],
                    "Operation '" + operation + "' expects a string at position " + index);
        }
        return value;
    }

    private static void requireArgs(String operation, Object[] args, int count) {
        if (args == null || args.length < count) {
            throw new InvalidArgumentException("args",
                    "Operation '" + operation + "' expects at least " + count + " argument(s)");
        }
    }

    // ==================== 子系统接入 ====================

    public HostBridge setupRunningInConsole() {
        return setupRunningInConsole(true);
    }

    public HostBridge setupRunningInConsole(boolean is) {
        ensureBootstrapped();
        app.set("runningInConsole", is);
        return this;
    }

    public HostBridge setupView(String viewPath, String compiledPath) {
        return setupView(Collections.singletonList(viewPath), compiledPath);
    }

    public HostBridge setupView(List<String> viewPaths, String compiledPath) {
        return setupCallableProvider(container -> {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("view.paths", new ArrayList<>(viewPaths));
            values.put("view.compiled", compiledPath);
            getConfig().set(values);

            return new ViewServiceProvider();
        });
    }

    public HostBridge setupDatabase(Map<String, ? extends Map<String, ?>> connections) {
        return setupDatabase(connections, "default", FetchMode.CLASS);
    }

    public HostBridge setupDatabase(Map<String, ? extends Map<String, ?>> connections, String defaultConnection) {
        return setupDatabase(connections, defaultConnection, FetchMode.CLASS);
    }

    public HostBridge setupDatabase(Map<String, ? extends Map<String, ?>> connections, String defaultConnection,
                                    FetchMode fetchMode) {
        return setupCallableProvider(container -> {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("database.connections", connections);
            values.put("database.default", defaultConnection);
            values.put("database.fetch", fetchMode);
            getConfig().set(values);

            return new DatabaseServiceProvider();
        });
    }

    public HostBridge setupPagination() {
        return setupCallableProvider(container -> new PaginationServiceProvider());
    }

    public HostBridge setupTranslator(String langPath) {
        return setupCallableProvider(container -> {
            container.instance("path.lang", langPath);

            return new TranslationServiceProvider();
        });
    }

    public HostBridge setupLocale(String locale) {
        ensureBootstrapped();
        getConfig().set("app.locale", locale);
        return this;
    }

    /**
     * 启用诊断栏，并把数据库面板挂到 SQL 执行事件上
     */
    public HostBridge setupDiagnostics(Map<String, ?> config) {
        ensureBootstrapped();
        DiagnosticsBar bar = new DiagnosticsBar(config == null ? Collections.emptyMap() : config,
                app.runningInConsole());
        app.instance("diagnostics", bar);

        DatabasePanel databasePanel = bar.getPanel(DatabasePanel.ID, DatabasePanel.class);
        if (databasePanel == null) {
            log.warn("Database panel is disabled, query logging is not attached");
            return this;
        }
        getEvents().listen(QueryExecutedEvent.class, event -> databasePanel.logQuery(
                event.getSql(),
                event.getBindings(),
                event.getTime(),
                event.getConnectionName(),
                event.getConnection().getJdbcConnection()));
        return this;
    }

    /**
     * 把 YAML 文件合并进配置仓库
     */
    public HostBridge setupConfiguration(Path yamlFile) {
        ensureBootstrapped();
        getConfig().mergeYaml(yamlFile);
        return this;
    }

    /**
     * 接入自定义服务提供者
     *
     * @param callable 以容器为参数返回提供者实例
     */
    public HostBridge setupCallableProvider(Function<Container, ? extends ServiceProvider> callable) {
        ensureBootstrapped();
        bootServiceProvider(callable.apply(app));
        return this;
    }

    protected void bootServiceProvider(ServiceProvider serviceProvider) {
        if (serviceProvider == null) {
            throw new InvalidArgumentException("serviceProvider", "Callable returned no service provider");
        }
        String name = serviceProvider.getClass().getSimpleName();

        serviceProvider.register(app);
        if (serviceProvider instanceof BootableServiceProvider bootable) {
            bootable.boot(app);
        }
        loadedProviders.add(serviceProvider);
        log.info("[{}] Provider registered{}", name,
                serviceProvider instanceof BootableServiceProvider ? " and booted" : "");
    }

    private void ensureBootstrapped() {
        if (!bootstrapped) {
            log.debug("HostBridge not bootstrapped yet, bootstrapping lazily");
            bootstrap();
        }
    }
}
