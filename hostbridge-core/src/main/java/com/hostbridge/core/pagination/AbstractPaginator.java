package com.hostbridge.core.pagination;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 分页器基类
 * <p>
 * 当前页与当前路径未显式给出时，从全局解析器读取（由 {@link PaginationState} 安装）。
 */
public abstract class AbstractPaginator<T> {

    private static volatile Supplier<String> currentPathResolver = () -> "/";
    private static volatile Function<String, Integer> currentPageResolver = pageName -> 1;

    protected final List<T> items;
    protected final int perPage;
    protected final int currentPage;
    protected final String path;
    protected final String pageName;
    private final Map<String, String> query = new TreeMap<>();

    protected AbstractPaginator(List<T> items, int perPage, Integer currentPage, String path, String pageName) {
        if (perPage < 1) {
            throw new IllegalArgumentException("perPage must be positive: " + perPage);
        }
        this.pageName = pageName == null ? "page" : pageName;
        this.perPage = perPage;
        this.currentPage = normalizePage(currentPage != null ? currentPage : resolveCurrentPage(this.pageName));
        this.path = path != null ? path : resolveCurrentPath();
        this.items = items;
    }

    // ==================== URL ====================

    public String url(int page) {
        int target = Math.max(page, 1);
        StringBuilder sb = new StringBuilder(path);
        sb.append(path.contains("?") ? '&' : '?');
        sb.append(encode(pageName)).append('=').append(target);
        query.forEach((k, v) -> sb.append('&').append(encode(k)).append('=').append(encode(v)));
        return sb.toString();
    }

    public String previousPageUrl() {
        return currentPage > 1 ? url(currentPage - 1) : null;
    }

    public abstract String nextPageUrl();

    public abstract boolean hasMorePages();

    /**
     * 追加到所有分页链接上的查询参数
     */
    public AbstractPaginator<T> appends(String key, String value) {
        if (!pageName.equals(key)) {
            query.put(key, value);
        }
        return this;
    }

    // ==================== 数据 ====================

    public List<T> getItems() {
        return Collections.unmodifiableList(items);
    }

    public int count() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * 本页第一条在全部结果中的序号（从 1 开始），空页返回 null
     */
    public Integer firstItem() {
        return items.isEmpty() ? null : (currentPage - 1) * perPage + 1;
    }

    public Integer lastItem() {
        return items.isEmpty() ? null : firstItem() + count() - 1;
    }

    public boolean onFirstPage() {
        return currentPage <= 1;
    }

    public int getPerPage() {
        return perPage;
    }

    public int getCurrentPage() {
        return currentPage;
    }

    public String getPath() {
        return path;
    }

    public String getPageName() {
        return pageName;
    }

    // ==================== 全局解析器 ====================

    public static void currentPathResolver(Supplier<String> resolver) {
        currentPathResolver = resolver;
    }

    public static void currentPageResolver(Function<String, Integer> resolver) {
        currentPageResolver = resolver;
    }

    public static String resolveCurrentPath() {
        return currentPathResolver.get();
    }

    public static int resolveCurrentPage(String pageName) {
        Integer page = currentPageResolver.apply(pageName);
        return page == null ? 1 : page;
    }

    private static int normalizePage(int page) {
        return page < 1 ? 1 : page;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
