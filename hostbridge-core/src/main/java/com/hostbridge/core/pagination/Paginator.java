package com.hostbridge.core.pagination;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 简单分页器：不知道总数，只知道是否还有下一页
 * <p>
 * 调用方应多取一条（perPage + 1），多出的那条仅用于判断 hasMorePages。
 */
public class Paginator<T> extends AbstractPaginator<T> {

    private final boolean hasMore;

    public Paginator(List<T> items, int perPage) {
        this(items, perPage, null, null, null);
    }

    public Paginator(List<T> items, int perPage, Integer currentPage, String path, String pageName) {
        super(new ArrayList<>(items.subList(0, Math.min(items.size(), perPage))), perPage, currentPage, path, pageName);
        this.hasMore = items.size() > perPage;
    }

    @Override
    public boolean hasMorePages() {
        return hasMore;
    }

    @Override
    public String nextPageUrl() {
        return hasMore ? url(currentPage + 1) : null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("current_page", currentPage);
        map.put("data", getItems());
        map.put("first_page_url", url(1));
        map.put("from", firstItem());
        map.put("next_page_url", nextPageUrl());
        map.put("path", path);
        map.put("per_page", perPage);
        map.put("prev_page_url", previousPageUrl());
        map.put("to", lastItem());
        return map;
    }
}
