package com.hostbridge.core.pagination;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 已知总数的分页器
 */
public class LengthAwarePaginator<T> extends AbstractPaginator<T> {

    private final long total;
    private final int lastPage;

    public LengthAwarePaginator(List<T> items, long total, int perPage) {
        this(items, total, perPage, null, null, null);
    }

    public LengthAwarePaginator(List<T> items, long total, int perPage, Integer currentPage,
                                String path, String pageName) {
        super(items, perPage, currentPage, path, pageName);
        this.total = total;
        this.lastPage = Math.max((int) Math.ceil((double) total / perPage), 1);
    }

    public long getTotal() {
        return total;
    }

    public int getLastPage() {
        return lastPage;
    }

    @Override
    public boolean hasMorePages() {
        return currentPage < lastPage;
    }

    @Override
    public String nextPageUrl() {
        return hasMorePages() ? url(currentPage + 1) : null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("current_page", currentPage);
        map.put("data", getItems());
        map.put("first_page_url", url(1));
        map.put("from", firstItem());
        map.put("last_page", lastPage);
        map.put("last_page_url", url(lastPage));
        map.put("next_page_url", nextPageUrl());
        map.put("path", path);
        map.put("per_page", perPage);
        map.put("prev_page_url", previousPageUrl());
        map.put("to", lastItem());
        map.put("total", total);
        return map;
    }
}
