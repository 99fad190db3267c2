package com.hostbridge.core.pagination;

import com.hostbridge.core.container.ServiceContainer;
import com.hostbridge.core.http.Request;
import com.hostbridge.core.http.RequestContextHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("分页器测试")
class PaginatorTest {

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
        PaginationState.reset();
    }

    @Nested
    @DisplayName("LengthAwarePaginator")
    class LengthAwareTests {

        @Test
        @DisplayName("计算末页与序号")
        void shouldComputePages() {
            LengthAwarePaginator<String> paginator =
                    new LengthAwarePaginator<>(List.of("d", "e", "f"), 10, 3, 2, "/users", null);

            assertEquals(4, paginator.getLastPage());
            assertEquals(4, paginator.firstItem());
            assertEquals(6, paginator.lastItem());
            assertTrue(paginator.hasMorePages());
            assertFalse(paginator.onFirstPage());
            assertEquals("/users?page=3", paginator.nextPageUrl());
            assertEquals("/users?page=1", paginator.previousPageUrl());
        }

        @Test
        @DisplayName("总数为 0 时末页为 1")
        void emptyResultShouldHaveOnePage() {
            LengthAwarePaginator<String> paginator =
                    new LengthAwarePaginator<>(List.of(), 0, 15, 1, "/", null);

            assertEquals(1, paginator.getLastPage());
            assertNull(paginator.firstItem());
            assertNull(paginator.nextPageUrl());
            assertNull(paginator.previousPageUrl());
        }

        @Test
        @DisplayName("appends 追加查询参数，页码参数名可自定义")
        void appendsShouldExtendUrls() {
            LengthAwarePaginator<String> paginator =
                    new LengthAwarePaginator<>(List.of("a"), 5, 1, 1, "/posts", "p");
            paginator.appends("sort", "new");

            assertEquals("/posts?p=2&sort=new", paginator.nextPageUrl());
        }

        @Test
        @DisplayName("toMap 输出约定字段")
        void toMapShouldExposeFields() {
            Map<String, Object> map =
                    new LengthAwarePaginator<>(List.of("a", "b"), 2, 2, 1, "/x", null).toMap();

            assertEquals(1, map.get("current_page"));
            assertEquals(1, map.get("last_page"));
            assertEquals(2L, map.get("total"));
            assertEquals("/x?page=1", map.get("first_page_url"));
            assertNull(map.get("next_page_url"));
        }

        @Test
        @DisplayName("perPage 必须为正数")
        void perPageShouldBePositive() {
            assertThrows(IllegalArgumentException.class,
                    () -> new LengthAwarePaginator<>(List.of(), 0, 0));
        }
    }

    @Nested
    @DisplayName("Paginator")
    class SimpleTests {

        @Test
        @DisplayName("多取的一条只用于判断是否有下一页")
        void extraItemShouldSignalMorePages() {
            Paginator<Integer> paginator = new Paginator<>(List.of(1, 2, 3), 2, 1, "/n", null);

            assertEquals(List.of(1, 2), paginator.getItems());
            assertTrue(paginator.hasMorePages());
            assertEquals("/n?page=2", paginator.nextPageUrl());
        }

        @Test
        @DisplayName("不足一页时没有下一页")
        void shortPageShouldBeLast() {
            Paginator<Integer> paginator = new Paginator<>(List.of(1), 2, 3, "/n", null);

            assertFalse(paginator.hasMorePages());
            assertEquals(5, paginator.firstItem());
        }
    }

    @Nested
    @DisplayName("请求解析")
    class ResolverTests {

        @Test
        @DisplayName("未安装解析器时默认第 1 页、路径 /")
        void defaultsWithoutResolvers() {
            Paginator<Integer> paginator = new Paginator<>(List.of(1), 10);

            assertEquals(1, paginator.getCurrentPage());
            assertEquals("/", paginator.getPath());
        }

        @Test
        @DisplayName("从当前请求读取页码与路径")
        void shouldResolveFromRequest() {
            ServiceContainer container = new ServiceContainer();
            container.singleton("request", c -> Request.capture());
            PaginationState.resolveUsing(container);

            RequestContextHolder.set(Request.builder()
                    .host("example.com").path("/users").queryParam("page", "3").build());
            LengthAwarePaginator<String> paginator = new LengthAwarePaginator<>(List.of("x"), 100, 10);

            assertEquals(3, paginator.getCurrentPage());
            assertEquals("http://example.com/users", paginator.getPath());
        }

        @Test
        @DisplayName("非法页码回退到第 1 页")
        void invalidPageShouldFallBack() {
            ServiceContainer container = new ServiceContainer();
            container.instance("request", Request.builder().queryParam("page", "-2").build());
            PaginationState.resolveUsing(container);

            assertEquals(1, new Paginator<>(List.of(), 5).getCurrentPage());

            container.instance("request", Request.builder().queryParam("page", "abc").build());
            assertEquals(1, new Paginator<>(List.of(), 5).getCurrentPage());
        }
    }
}
