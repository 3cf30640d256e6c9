package com.pharmacy.ecommerce.domain.common.page;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PageQuery / PagedResult 테스트")
class PageQueryTest {

    @Test
    @DisplayName("기본값 - page 1, limit 10")
    void testOf_Defaults() {
        PageQuery query = PageQuery.of(null, null);

        assertEquals(1, query.getPage());
        assertEquals(10, query.getLimit());
        assertEquals(PageQuery.defaults(), query);
    }

    @Test
    @DisplayName("보정 - page는 1 이상, limit은 1~100")
    void testOf_Clamp() {
        assertEquals(1, PageQuery.of(0, 10).getPage());
        assertEquals(1, PageQuery.of(-3, 10).getPage());
        assertEquals(1, PageQuery.of(1, 0).getLimit());
        assertEquals(100, PageQuery.of(1, 500).getLimit());
    }

    @Test
    @DisplayName("offset 계산")
    void testGetOffset() {
        assertEquals(20L, PageQuery.of(3, 10).getOffset());
    }

    @Test
    @DisplayName("PagedResult - 23건 중 3페이지 (limit 10)")
    void testPagedResult_LastPage() {
        PagedResult<String> result = PagedResult.of(List.of("a", "b", "c"), 23, PageQuery.of(3, 10));

        assertEquals(3, result.getTotalPages());
        assertFalse(result.isHasNextPage());
        assertTrue(result.isHasPreviousPage());
    }

    @Test
    @DisplayName("PagedResult - 결과 없음이면 totalPages 0")
    void testPagedResult_Empty() {
        PagedResult<String> result = PagedResult.of(List.of(), 0, PageQuery.defaults());

        assertEquals(0, result.getTotalPages());
        assertFalse(result.isHasNextPage());
        assertFalse(result.isHasPreviousPage());
    }

    @Test
    @DisplayName("PagedResult.map - 페이지 정보 유지")
    void testPagedResult_Map() {
        PagedResult<Integer> mapped = PagedResult.of(List.of("ab", "c"), 12, PageQuery.of(1, 2))
                .map(String::length);

        assertEquals(List.of(2, 1), mapped.getItems());
        assertEquals(12L, mapped.getTotal());
        assertEquals(6, mapped.getTotalPages());
        assertTrue(mapped.isHasNextPage());
    }
}
