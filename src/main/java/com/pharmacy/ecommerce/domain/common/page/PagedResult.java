package com.pharmacy.ecommerce.domain.common.page;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.function.Function;

/**
 * 페이지 조회 결과
 */
@Getter
@ToString
public final class PagedResult<T> {

    private final List<T> items;
    private final long total;
    private final int page;
    private final int limit;
    private final int totalPages;
    private final boolean hasNextPage;
    private final boolean hasPreviousPage;

    private PagedResult(List<T> items, long total, int page, int limit) {
        this.items = List.copyOf(items);
        this.total = total;
        this.page = page;
        this.limit = limit;
        this.totalPages = (int) ((total + limit - 1) / limit);
        this.hasNextPage = page < totalPages;
        this.hasPreviousPage = page > 1;
    }

    public static <T> PagedResult<T> of(List<T> items, long total, PageQuery query) {
        return new PagedResult<>(items, total, query.getPage(), query.getLimit());
    }

    public <R> PagedResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PagedResult<>(mapped, total, page, limit);
    }
}
