package com.pharmacy.ecommerce.domain.common.page;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 페이지 요청 값 (정규화된 page, limit)
 *
 * - page: 1 이상으로 보정 (기본 1)
 * - limit: 1 ~ 100 범위로 보정 (기본 10)
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PageQuery {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private final int page;
    private final int limit;

    private PageQuery(int page, int limit) {
        this.page = page;
        this.limit = limit;
    }

    /**
     * null 값은 기본값으로, 범위를 벗어난 값은 경계값으로 보정합니다.
     */
    public static PageQuery of(Integer page, Integer limit) {
        int normalizedPage = page == null ? DEFAULT_PAGE : Math.max(1, page);
        int normalizedLimit = limit == null ? DEFAULT_LIMIT : Math.min(MAX_LIMIT, Math.max(1, limit));
        return new PageQuery(normalizedPage, normalizedLimit);
    }

    public static PageQuery defaults() {
        return new PageQuery(DEFAULT_PAGE, DEFAULT_LIMIT);
    }

    public long getOffset() {
        return (long) (page - 1) * limit;
    }
}
