package com.pharmacy.ecommerce.domain.catalog;

import com.pharmacy.ecommerce.domain.common.vo.Money;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 카탈로그 상품 조회 결과 (읽기 전용)
 */
@Getter
@Builder
@ToString
public class CatalogProduct {

    private final String id;
    private final String name;
    private final Money price;
    private final boolean requiresPrescription;
    private final boolean active;
}
