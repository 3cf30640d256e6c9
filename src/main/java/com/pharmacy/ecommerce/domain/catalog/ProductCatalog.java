package com.pharmacy.ecommerce.domain.catalog;

import java.util.Optional;

/**
 * ProductCatalog - 카탈로그 조회 Port
 *
 * 주문 도메인은 상품을 소유하지 않고 이 인터페이스로 조회만 한다.
 * 판매 중지 상품도 조회 결과에 포함될 수 있으며, 판매 가능 여부 판단은 호출자 몫이다.
 */
public interface ProductCatalog {

    Optional<CatalogProduct> findById(String productId);

    /**
     * @throws ProductNotFoundException 상품이 없는 경우
     */
    default CatalogProduct getProductById(String productId) {
        return findById(productId).orElseThrow(() -> new ProductNotFoundException(productId));
    }
}
