package com.pharmacy.ecommerce.domain.catalog;

import com.pharmacy.ecommerce.common.exception.DomainException;
import com.pharmacy.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 카탈로그에 상품이 없거나 판매 중지(inactive)일 때 발생하는 예외 (404)
 */
@Getter
public class ProductNotFoundException extends DomainException {

    private final String productId;

    public ProductNotFoundException(String productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
        this.productId = productId;
    }
}
