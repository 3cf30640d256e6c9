package com.pharmacy.ecommerce.application.order;

import com.pharmacy.ecommerce.domain.catalog.CatalogProduct;
import com.pharmacy.ecommerce.domain.catalog.ProductCatalog;
import com.pharmacy.ecommerce.domain.order.Order;
import com.pharmacy.ecommerce.domain.order.OrderItem;
import org.springframework.stereotype.Component;

/**
 * 주문 항목 중 처방전이 필요한 상품이 있는지 카탈로그로 판정한다.
 *
 * 체크아웃을 막지 않는 정보성 판정이다. 카탈로그에서 사라진 상품은 처방 불필요로 본다.
 */
@Component
public class PrescriptionRequirementChecker {

    private final ProductCatalog productCatalog;

    public PrescriptionRequirementChecker(ProductCatalog productCatalog) {
        this.productCatalog = productCatalog;
    }

    public boolean requiresPrescription(Order order) {
        for (OrderItem item : order.getItems()) {
            boolean required = productCatalog.findById(item.getProductId())
                    .map(CatalogProduct::isRequiresPrescription)
                    .orElse(false);
            if (required) {
                return true;
            }
        }
        return false;
    }
}
