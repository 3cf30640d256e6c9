package com.pharmacy.ecommerce.infrastructure.catalog;

import com.pharmacy.ecommerce.domain.catalog.CatalogProduct;
import com.pharmacy.ecommerce.domain.catalog.ProductCatalog;
import com.pharmacy.ecommerce.domain.common.vo.Money;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemory 카탈로그 구현
 *
 * 예시 약국 상품으로 초기화된다. 가격은 최소 화폐 단위(paise) 기준.
 * 일부 상품(prod-003, prod-004)은 처방전이 필요하고, prod-099는 판매 중지 상품이다.
 */
@Component
public class InMemoryProductCatalog implements ProductCatalog {

    private final Map<String, CatalogProduct> products = new ConcurrentHashMap<>();

    public InMemoryProductCatalog() {
        initializeData();
    }

    @Override
    public Optional<CatalogProduct> findById(String productId) {
        if (productId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(products.get(productId));
    }

    /**
     * 상품 등록 또는 교체 (가격 변경 등)
     */
    public void save(CatalogProduct product) {
        products.put(product.getId(), product);
    }

    /**
     * 예시 데이터 초기화
     */
    private void initializeData() {
        register("prod-001", "Paracetamol 500mg", 2_500, false, true);
        register("prod-002", "Cetirizine 10mg", 4_500, false, true);
        register("prod-003", "Amoxicillin 500mg", 12_000, true, true);
        register("prod-004", "Omeprazole 20mg", 8_500, true, true);
        register("prod-005", "Chyawanprash 500g", 32_000, false, true);
        register("prod-006", "Ashwagandha Capsules", 28_000, false, true);
        register("prod-007", "Digital Thermometer", 19_900, false, true);
        register("prod-008", "Blood Pressure Monitor", 185_000, false, true);
        register("prod-009", "Vitamin D3 1000 IU", 45_000, false, true);
        register("prod-010", "Omega-3 Fish Oil", 62_000, false, true);
        register("prod-011", "First Aid Kit", 39_900, false, true);
        register("prod-012", "Baby Diapers (Medium)", 79_900, false, true);
        register("prod-013", "Sunscreen SPF 50", 35_000, false, true);
        register("prod-099", "Codeine Cough Syrup (Discontinued)", 15_000, true, false);
    }

    private void register(String id, String name, long price, boolean requiresPrescription, boolean active) {
        save(CatalogProduct.builder()
                .id(id)
                .name(name)
                .price(Money.of(price, Money.DEFAULT_CURRENCY))
                .requiresPrescription(requiresPrescription)
                .active(active)
                .build());
    }
}
