package com.pharmacy.ecommerce.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 주문 모듈 설정 (pharmacy.order.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pharmacy.order")
public class OrderProperties {

    /**
     * 주문 저장소 구현: jpa | memory
     */
    private Storage storage = Storage.JPA;

    /**
     * 빈 장바구니 합계 등에 쓰이는 기본 통화 (ISO-4217)
     */
    private String defaultCurrency = "INR";

    public enum Storage {
        JPA,
        MEMORY
    }
}
