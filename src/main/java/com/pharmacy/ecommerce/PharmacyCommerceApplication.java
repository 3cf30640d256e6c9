package com.pharmacy.ecommerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Pharmacy E-Commerce 애플리케이션 메인 클래스
 *
 * - @EnableAspectJAutoProxy: 사용자 명령 락 Aspect 프록시 생성
 * - @ConfigurationPropertiesScan: pharmacy.* 설정 바인딩
 */
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@SpringBootApplication
public class PharmacyCommerceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PharmacyCommerceApplication.class, args);
    }
}
