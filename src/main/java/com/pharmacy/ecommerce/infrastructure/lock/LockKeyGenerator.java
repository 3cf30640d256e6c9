package com.pharmacy.ecommerce.infrastructure.lock;

/**
 * 락 키 생성 유틸리티
 *
 * 패턴: resource_type:resource_id
 */
public final class LockKeyGenerator {

    /**
     * 사용자 주문/장바구니 명령용 락 키 템플릿
     * 예: addItemToCart(userId="u-1", ...) → "user:orders:u-1"
     */
    public static final String USER_ORDER_KEY_TEMPLATE = "'user:orders:' + #p0";

    private LockKeyGenerator() {
    }

    public static String userOrders(String userId) {
        return "user:orders:" + userId;
    }
}
