package com.storefront.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 사용 예:
 * - if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > CartConstants.MAX_CART_QUANTITY) throw ...
 */
public class CartConstants {

    /** 장바구니 항목 최소 수량 */
    public static final int MIN_CART_QUANTITY = 1;

    /** 장바구니 항목 최대 수량 */
    public static final int MAX_CART_QUANTITY = 1000;

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
