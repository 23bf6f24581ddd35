package com.storefront.presentation.order;

import com.storefront.application.order.CheckoutService;
import com.storefront.application.order.OrderQueryService;
import com.storefront.application.order.dto.CheckoutResult;
import com.storefront.infrastructure.security.AuthenticatedUser;
import com.storefront.presentation.common.auth.LoginUser;
import com.storefront.presentation.order.response.CheckoutResponse;
import com.storefront.presentation.order.response.OrderResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderController - Presentation 계층
 * 결제 및 주문 내역 조회
 */
@RestController
public class OrderController {

    private final CheckoutService checkoutService;
    private final OrderQueryService orderQueryService;

    public OrderController(CheckoutService checkoutService, OrderQueryService orderQueryService) {
        this.checkoutService = checkoutService;
        this.orderQueryService = orderQueryService;
    }

    /**
     * POST /checkout - 장바구니 전체 결제
     *
     * 성공 시 장바구니의 모든 라인이 새 주문에 묶이고 재고가 차감된다.
     * 실패 시 아무것도 반영되지 않는다.
     */
    @PostMapping("/checkout")
    public ResponseEntity<CheckoutResponse> checkout(@LoginUser AuthenticatedUser user) {
        CheckoutResult result = checkoutService.checkout(user.getUserId());
        return ResponseEntity.ok(new CheckoutResponse("Checkout successful!", result.getOrderId(), result.getTotalAmount()));
    }

    /**
     * GET /orders - 주문 내역 조회 (최신순)
     */
    @GetMapping("/orders")
    public ResponseEntity<List<OrderResponse>> getOrders(@LoginUser AuthenticatedUser user) {
        List<OrderResponse> orders = orderQueryService.listForUser(user.getUserId()).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(orders);
    }
}
