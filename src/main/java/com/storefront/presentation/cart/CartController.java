package com.storefront.presentation.cart;

import com.storefront.application.cart.CartService;
import com.storefront.application.cart.dto.AddCartLineCommand;
import com.storefront.application.cart.dto.CartLineInfo;
import com.storefront.infrastructure.security.AuthenticatedUser;
import com.storefront.presentation.cart.request.AddCartLineRequest;
import com.storefront.presentation.cart.response.AddCartLineResponse;
import com.storefront.presentation.cart.response.CartLineResponse;
import com.storefront.presentation.common.auth.LoginUser;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리 (로그인 사용자 본인의 장바구니)
 */
@RestController
@RequestMapping("/cart")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    /**
     * GET /cart - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<List<CartLineResponse>> getCart(@LoginUser AuthenticatedUser user) {
        List<CartLineResponse> lines = cartService.getCart(user.getUserId()).stream()
                .map(CartLineResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(lines);
    }

    /**
     * POST /cart - 장바구니 담기
     */
    @PostMapping
    public ResponseEntity<AddCartLineResponse> addLine(
            @LoginUser AuthenticatedUser user,
            @RequestBody AddCartLineRequest request) {
        CartLineInfo added = cartService.addLine(user.getUserId(), AddCartLineCommand.builder()
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new AddCartLineResponse("Item added to cart successfully!", CartLineResponse.from(added)));
    }
}
