package com.storefront.application.cart;

import com.storefront.application.cart.dto.AddCartLineCommand;
import com.storefront.application.cart.dto.CartLineInfo;
import com.storefront.common.exception.DomainException;
import com.storefront.domain.cart.CartLine;
import com.storefront.domain.cart.CartRepository;
import com.storefront.domain.cart.InvalidQuantityException;
import com.storefront.domain.product.Product;
import com.storefront.domain.product.ProductNotFoundException;
import com.storefront.domain.product.ProductRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    @Mock
    private CartRepository cartRepository;

    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private CartService cartService;

    private static final Long USER_ID = 1L;

    private static Product mug() {
        return Product.builder()
                .productId(7L)
                .name("Mug")
                .price(new BigDecimal("25.50"))
                .stock(100)
                .imageUrl("mug.png")
                .createdAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("담기 - 현재 가격을 단가 스냅샷으로 저장")
    void addLine_snapshotsPrice() {
        // Given
        when(productRepository.findById(7L)).thenReturn(Optional.of(mug()));
        when(cartRepository.save(any(CartLine.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        CartLineInfo result = cartService.addLine(USER_ID, new AddCartLineCommand(7L, 2));

        // Then
        ArgumentCaptor<CartLine> captor = ArgumentCaptor.forClass(CartLine.class);
        verify(cartRepository).save(captor.capture());
        CartLine saved = captor.getValue();
        assertThat(saved.getUserId()).isEqualTo(USER_ID);
        assertThat(saved.getUnitPrice()).isEqualByComparingTo("25.50");
        assertThat(saved.isInCart()).isTrue();
        assertThat(result.getProductName()).isEqualTo("Mug");
        assertThat(result.getQuantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("담기 - 없는 상품이면 ProductNotFoundException")
    void addLine_productNotFound() {
        when(productRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cartService.addLine(USER_ID, new AddCartLineCommand(99L, 1)))
                .isInstanceOf(ProductNotFoundException.class);
        verify(cartRepository, never()).save(any());
    }

    @Test
    @DisplayName("담기 - 필수값 누락이면 400")
    void addLine_missingFields() {
        assertThatThrownBy(() -> cartService.addLine(USER_ID, new AddCartLineCommand(null, 1)))
                .isInstanceOf(DomainException.class);
        assertThatThrownBy(() -> cartService.addLine(USER_ID, new AddCartLineCommand(7L, null)))
                .isInstanceOf(DomainException.class);
        verifyNoInteractions(productRepository, cartRepository);
    }

    @Test
    @DisplayName("담기 - 수량 범위(1~1000) 위반")
    void addLine_quantityOutOfRange() {
        when(productRepository.findById(7L)).thenReturn(Optional.of(mug()));

        assertThatThrownBy(() -> cartService.addLine(USER_ID, new AddCartLineCommand(7L, 0)))
                .isInstanceOf(InvalidQuantityException.class);
        assertThatThrownBy(() -> cartService.addLine(USER_ID, new AddCartLineCommand(7L, 1001)))
                .isInstanceOf(InvalidQuantityException.class);
        verify(cartRepository, never()).save(any());
    }

    @Test
    @DisplayName("조회 - 라인 순서 유지, 상품명/이미지 결합")
    void getCart_joinsProductInfo() {
        CartLine line = CartLine.builder()
                .cartLineId(5L)
                .userId(USER_ID)
                .productId(7L)
                .quantity(2)
                .unitPrice(new BigDecimal("20.00"))
                .build();
        when(cartRepository.findUnassignedByUserId(USER_ID)).thenReturn(List.of(line));
        when(productRepository.findAllByIds(any())).thenReturn(List.of(mug()));

        List<CartLineInfo> result = cartService.getCart(USER_ID);

        assertThat(result).singleElement().satisfies(info -> {
            assertThat(info.getCartLineId()).isEqualTo(5L);
            assertThat(info.getPrice()).isEqualByComparingTo("20.00");
            assertThat(info.getProductName()).isEqualTo("Mug");
            assertThat(info.getImageUrl()).isEqualTo("mug.png");
        });
    }

    @Test
    @DisplayName("조회 - 빈 장바구니")
    void getCart_empty() {
        when(cartRepository.findUnassignedByUserId(USER_ID)).thenReturn(Collections.emptyList());

        assertThat(cartService.getCart(USER_ID)).isEmpty();
        verifyNoInteractions(productRepository);
    }
}
