package com.storefront.application.order;

import com.storefront.application.order.dto.CheckoutResult;
import com.storefront.domain.cart.CartLine;
import com.storefront.domain.cart.CartRepository;
import com.storefront.domain.cart.EmptyCartException;
import com.storefront.domain.order.Order;
import com.storefront.domain.order.OrderRepository;
import com.storefront.domain.product.InsufficientStockException;
import com.storefront.domain.product.Product;
import com.storefront.domain.product.ProductNotFoundException;
import com.storefront.domain.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CheckoutTransactionService - 결제 트랜잭션 처리 서비스 (Application 계층)
 *
 * 역할:
 * - 사용자의 장바구니 라인 전체를 하나의 주문으로 바꾸는 원자적 단계만 담당
 * - CheckoutService와 분리되어 있어 @Transactional / @Retryable 프록시가 정상 적용된다
 *
 * 처리 순서 (하나의 트랜잭션):
 * 1. 장바구니 라인 잠금 조회 (SELECT ... FOR UPDATE, 라인 ID 오름차순)
 * 2. 관련 상품 잠금 조회 (상품 ID 오름차순으로 락 획득)
 * 3. 라인 순서대로 남은 재고 확인 (같은 상품의 앞선 라인 수량을 먼저 뺀다)
 * 4. 스냅샷 단가 × 수량 합계로 총액 계산
 * 5. 주문 저장 → 라인 바인딩 → 조건부 재고 차감
 *
 * 어느 단계에서든 예외가 나면 모든 변경사항이 롤백되고 장바구니는 그대로 남는다.
 *
 * 동시성 제어:
 * - 비관적 락(InnoDB 행 락)으로 재고 확인과 차감 사이를 직렬화
 * - 조건부 UPDATE (stock >= amount)가 2차 방어선
 * - 데드락/락 대기 타임아웃은 @Retryable로 최대 3회 재시도 (매 시도마다 새 트랜잭션)
 *   - backoff: delay=50ms, multiplier=2, maxDelay=1000ms, random=true (Jitter)
 */
@Service
public class CheckoutTransactionService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutTransactionService.class);

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;

    public CheckoutTransactionService(CartRepository cartRepository,
                                      ProductRepository productRepository,
                                      OrderRepository orderRepository) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
    }

    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = {PessimisticLockingFailureException.class, CannotAcquireLockException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 1000, random = true)
    )
    public CheckoutResult checkout(Long userId) {
        List<CartLine> lines = cartRepository.findUnassignedByUserIdForUpdate(userId);
        if (lines.isEmpty()) {
            throw new EmptyCartException(userId);
        }

        // 상품 ID 오름차순으로 락 획득 (TreeMap 키 순서)
        Map<Long, Integer> claimedByProduct = new TreeMap<>();
        lines.forEach(line -> claimedByProduct.putIfAbsent(line.getProductId(), 0));

        Map<Long, Product> products = productRepository.findAllByIdsForUpdate(claimedByProduct.keySet())
                .stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        for (CartLine line : lines) {
            Long productId = line.getProductId();
            Product product = products.get(productId);
            if (product == null) {
                throw new ProductNotFoundException(productId);
            }

            int alreadyClaimed = claimedByProduct.get(productId);
            int claimed = alreadyClaimed + line.getQuantity();
            if (!product.hasStockFor(claimed)) {
                log.info("[CheckoutTransactionService] 재고 부족: userId={}, productId={}, requested={}, available={}",
                        userId, productId, line.getQuantity(), product.getStock() - alreadyClaimed);
                throw new InsufficientStockException(productId, line.getQuantity(),
                        product.getStock() - alreadyClaimed);
            }
            claimedByProduct.put(productId, claimed);
        }

        BigDecimal totalAmount = lines.stream()
                .map(CartLine::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.UNNECESSARY);

        Order order = orderRepository.save(Order.createCompletedOrder(userId, totalAmount));

        List<Long> lineIds = lines.stream()
                .map(CartLine::getCartLineId)
                .collect(Collectors.toList());
        int bound = cartRepository.bindToOrder(lineIds, order.getOrderId());
        if (bound != lines.size()) {
            throw new IllegalStateException(
                    "장바구니 라인 바인딩 수 불일치: expected=" + lines.size() + ", actual=" + bound);
        }

        for (Map.Entry<Long, Integer> entry : claimedByProduct.entrySet()) {
            if (!productRepository.decrementStock(entry.getKey(), entry.getValue())) {
                throw new InsufficientStockException(entry.getKey());
            }
        }

        log.info("[CheckoutTransactionService] 결제 완료: userId={}, orderId={}, lines={}, totalAmount={}",
                userId, order.getOrderId(), lines.size(), totalAmount);

        return CheckoutResult.builder()
                .orderId(order.getOrderId())
                .totalAmount(totalAmount)
                .build();
    }
}
