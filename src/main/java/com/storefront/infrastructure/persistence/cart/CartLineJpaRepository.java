package com.storefront.infrastructure.persistence.cart;

import com.storefront.domain.cart.CartLine;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

/**
 * CartLine JPA Repository
 * order_items 테이블 (장바구니 라인 + 주문 항목)
 */
public interface CartLineJpaRepository extends JpaRepository<CartLine, Long> {

    List<CartLine> findByUserIdAndOrderIdIsNullOrderByCartLineIdAsc(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CartLine c WHERE c.userId = :userId AND c.orderId IS NULL ORDER BY c.cartLineId ASC")
    List<CartLine> findUnassignedByUserIdForUpdate(@Param("userId") Long userId);

    List<CartLine> findByOrderIdInOrderByOrderIdAscCartLineIdAsc(Collection<Long> orderIds);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE CartLine c SET c.orderId = :orderId " +
           "WHERE c.cartLineId IN :cartLineIds AND c.orderId IS NULL")
    int bindToOrder(@Param("cartLineIds") Collection<Long> cartLineIds, @Param("orderId") Long orderId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CartLine c WHERE c.productId = :productId AND c.orderId IS NULL")
    int deleteUnassignedByProductId(@Param("productId") Long productId);
}
