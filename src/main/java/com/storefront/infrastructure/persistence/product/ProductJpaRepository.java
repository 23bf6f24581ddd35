package com.storefront.infrastructure.persistence.product;

import com.storefront.domain.product.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

/**
 * Product JPA Repository
 * Spring Data JPA를 통한 Product 엔티티 영구 저장소
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    List<Product> findAllByOrderByProductIdAsc();

    /**
     * 비관적 락(Pessimistic Lock)을 사용하여 여러 상품 조회
     * SELECT ... FOR UPDATE, ID 오름차순
     *
     * 예시:
     * Thread A가 상품 1, 2 락 획득 → 재고 검사 → 차감 → 커밋(해제)
     * Thread B는 상품 1 락에서 대기하다가 A 커밋 후 최신 재고로 검사
     * 결과: 초과 판매 없음
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.productId IN :productIds ORDER BY p.productId ASC")
    List<Product> findAllByIdsForUpdate(@Param("productIds") Collection<Long> productIds);

    /**
     * 조건부 재고 차감
     * 재고가 부족하면 0건 갱신
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.stock = p.stock - :amount " +
           "WHERE p.productId = :productId AND p.stock >= :amount")
    int decrementStock(@Param("productId") Long productId, @Param("amount") int amount);
}
