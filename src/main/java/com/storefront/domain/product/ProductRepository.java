package com.storefront.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 * 상품 데이터 접근 인터페이스
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface ProductRepository {

    /**
     * 모든 상품 조회 (ID 오름차순)
     */
    List<Product> findAll();

    Optional<Product> findById(Long productId);

    /**
     * 여러 상품을 일반 조회 (락 없음)
     */
    List<Product> findAllByIds(Collection<Long> productIds);

    /**
     * 비관적 락을 사용하여 여러 상품 조회
     * SELECT ... FOR UPDATE, ID 오름차순으로 락 획득
     *
     * 용도: 결제 시 재고 확인과 차감 사이의 경쟁 조건 차단
     * - 항상 같은 순서로 락을 잡으므로 겹치는 장바구니 간 교착 상태를 피한다
     * - 트랜잭션 안에서만 호출해야 함
     */
    List<Product> findAllByIdsForUpdate(Collection<Long> productIds);

    Product save(Product product);

    void delete(Product product);

    /**
     * 조건부 재고 차감 (트랜잭션 내부 전용)
     *
     * UPDATE products SET stock = stock - :amount WHERE id = :id AND stock >= :amount
     *
     * @return 차감되었으면 true, 재고가 부족하거나 상품이 없으면 false
     */
    boolean decrementStock(Long productId, int amount);
}
