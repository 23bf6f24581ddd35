package com.storefront.infrastructure.persistence.product;

import com.storefront.domain.product.Product;
import com.storefront.domain.product.ProductRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(ProductRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public List<Product> findAll() {
        return productJpaRepository.findAllByOrderByProductIdAsc();
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public List<Product> findAllByIds(Collection<Long> productIds) {
        if (productIds.isEmpty()) {
            return List.of();
        }
        return productJpaRepository.findAllById(productIds);
    }

    @Override
    public List<Product> findAllByIdsForUpdate(Collection<Long> productIds) {
        if (productIds.isEmpty()) {
            return List.of();
        }
        return productJpaRepository.findAllByIdsForUpdate(productIds);
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }

    @Override
    public void delete(Product product) {
        productJpaRepository.delete(product);
    }

    @Override
    public boolean decrementStock(Long productId, int amount) {
        return productJpaRepository.decrementStock(productId, amount) == 1;
    }
}
