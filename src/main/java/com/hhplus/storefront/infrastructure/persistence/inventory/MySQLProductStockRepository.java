package com.hhplus.storefront.infrastructure.persistence.inventory;

import com.hhplus.storefront.domain.inventory.ProductStock;
import com.hhplus.storefront.domain.inventory.ProductStockRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 ProductStock Repository 구현
 */
@Repository
@Primary
public class MySQLProductStockRepository implements ProductStockRepository {

    private final ProductStockJpaRepository productStockJpaRepository;

    public MySQLProductStockRepository(ProductStockJpaRepository productStockJpaRepository) {
        this.productStockJpaRepository = productStockJpaRepository;
    }

    @Override
    public Optional<ProductStock> findByProductId(Long productId) {
        return productStockJpaRepository.findById(productId);
    }

    @Override
    public Optional<ProductStock> findByProductIdForUpdate(Long productId) {
        return productStockJpaRepository.findByIdForUpdate(productId);
    }

    @Override
    public ProductStock save(ProductStock stock) {
        return productStockJpaRepository.save(stock);
    }
}
