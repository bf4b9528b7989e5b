package com.hhplus.storefront.domain.catalog;

import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 */
public interface ProductRepository {

    Optional<Product> findById(Long productId);

    Product save(Product product);

    long count();
}
