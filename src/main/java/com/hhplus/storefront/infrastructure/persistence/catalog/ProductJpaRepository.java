package com.hhplus.storefront.infrastructure.persistence.catalog;

import com.hhplus.storefront.domain.catalog.Product;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProductJpaRepository extends JpaRepository<Product, Long> {
}
