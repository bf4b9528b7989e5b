package com.hhplus.storefront.infrastructure.catalog;

import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductAvailability;
import com.hhplus.storefront.domain.catalog.ProductCatalog;
import com.hhplus.storefront.domain.catalog.ProductNotFoundException;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * products 테이블을 읽는 ProductCatalog 어댑터
 */
@Component
@Transactional(readOnly = true)
public class DatabaseProductCatalog implements ProductCatalog {

    private final ProductRepository productRepository;

    public DatabaseProductCatalog(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    @Override
    public long getCurrentPrice(Long productId) {
        return productRepository.findById(productId)
                .map(Product::getPrice)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    @Override
    public ProductAvailability getProduct(Long productId) {
        return productRepository.findById(productId)
                .map(product -> ProductAvailability.of(product.isActive()))
                .orElse(ProductAvailability.missing());
    }
}
