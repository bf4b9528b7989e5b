package com.hhplus.storefront.infrastructure.sample;

import com.hhplus.storefront.application.inventory.InventoryLedger;
import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 로컬 실행용 샘플 상품/재고 적재
 * 상품이 하나라도 있으면 아무것도 하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "storefront.sample-data.enabled", havingValue = "true")
public class SampleDataLoader implements CommandLineRunner {

    private final ProductRepository productRepository;
    private final InventoryLedger inventoryLedger;
    private final Clock clock;

    @Override
    public void run(String... args) {
        if (productRepository.count() > 0) {
            log.info("[SampleDataLoader] 상품이 이미 존재하여 샘플 적재를 건너뜀");
            return;
        }

        // 상품명 → {가격, 초기 재고}
        Map<String, long[]> samples = new LinkedHashMap<>();
        samples.put("기본 티셔츠", new long[]{15000L, 100L});
        samples.put("데님 팬츠", new long[]{49000L, 50L});
        samples.put("캔버스 스니커즈", new long[]{69000L, 30L});
        samples.put("울 머플러", new long[]{29000L, 5L});

        LocalDateTime now = LocalDateTime.now(clock);
        samples.forEach((name, values) -> {
            Product product = productRepository.save(Product.create(name, values[0], now));
            inventoryLedger.restock(product.getProductId(), (int) values[1]);
        });
        log.info("[SampleDataLoader] 샘플 상품 {}건 적재 완료", samples.size());
    }
}
