package com.hhplus.storefront.integration;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.inventory.InventoryLedger;
import com.hhplus.storefront.domain.catalog.Product;
import com.hhplus.storefront.domain.catalog.ProductRepository;
import com.hhplus.storefront.domain.payment.PaymentDetails;
import com.hhplus.storefront.infrastructure.payment.SimulatedPaymentGateway;
import com.hhplus.storefront.support.MutableClock;
import com.hhplus.storefront.support.TestClockConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 기본 통합 테스트 - H2 (MySQL 모드) 기반
 *
 * 특징:
 * - 스케줄러/샘플 데이터 비활성화 (application-test.yml)
 * - MutableClock 으로 타임아웃/예약 만료를 재현
 * - 컨텍스트를 공유하므로 테스트마다 새 상품과 새 소유자 ID 를 만들어 격리한다
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class BaseIntegrationTest {

    @Autowired
    protected ProductRepository productRepository;

    @Autowired
    protected InventoryLedger inventoryLedger;

    @Autowired
    protected CartService cartService;

    @Autowired
    protected SimulatedPaymentGateway paymentGateway;

    @Autowired
    protected MutableClock clock;

    /**
     * 판매 중인 상품과 초기 재고 생성
     */
    protected Long createProduct(String name, long price, int stock) {
        Product product = productRepository.save(Product.create(name, price, LocalDateTime.now(clock)));
        inventoryLedger.restock(product.getProductId(), stock);
        return product.getProductId();
    }

    protected String newOwner() {
        return "user-" + UUID.randomUUID().toString().substring(0, 8);
    }

    protected PaymentDetails card(String token) {
        return PaymentDetails.builder().method("CARD").token(token).build();
    }
}
