package com.hhplus.storefront.integration;

import com.hhplus.storefront.application.checkout.CheckoutCoordinator;
import com.hhplus.storefront.application.checkout.dto.CheckoutResult;
import com.hhplus.storefront.application.order.OrderLedger;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.domain.checkout.CheckoutInProgressException;
import com.hhplus.storefront.domain.inventory.InsufficientStockException;
import com.hhplus.storefront.domain.inventory.ProductStock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * MySQLCheckoutIntegrationTest - 실제 MySQL 8.0 에서의 체크아웃 검증
 *
 * - Docker 가 없으면 건너뛴다
 * - SELECT ... FOR UPDATE 락 동작을 H2 가 아닌 InnoDB 에서 확인
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("MySQL 체크아웃 통합 테스트")
class MySQLCheckoutIntegrationTest extends BaseIntegrationTest {

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("storefront_test")
            .withUsername("testuser")
            .withPassword("testpass");

    @DynamicPropertySource
    static void mysqlProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "com.mysql.cj.jdbc.Driver");
    }

    @Autowired
    private CheckoutCoordinator checkoutCoordinator;

    @Autowired
    private OrderLedger orderLedger;

    @Test
    @DisplayName("결제 승인 흐름 - 주문 생성, 재고 차감")
    void testCheckout_Approved() {
        String owner = newOwner();
        Long productA = createProduct("MySQL상품A", 1000L, 10);
        Long productB = createProduct("MySQL상품B", 500L, 10);
        cartService.addItem(owner, productA, 2, null, false);
        cartService.addItem(owner, productB, 1, null, false);

        CheckoutResult result = checkoutCoordinator.checkout(owner, "mysql-" + owner, card("tok_ok"));

        assertThat(result.getOrder().getTotalAmount()).isEqualTo(2500L);
        assertThat(inventoryLedger.getStock(productA).getAvailableQuantity()).isEqualTo(8);
        assertThat(inventoryLedger.getStock(productB).getAvailableQuantity()).isEqualTo(9);
    }

    @Test
    @DisplayName("재고 5개에 3개씩 동시 체크아웃 - 1건만 성공")
    void testConcurrentCheckout_OnlyOneWins() throws InterruptedException {
        // Given
        Long productId = createProduct("MySQL한정상품", 1000L, 5);
        List<String> owners = List.of(newOwner(), newOwner());
        for (String owner : owners) {
            cartService.addItem(owner, productId, 3, null, false);
        }
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(owners.size());
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger insufficientCount = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(owners.size());

        // When
        for (String owner : owners) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    checkoutCoordinator.checkout(owner, "mysql-limited-" + owner, card("tok_ok"));
                    successCount.incrementAndGet();
                } catch (InsufficientStockException e) {
                    insufficientCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertThat(endLatch.await(60, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // Then
        ProductStock stock = inventoryLedger.getStock(productId);
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(insufficientCount.get()).isEqualTo(1);
        assertThat(stock.getAvailableQuantity()).isEqualTo(2);
        assertThat(stock.getReservedQuantity()).isZero();
    }

    @Test
    @DisplayName("새 소유자의 첫 상품 추가 - InnoDB 갭 락에 막히지 않고 즉시 장바구니 생성")
    void testAddItem_NewOwner_DoesNotBlockOnGapLock() {
        Long productId = createProduct("MySQL첫담기상품", 700L, 10);
        String owner = newOwner();

        CartSnapshot cart = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> cartService.addItem(owner, productId, 2, 0L, false));

        assertThat(cart.getVersion()).isEqualTo(1L);
        assertThat(cart.getLines()).hasSize(1);
        assertThat(cartService.updateQuantity(owner, productId, 3, 1L).getVersion()).isEqualTo(2L);
    }

    @Test
    @DisplayName("같은 새 키로 동시 체크아웃 - 주문 1건, 나머지는 재생 또는 진행 중(409), 락 오류 없음")
    void testConcurrentCheckout_SameNewKey() throws InterruptedException {
        // Given
        Long productId = createProduct("MySQL동일키상품", 1000L, 10);
        String owner = newOwner();
        String key = "mysql-same-key-" + owner;
        cartService.addItem(owner, productId, 1, null, false);
        int threads = 5;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(threads);
        AtomicInteger completed = new AtomicInteger(0);
        AtomicInteger inProgress = new AtomicInteger(0);
        AtomicInteger unexpected = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        // When
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    checkoutCoordinator.checkout(owner, key, card("tok_ok"));
                    completed.incrementAndGet();
                } catch (CheckoutInProgressException e) {
                    inProgress.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    unexpected.incrementAndGet();
                } finally {
                    endLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertThat(endLatch.await(60, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // Then
        assertThat(unexpected.get()).isZero();
        assertThat(completed.get() + inProgress.get()).isEqualTo(threads);
        assertThat(orderLedger.listForOwner(owner)).hasSize(1);
        assertThat(inventoryLedger.getStock(productId).getAvailableQuantity()).isEqualTo(9);
    }
}
