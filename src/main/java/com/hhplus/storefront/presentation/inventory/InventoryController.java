package com.hhplus.storefront.presentation.inventory;

import com.hhplus.storefront.application.inventory.InventoryLedger;
import com.hhplus.storefront.presentation.inventory.response.InventoryResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * InventoryController - Presentation 계층
 *
 * API:
 * - GET /api/inventory/{product_id}
 *   - 응답: available/reserved 수량 (200 OK)
 *   - 오류: 400 (product_id <= 0), 404 (재고 행 없음)
 */
@RestController
@RequestMapping("/inventory")
public class InventoryController {

    private final InventoryLedger inventoryLedger;

    public InventoryController(InventoryLedger inventoryLedger) {
        this.inventoryLedger = inventoryLedger;
    }

    @GetMapping("/{product_id}")
    public ResponseEntity<InventoryResponse> getProductInventory(
            @PathVariable(name = "product_id") Long productId) {
        if (productId == null || productId <= 0) {
            throw new IllegalArgumentException("product_id 는 양수여야 합니다: " + productId);
        }
        return ResponseEntity.ok(InventoryResponse.from(inventoryLedger.getStock(productId)));
    }
}
