package com.hhplus.storefront.domain.payment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class PaymentRequest {
    private final String checkoutId;
    private final String ownerId;
    private final long amount;
    private final PaymentDetails paymentDetails;
}
