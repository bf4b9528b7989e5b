package com.hhplus.storefront.domain.payment;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentResult {
    private final PaymentOutcome outcome;
    private final String reference;
    private final String message;

    public static PaymentResult approved(String reference) {
        return new PaymentResult(PaymentOutcome.APPROVED, reference, "승인");
    }

    public static PaymentResult declined(String reference, String message) {
        return new PaymentResult(PaymentOutcome.DECLINED, reference, message);
    }

    public static PaymentResult error(String message) {
        return new PaymentResult(PaymentOutcome.ERROR, null, message);
    }

    public boolean isApproved() {
        return outcome == PaymentOutcome.APPROVED;
    }
}
