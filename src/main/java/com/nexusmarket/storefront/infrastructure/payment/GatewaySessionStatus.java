package com.nexusmarket.storefront.infrastructure.payment;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Gateway-side view of a checkout session.
 * {@code status} is the session lifecycle (open, complete, expired); {@code paymentStatus} is
 * paid, unpaid or no_payment_required.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class GatewaySessionStatus {

    public static final String PAID = "paid";

    private final String status;
    private final String paymentStatus;

    public boolean isPaid() {
        return PAID.equals(paymentStatus);
    }
}
