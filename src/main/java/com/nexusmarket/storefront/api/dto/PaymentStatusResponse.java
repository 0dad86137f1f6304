package com.nexusmarket.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexusmarket.storefront.service.ConfirmationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for payment status polling.
 *
 * @author Storefront Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentStatusResponse {

    private String status;
    private String paymentStatus;
    private String orderId;

    public static PaymentStatusResponse from(ConfirmationResult result) {
        return new PaymentStatusResponse(result.getStatus(), result.getPaymentStatus(), result.getOrderId());
    }
}
