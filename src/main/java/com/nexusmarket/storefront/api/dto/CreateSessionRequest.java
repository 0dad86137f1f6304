package com.nexusmarket.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for opening a hosted checkout session. The amount is taken from the order.
 *
 * @author Storefront Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateSessionRequest {

    @NotBlank(message = "Order ID is required")
    private String orderId;

    /**
     * Storefront origin the gateway redirects back to after payment or cancellation.
     */
    @NotBlank(message = "Origin URL is required")
    @Pattern(regexp = "^https?://\\S+$", message = "Origin URL must be an http(s) URL")
    private String originUrl;
}
