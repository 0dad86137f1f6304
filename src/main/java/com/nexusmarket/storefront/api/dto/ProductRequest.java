package com.nexusmarket.storefront.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexusmarket.storefront.service.ProductDraft;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import jakarta.validation.groups.Default;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for creating or updating a product.
 * All fields are optional on update; name and price are required on create.
 *
 * @author Storefront Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProductRequest {

    /**
     * Validation group for product creation.
     */
    public interface Create extends Default {
    }

    @NotBlank(groups = Create.class, message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    private String description;

    @NotNull(groups = Create.class, message = "Price is required")
    @DecimalMin(value = "0.00", message = "Price must not be negative")
    @Digits(integer = 8, fraction = 2, message = "Price must have at most 2 decimal places")
    private BigDecimal price;

    private String categoryId;

    @Min(value = 0, message = "Stock must not be negative")
    private Integer stock;

    public ProductDraft toDraft() {
        return ProductDraft.builder()
                .name(name)
                .description(description)
                .price(price)
                .categoryId(categoryId)
                .stock(stock)
                .build();
    }
}
