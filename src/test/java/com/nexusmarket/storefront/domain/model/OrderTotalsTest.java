package com.nexusmarket.storefront.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for OrderTotals pricing rules.
 */
@DisplayName("OrderTotals Tests")
class OrderTotalsTest {

    @Test
    @DisplayName("Subtotal below free-shipping threshold pays flat shipping")
    void fromSubtotal_BelowThreshold_AddsFlatShipping() {
        OrderTotals totals = OrderTotals.fromSubtotal(new BigDecimal("90.00"));

        assertThat(totals.getSubtotal()).isEqualByComparingTo("90.00");
        assertThat(totals.getTax()).isEqualByComparingTo("9.00");
        assertThat(totals.getShipping()).isEqualByComparingTo("10.00");
        assertThat(totals.getTotal()).isEqualByComparingTo("109.00");
    }

    @Test
    @DisplayName("Subtotal above threshold ships free")
    void fromSubtotal_AboveThreshold_ShipsFree() {
        OrderTotals totals = OrderTotals.fromSubtotal(new BigDecimal("150.00"));

        assertThat(totals.getTax()).isEqualByComparingTo("15.00");
        assertThat(totals.getShipping()).isEqualByComparingTo("0.00");
        assertThat(totals.getTotal()).isEqualByComparingTo("165.00");
    }

    @Test
    @DisplayName("Subtotal of exactly 100.00 ships free")
    void fromSubtotal_AtThreshold_ShipsFree() {
        OrderTotals totals = OrderTotals.fromSubtotal(new BigDecimal("100.00"));

        assertThat(totals.getShipping()).isEqualByComparingTo("0.00");
        assertThat(totals.getTotal()).isEqualByComparingTo("110.00");
    }

    @Test
    @DisplayName("Tax is rounded to cents and total equals the sum of its parts")
    void of_RoundsTaxToCents() {
        List<OrderLine> lines = List.of(
                new OrderLine("prod_a", "Mug", new BigDecimal("12.35"), 3),
                new OrderLine("prod_b", "Coaster", new BigDecimal("4.99"), 1)
        );

        OrderTotals totals = OrderTotals.of(lines);

        // 37.05 + 4.99 = 42.04; tax 4.204 -> 4.20
        assertThat(totals.getSubtotal()).isEqualByComparingTo("42.04");
        assertThat(totals.getTax()).isEqualByComparingTo("4.20");
        assertThat(totals.getShipping()).isEqualByComparingTo("10.00");
        assertThat(totals.getTotal())
                .isEqualByComparingTo(totals.getSubtotal().add(totals.getTax()).add(totals.getShipping()));
        assertThat(totals.getTotal().scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Half-cent tax rounds up")
    void of_HalfCentTax_RoundsUp() {
        // 0.05 -> tax 0.005 -> 0.01; 0.25 -> tax 0.025 -> 0.03
        OrderTotals nickel = OrderTotals.fromSubtotal(new BigDecimal("0.05"));
        OrderTotals quarter = OrderTotals.fromSubtotal(new BigDecimal("0.25"));

        assertThat(nickel.getTax()).isEqualByComparingTo("0.01");
        assertThat(nickel.getTotal()).isEqualByComparingTo("10.06");
        assertThat(quarter.getTax()).isEqualByComparingTo("0.03");
        assertThat(quarter.getTotal()).isEqualByComparingTo("10.28");
    }
}
