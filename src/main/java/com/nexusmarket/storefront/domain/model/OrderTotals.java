package com.nexusmarket.storefront.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * Derived monetary amounts of an order.
 *
 * Pricing rules:
 * - subtotal = sum of unit price x quantity
 * - tax = 10% of subtotal, rounded to cents
 * - shipping = 10.00 below a 100.00 subtotal, free otherwise
 * - total = subtotal + tax + shipping, rounded to cents
 *
 * Rounding is half-up.
 *
 * @author Storefront Team
 */
public final class OrderTotals {

    static final BigDecimal TAX_RATE = new BigDecimal("0.10");
    static final BigDecimal FREE_SHIPPING_THRESHOLD = new BigDecimal("100.00");
    static final BigDecimal FLAT_SHIPPING = new BigDecimal("10.00");

    private final BigDecimal subtotal;
    private final BigDecimal tax;
    private final BigDecimal shipping;
    private final BigDecimal total;

    private OrderTotals(BigDecimal subtotal, BigDecimal tax, BigDecimal shipping, BigDecimal total) {
        this.subtotal = subtotal;
        this.tax = tax;
        this.shipping = shipping;
        this.total = total;
    }

    /**
     * Price a list of order lines.
     *
     * @param lines Order lines with captured unit prices
     * @return Computed totals
     */
    public static OrderTotals of(List<OrderLine> lines) {
        BigDecimal subtotal = lines.stream()
                .map(OrderLine::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return fromSubtotal(subtotal);
    }

    public static OrderTotals fromSubtotal(BigDecimal rawSubtotal) {
        BigDecimal subtotal = round(rawSubtotal);
        BigDecimal tax = round(rawSubtotal.multiply(TAX_RATE));
        BigDecimal shipping = rawSubtotal.compareTo(FREE_SHIPPING_THRESHOLD) < 0
                ? FLAT_SHIPPING
                : BigDecimal.ZERO.setScale(2);
        BigDecimal total = round(rawSubtotal.add(tax).add(shipping));
        return new OrderTotals(subtotal, tax, shipping, total);
    }

    static BigDecimal round(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }

    public BigDecimal getTax() {
        return tax;
    }

    public BigDecimal getShipping() {
        return shipping;
    }

    public BigDecimal getTotal() {
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderTotals)) return false;
        OrderTotals that = (OrderTotals) o;
        return subtotal.equals(that.subtotal) && tax.equals(that.tax)
                && shipping.equals(that.shipping) && total.equals(that.total);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subtotal, tax, shipping, total);
    }

    @Override
    public String toString() {
        return "OrderTotals{subtotal=" + subtotal + ", tax=" + tax
                + ", shipping=" + shipping + ", total=" + total + "}";
    }
}
