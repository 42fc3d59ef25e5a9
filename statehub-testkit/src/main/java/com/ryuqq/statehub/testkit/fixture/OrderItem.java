package com.ryuqq.statehub.testkit.fixture;

import java.math.BigDecimal;

/**
 * List element of {@link OrderState}.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class OrderItem {

    private String productName = "";
    private int quantity;
    private BigDecimal price = BigDecimal.ZERO;

    public OrderItem() {
    }

    public OrderItem(String productName, int quantity, BigDecimal price) {
        this.productName = productName;
        this.quantity = quantity;
        this.price = price;
    }

    public String getProductName() {
        return productName;
    }

    public void setProductName(String productName) {
        this.productName = productName;
    }

    public int getQuantity() {
        return quantity;
    }

    public void setQuantity(int quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }
}
