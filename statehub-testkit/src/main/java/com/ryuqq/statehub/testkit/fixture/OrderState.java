package com.ryuqq.statehub.testkit.fixture;

import java.util.ArrayList;
import java.util.List;

/**
 * State with a list of objects and a three-level nested path
 * (order → customer → shipping address).
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class OrderState {

    private int orderId;
    private List<OrderItem> items = new ArrayList<>();
    private Customer customer = new Customer();

    public int getOrderId() {
        return orderId;
    }

    public void setOrderId(int orderId) {
        this.orderId = orderId;
    }

    public List<OrderItem> getItems() {
        return items;
    }

    public void setItems(List<OrderItem> items) {
        this.items = items;
    }

    public Customer getCustomer() {
        return customer;
    }

    public void setCustomer(Customer customer) {
        this.customer = customer;
    }
}
