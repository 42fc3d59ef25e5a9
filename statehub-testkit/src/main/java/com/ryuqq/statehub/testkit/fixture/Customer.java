package com.ryuqq.statehub.testkit.fixture;

/**
 * Second level of nesting in {@link OrderState}.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class Customer {

    private String name = "";
    private Address shippingAddress = new Address();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Address getShippingAddress() {
        return shippingAddress;
    }

    public void setShippingAddress(Address shippingAddress) {
        this.shippingAddress = shippingAddress;
    }
}
