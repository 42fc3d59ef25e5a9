package com.ryuqq.statehub.testkit.fixture;

import java.util.Objects;

/**
 * Nested value object.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class Contact {

    private String email = "";
    private String phone = "";

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Contact)) {
            return false;
        }
        Contact other = (Contact) o;
        return Objects.equals(email, other.email) && Objects.equals(phone, other.phone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(email, phone);
    }
}
