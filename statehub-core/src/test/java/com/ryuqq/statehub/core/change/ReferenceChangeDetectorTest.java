package com.ryuqq.statehub.core.change;

import com.ryuqq.statehub.core.model.PropertyChange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ReferenceChangeDetector 테스트.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
class ReferenceChangeDetectorTest {

    private final ReferenceChangeDetector detector = new ReferenceChangeDetector();

    @Test
    void diff_ValueReplaced_ReportsOldAndNewReferences() {
        // Given
        Cart cart = new Cart();
        List<String> original = cart.getItems();
        Snapshot before = detector.snapshot(Cart.class, cart);

        // When
        List<String> replacement = new ArrayList<>(List.of("apple"));
        cart.setItems(replacement);
        List<PropertyChange> changes = detector.diff(Cart.class, before, cart);

        // Then
        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).oldValue()).isSameAs(original);
        assertThat(changes.get(0).newValue()).isSameAs(replacement);
    }

    @Test
    void diff_InPlaceCollectionEdit_IsNotDetected() {
        // Given
        Cart cart = new Cart();
        Snapshot before = detector.snapshot(Cart.class, cart);

        // When
        cart.getItems().add("apple");

        // Then
        assertThat(detector.diff(Cart.class, before, cart)).isEmpty();
    }

    @Test
    void diff_EqualButDistinctValue_IsNotAChange() {
        // Given
        Cart cart = new Cart();
        cart.setOwner(new String("kim"));
        Snapshot before = detector.snapshot(Cart.class, cart);

        // When
        cart.setOwner(new String("kim"));

        // Then
        assertThat(detector.diff(Cart.class, before, cart)).isEmpty();
    }

    @Test
    void strategy_IsReference() {
        assertThat(detector.strategy()).isEqualTo(ComparisonStrategy.REFERENCE);
        assertThat(detector.snapshot(Cart.class, new Cart()).strategy()).isEqualTo(ComparisonStrategy.REFERENCE);
    }

    static class Cart {
        private String owner;
        private List<String> items = new ArrayList<>();

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public List<String> getItems() {
            return items;
        }

        public void setItems(List<String> items) {
            this.items = items;
        }
    }
}
