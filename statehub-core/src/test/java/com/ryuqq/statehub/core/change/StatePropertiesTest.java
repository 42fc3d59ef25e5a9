package com.ryuqq.statehub.core.change;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StateProperties 테스트.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
class StatePropertiesTest {

    @Test
    void of_Record_UsesComponentsInOrder() {
        assertThat(names(Point.class)).containsExactly("x", "y");
    }

    @Test
    void of_ClassHierarchy_SuperclassFieldsFirstThenComputedSortedByName() {
        assertThat(names(Derived.class)).containsExactly("id", "count", "label", "alpha", "displayName");
    }

    @Test
    void of_FieldWithoutAccessorOrPublicVisibility_IsExcluded() {
        assertThat(names(Derived.class)).doesNotContain("hidden");
    }

    @Test
    void of_BooleanField_UsesIsAccessor() {
        assertThat(names(Flags.class)).containsExactly("enabled");
    }

    @Test
    void of_StaticMembers_AreExcluded() {
        assertThat(names(WithStatic.class)).containsExactly("value");
    }

    @Test
    void of_UpperCaseAcronymGetter_KeepsAcronym() {
        assertThat(names(Endpoint.class)).containsExactly("URL");
    }

    @Test
    void of_SameType_ReturnsCachedList() {
        assertThat(StateProperties.of(Derived.class)).isSameAs(StateProperties.of(Derived.class));
    }

    @Test
    void of_GenericProperty_KeepsTypeArguments() {
        // When
        StateProperty tags = StateProperties.of(Tagged.class).get(0);

        // Then
        assertThat(tags.rawType()).isEqualTo(Map.class);
        assertThat(tags.genericType().getTypeName()).isEqualTo("java.util.Map<java.lang.String, java.lang.Integer>");
    }

    @Test
    void read_ReturnsCurrentValue() {
        // Given
        Derived derived = new Derived();
        derived.setCount(3);
        derived.label = "L";

        // When & Then
        for (StateProperty property : StateProperties.of(Derived.class)) {
            switch (property.name()) {
                case "count" -> assertThat(property.read(derived)).isEqualTo(3);
                case "label" -> assertThat(property.read(derived)).isEqualTo("L");
                case "displayName" -> assertThat(property.read(derived)).isEqualTo("L#3");
                default -> {
                    // remaining properties are unset
                }
            }
        }
    }

    @Test
    void read_AccessorThrows_PropagatesRuntimeException() {
        // Given
        StateProperty broken = StateProperties.of(Broken.class).get(0);

        // When & Then
        assertThatThrownBy(() -> broken.read(new Broken()))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessage("not readable");
    }

    @Test
    void of_NullType_ThrowsException() {
        assertThatThrownBy(() -> StateProperties.of(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("type cannot be null");
    }

    private static List<String> names(Class<?> type) {
        return StateProperties.of(type).stream().map(StateProperty::name).toList();
    }

    record Point(int x, int y) {
    }

    static class Base {
        private String id;

        public String getId() {
            return id;
        }
    }

    static class Derived extends Base {
        private int count;
        public String label;
        @SuppressWarnings("unused")
        private String hidden;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public String getDisplayName() {
            return label + "#" + count;
        }

        public String getAlpha() {
            return "a";
        }
    }

    static class Flags {
        private boolean enabled;

        public boolean isEnabled() {
            return enabled;
        }
    }

    static class WithStatic {
        static final String CONSTANT = "c";
        private int value;

        public int getValue() {
            return value;
        }

        public static String getShared() {
            return CONSTANT;
        }
    }

    static class Endpoint {
        public String getURL() {
            return "http://localhost";
        }
    }

    static class Tagged {
        private Map<String, Integer> tags;

        public Map<String, Integer> getTags() {
            return tags;
        }
    }

    static class Broken {
        private String secret;

        public String getSecret() {
            throw new UnsupportedOperationException("not readable");
        }
    }
}
