package com.ryuqq.statehub.core.change;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-type cache of readable top-level properties.
 *
 * <p><strong>Enumeration rules:</strong></p>
 * <ul>
 *   <li>Records: record components, in component order</li>
 *   <li>Classes: declared instance fields walking from the top superclass down, each exposed
 *       through a public {@code getX()}/{@code isX()} accessor or, failing that, only when the
 *       field itself is public</li>
 *   <li>Getter-only (computed) properties follow, sorted by name</li>
 * </ul>
 *
 * <p>The list for a type is built once and reused for every snapshot and diff.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public final class StateProperties {

    private static final ClassValue<List<StateProperty>> CACHE = new ClassValue<>() {
        @Override
        protected List<StateProperty> computeValue(Class<?> type) {
            return introspect(type);
        }
    };

    private StateProperties() {
    }

    /**
     * Returns the readable top-level properties of a state type.
     *
     * @param type the state type
     * @return immutable, ordered property list (may be empty)
     * @throws IllegalArgumentException if type is null
     */
    public static List<StateProperty> of(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return CACHE.get(type);
    }

    private static List<StateProperty> introspect(Class<?> type) {
        Map<String, StateProperty> properties = new LinkedHashMap<>();

        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                properties.put(component.getName(), StateProperty.ofAccessor(component.getName(), component.getAccessor()));
            }
            return List.copyOf(properties.values());
        }

        for (Class<?> declaring : hierarchyOf(type)) {
            for (Field field : declaring.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                    continue;
                }
                String name = field.getName();
                if (properties.containsKey(name)) {
                    continue;
                }
                Method accessor = findAccessor(type, name, field.getType());
                if (accessor != null) {
                    properties.put(name, StateProperty.ofAccessor(name, accessor));
                } else if (Modifier.isPublic(field.getModifiers())) {
                    properties.put(name, StateProperty.ofField(field));
                }
            }
        }

        List<Method> computed = new ArrayList<>();
        for (Method method : type.getMethods()) {
            if (isGetter(method) && !properties.containsKey(propertyNameOf(method))) {
                computed.add(method);
            }
        }
        computed.sort(Comparator.comparing(StateProperties::propertyNameOf));
        for (Method method : computed) {
            properties.putIfAbsent(propertyNameOf(method), StateProperty.ofAccessor(propertyNameOf(method), method));
        }

        return List.copyOf(properties.values());
    }

    private static Deque<Class<?>> hierarchyOf(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.addFirst(current);
        }
        return hierarchy;
    }

    private static Method findAccessor(Class<?> type, String fieldName, Class<?> fieldType) {
        String suffix = capitalize(fieldName);
        List<String> candidates = fieldType == boolean.class
            ? List.of("is" + suffix, "get" + suffix)
            : List.of("get" + suffix);

        for (String candidate : candidates) {
            for (Method method : type.getMethods()) {
                if (method.getName().equals(candidate) && isGetter(method)) {
                    return method;
                }
            }
        }
        return null;
    }

    private static boolean isGetter(Method method) {
        if (Modifier.isStatic(method.getModifiers())
                || method.getParameterCount() != 0
                || method.getReturnType() == void.class
                || method.getDeclaringClass() == Object.class
                || method.isBridge()
                || method.isSynthetic()) {
            return false;
        }
        String name = method.getName();
        if (name.startsWith("get") && name.length() > 3) {
            return true;
        }
        return name.startsWith("is") && name.length() > 2 && method.getReturnType() == boolean.class;
    }

    private static String propertyNameOf(Method getter) {
        String name = getter.getName();
        String stripped = name.startsWith("get") ? name.substring(3) : name.substring(2);
        return decapitalize(stripped);
    }

    private static String capitalize(String name) {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    // JavaBeans rule: "URL" stays "URL", "Name" becomes "name"
    private static String decapitalize(String name) {
        if (name.length() > 1 && Character.isUpperCase(name.charAt(0)) && Character.isUpperCase(name.charAt(1))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
