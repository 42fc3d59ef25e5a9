package com.ryuqq.statehub.core.change;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Type;

/**
 * Readable top-level property of a state type.
 *
 * <p>Backed either by a public no-arg accessor (record component accessor, {@code getX()},
 * {@code isX()}) or by a public instance field. Instances are created once per state type by
 * {@link StateProperties} and shared by every detector.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public final class StateProperty {

    private final String name;
    private final Type genericType;
    private final Class<?> rawType;
    private final Member member;

    private StateProperty(String name, Type genericType, Class<?> rawType, Member member) {
        this.name = name;
        this.genericType = genericType;
        this.rawType = rawType;
        this.member = member;
    }

    static StateProperty ofAccessor(String name, Method accessor) {
        accessor.trySetAccessible();
        return new StateProperty(name, accessor.getGenericReturnType(), accessor.getReturnType(), accessor);
    }

    static StateProperty ofField(Field field) {
        field.trySetAccessible();
        return new StateProperty(field.getName(), field.getGenericType(), field.getType(), field);
    }

    /**
     * Returns the property name as reported in {@link com.ryuqq.statehub.core.model.PropertyChange}.
     *
     * @return property name
     */
    public String name() {
        return name;
    }

    /**
     * Returns the declared generic type, used to reconstruct old values.
     *
     * @return declared type, including type arguments
     */
    public Type genericType() {
        return genericType;
    }

    /**
     * Returns the declared raw type.
     *
     * @return declared class
     */
    public Class<?> rawType() {
        return rawType;
    }

    /**
     * Reads the property from a state instance.
     *
     * @param target the state instance
     * @return the current value (may be null)
     * @throws IllegalStateException if the accessor cannot be invoked
     * @throws RuntimeException if the accessor itself throws an unchecked exception
     */
    public Object read(Object target) {
        try {
            if (member instanceof Method method) {
                return method.invoke(target);
            }
            return ((Field) member).get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read property '" + name + "' of " + target.getClass().getName(), e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Accessor for property '" + name + "' failed", cause);
        }
    }

    @Override
    public String toString() {
        return "StateProperty{" + name + ": " + genericType.getTypeName() + '}';
    }
}
