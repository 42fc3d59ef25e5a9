package com.ryuqq.statehub.core.change;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Change detector comparing canonical JSON encodings of each property.
 *
 * <p><strong>Algorithm:</strong></p>
 * <pre>
 * snapshot: property → Encoded(json, runtimeClass)
 * diff:     property → Encoded(json', runtimeClass')
 *           json != json' → PropertyChange(name, decode(json), liveValue)
 * </pre>
 *
 * <p>Because the encoding covers the whole reachable value, appending to a list or editing a
 * nested object's property is reported as one change on the outer property.</p>
 *
 * <p><strong>Failure handling:</strong></p>
 * <ul>
 *   <li>Encoding failure: the property falls back to {@code equals} comparison for this mutation</li>
 *   <li>Decoding failure: retried against the runtime class seen at snapshot time, then reported
 *       with a null old value</li>
 * </ul>
 * Neither aborts the diff; both are logged at WARN.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public final class StructuralChangeDetector extends AbstractChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(StructuralChangeDetector.class);

    private static final String NULL_JSON = "null";

    private final ObjectMapper objectMapper;

    /**
     * Creates a detector with the canonical mapper from {@link StateObjectMapperFactory}.
     */
    public StructuralChangeDetector() {
        this(StateObjectMapperFactory.create());
    }

    /**
     * Creates a detector with a caller-supplied mapper.
     *
     * <p>The mapper must produce a canonical encoding, otherwise unchanged values may be
     * reported as changes.</p>
     *
     * @param objectMapper the mapper used for encoding and decoding
     * @throws IllegalArgumentException if objectMapper is null
     */
    public StructuralChangeDetector(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public ComparisonStrategy strategy() {
        return ComparisonStrategy.STRUCTURAL;
    }

    @Override
    protected Object comparisonKey(StateProperty property, Object value) {
        if (value == null) {
            return new Encoded(NULL_JSON, null);
        }
        try {
            return new Encoded(objectMapper.writeValueAsString(value), value.getClass());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Cannot encode property '{}' ({}), comparing by equals instead: {}",
                property.name(), value.getClass().getName(), e.getMessage());
            return new Unencodable(value);
        }
    }

    @Override
    protected Object restoreOldValue(StateProperty property, Object key) {
        if (key instanceof Unencodable unencodable) {
            return unencodable.value();
        }
        Encoded encoded = (Encoded) key;
        if (encoded == null || NULL_JSON.equals(encoded.json())) {
            return null;
        }

        JavaType declaredType = objectMapper.getTypeFactory().constructType(property.genericType());
        try {
            return objectMapper.readValue(encoded.json(), declaredType);
        } catch (JsonProcessingException | RuntimeException declaredFailure) {
            if (encoded.runtimeType() != null && encoded.runtimeType() != declaredType.getRawClass()) {
                try {
                    return objectMapper.readValue(encoded.json(), encoded.runtimeType());
                } catch (JsonProcessingException | RuntimeException runtimeFailure) {
                    declaredFailure.addSuppressed(runtimeFailure);
                }
            }
            log.warn("Cannot reconstruct old value of property '{}' as {}, reporting null",
                property.name(), declaredType, declaredFailure);
            return null;
        }
    }

    @Override
    protected boolean sameKey(Object before, Object after) {
        if (before instanceof Encoded encodedBefore && after instanceof Encoded encodedAfter) {
            return encodedBefore.json().equals(encodedAfter.json());
        }
        return super.sameKey(before, after);
    }

    /**
     * Canonical encoding plus the runtime class it was written from.
     */
    private record Encoded(String json, Class<?> runtimeType) {
    }

    /**
     * Live value kept for equals comparison when encoding failed.
     */
    private record Unencodable(Object value) {
    }
}
