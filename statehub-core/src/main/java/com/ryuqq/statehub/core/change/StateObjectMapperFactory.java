package com.ryuqq.statehub.core.change;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for the {@link ObjectMapper} used to encode structural snapshots.
 *
 * <p>The encoding has to be canonical: the same logical value must always produce the same
 * JSON. Bean properties, map entries and set elements are therefore written in sorted order.</p>
 *
 * <p>Configured features:</p>
 * <ul>
 *   <li>{@link MapperFeature#SORT_PROPERTIES_ALPHABETICALLY} and
 *       {@link SerializationFeature#ORDER_MAP_ENTRIES_BY_KEYS} for stable output</li>
 *   <li>{@link CanonicalSetSerializer} so hash-ordered sets encode the same for equal content</li>
 *   <li>{@link SerializationFeature#FAIL_ON_EMPTY_BEANS} disabled so marker objects still encode</li>
 *   <li>{@link DeserializationFeature#FAIL_ON_UNKNOWN_PROPERTIES} disabled so computed getters do not
 *       break old-value reconstruction</li>
 *   <li>{@link JavaTimeModule} with ISO-8601 dates</li>
 * </ul>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public final class StateObjectMapperFactory {

    private StateObjectMapperFactory() {
    }

    /**
     * Creates a new mapper configured for canonical snapshots.
     *
     * @return configured mapper
     */
    public static ObjectMapper create() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .addModule(new SimpleModule("canonical-sets").addSerializer(new CanonicalSetSerializer()))
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
