package com.ryuqq.statehub.core.change;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Writes a {@link Set} as a JSON array whose elements are sorted by their own encoding.
 *
 * <p>Hash-based sets iterate in bucket order, which can change when an element is removed and
 * added back. Sorting by encoded element makes equal sets always encode identically.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
final class CanonicalSetSerializer extends StdSerializer<Set<?>> {

    CanonicalSetSerializer() {
        super(Set.class, false);
    }

    @Override
    public void serialize(Set<?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        ObjectMapper mapper = mapperOf(gen);
        List<String> elements = new ArrayList<>(value.size());
        for (Object element : value) {
            elements.add(mapper.writeValueAsString(element));
        }
        Collections.sort(elements);

        gen.writeStartArray(value, elements.size());
        for (String element : elements) {
            gen.writeRawValue(element);
        }
        gen.writeEndArray();
    }

    @Override
    public boolean isEmpty(SerializerProvider provider, Set<?> value) {
        return value.isEmpty();
    }

    private static ObjectMapper mapperOf(JsonGenerator gen) throws JsonMappingException {
        ObjectCodec codec = gen.getCodec();
        if (codec instanceof ObjectMapper mapper) {
            return mapper;
        }
        throw JsonMappingException.from(gen, "Canonical set encoding requires an ObjectMapper codec");
    }
}
