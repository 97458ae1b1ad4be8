package com.opensensor.querycache.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.util.ClassUtils;

/**
 * JSON implementation of {@link CacheSerializer} backed by Jackson.
 *
 * <p><strong>Type fidelity:</strong> the default mapper enables Jackson default typing for every
 * position declared as {@code Object}, the root value included. Result documents are
 * {@code List<Map<String, Object>>}, so each document value carries its concrete class and comes
 * back as the same Java type it was written as: a {@code Long} stays a {@code Long}, a
 * {@link java.util.Date} stays a {@code Date}, and a string that looks like a timestamp stays a
 * string. JSON-native scalars ({@code String}, {@code Integer}, {@code Double}, {@code Boolean})
 * are written without a type id. Timestamps are written as ISO-8601 strings.</p>
 *
 * <p>Values are always read back as their stored type, which must be an instance of the raw type
 * requested; anything else raises {@link SerializationException}. A custom {@link ObjectMapper}
 * passed to {@link #JacksonCacheSerializer(ObjectMapper)} needs the same default typing, for
 * example by starting from {@link #defaultObjectMapper()}.</p>
 *
 * @since 1.0.0
 * @see CacheSerializer
 */
public class JacksonCacheSerializer implements CacheSerializer {

    private final ObjectWriter writer;
    private final ObjectReader reader;

    /** Creates a serializer over {@link #defaultObjectMapper()}. */
    public JacksonCacheSerializer() {
        this(defaultObjectMapper());
    }

    /**
     * @param objectMapper the mapper used for all reads and writes; must be thread-safe and have
     *     default typing enabled for {@code Object} positions
     */
    public JacksonCacheSerializer(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerFor(Object.class);
        this.reader = objectMapper.readerFor(Object.class);
    }

    /**
     * Mapper with JDK 8 and {@code java.time} support, ISO-8601 dates and default typing for
     * {@code Object} positions. Type ids are accepted only for JDK value and collection types and
     * for this library's own types.
     *
     * @return a new, fully configured mapper
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new Jdk8Module())
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .activateDefaultTyping(typeValidator(), ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT)
                .build();
    }

    private static PolymorphicTypeValidator typeValidator() {
        return BasicPolymorphicTypeValidator.builder()
                .allowIfSubType("java.lang.")
                .allowIfSubType("java.math.")
                .allowIfSubType("java.time.")
                .allowIfSubType("java.util.")
                .allowIfSubType("com.opensensor.querycache.")
                .build();
    }

    /**
     * @throws SerializationException if Jackson cannot write the value
     */
    @Override
    public byte[] serialize(Object value) {
        try {
            return writer.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize object to JSON", e);
        }
    }

    /**
     * @throws SerializationException if the bytes are not valid JSON, name a type that is not
     *     allowed, or hold a value that is not an instance of the requested type
     */
    @Override
    public <T> T deserialize(byte[] data, ParameterizedTypeReference<T> typeRef) {
        if (data == null || data.length == 0) {
            return null;
        }
        JavaType javaType = TypeFactory.defaultInstance().constructType(typeRef.getType());
        Object value;
        try {
            value = reader.readValue(data);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize JSON to " + typeRef.getType(), e);
        }
        Class<?> expected = ClassUtils.resolvePrimitiveIfNecessary(javaType.getRawClass());
        if (value != null && !expected.isInstance(value)) {
            throw new SerializationException(
                    "Cached value of type " + value.getClass().getName() + " is not a " + typeRef.getType());
        }
        @SuppressWarnings("unchecked")
        T typed = (T) value;
        return typed;
    }
}
