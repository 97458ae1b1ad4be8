package com.opensensor.querycache.serializer;

import org.springframework.core.ParameterizedTypeReference;

/**
 * Converts cached values to and from the bytes held by a backend.
 *
 * <p>Implementations must preserve the semantic shape of query results: ordered sequences of
 * key-value documents, nested mappings, scalars and timestamps. Values read back must be
 * deep-equal to the values written.</p>
 *
 * <p><strong>Thread Safety:</strong> implementations are shared by every request thread and must
 * be thread-safe.</p>
 *
 * @see JacksonCacheSerializer
 * @see SerializationException
 */
public interface CacheSerializer {

    /**
     * Serializes a value into the bytes stored by the backend.
     *
     * @param value the value to serialize
     * @return the serialized form, never null
     * @throws SerializationException if the value cannot be encoded
     */
    byte[] serialize(Object value) throws SerializationException;

    /**
     * Restores a value of the requested type.
     *
     * @param <T> the target type
     * @param data the stored bytes; null or empty data yields null
     * @param typeRef the full generic target type
     * @return the restored value, or null for empty data
     * @throws SerializationException if the bytes cannot be decoded as {@code T}
     */
    <T> T deserialize(byte[] data, ParameterizedTypeReference<T> typeRef) throws SerializationException;
}
