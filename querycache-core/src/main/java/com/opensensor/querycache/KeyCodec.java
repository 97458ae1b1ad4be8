package com.opensensor.querycache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.opensensor.querycache.serializer.SerializationException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives cache keys from logical query descriptions.
 *
 * <p>Metadata and chunk keys embed their identifiers verbatim. Pipeline keys are content-addressed:
 * the pipeline is normalized, written to a canonical JSON form and hashed with SHA-256, so two
 * pipelines that differ only in trailing pagination stages share a key while any change to a
 * filter, grouping, device or time range yields a different one.</p>
 *
 * <p><strong>Canonical form:</strong></p>
 * <ul>
 *   <li>map entries and bean properties ordered by name</li>
 *   <li>no indentation or incidental whitespace</li>
 *   <li>{@code java.time} values as ISO-8601 strings</li>
 *   <li>stage order preserved, since it is significant to the pipeline</li>
 * </ul>
 *
 * <p>This class performs no I/O and is safe for concurrent use.</p>
 *
 * @since 1.0.0
 * @see CacheKey
 * @see Tier
 */
public class KeyCodec {

    private static final Set<String> PAGINATION_OPERATORS = Set.of("$skip", "$limit");
    private static final String GLOB_METACHARACTERS = "*?[]\\";

    private final ObjectMapper canonicalMapper;

    public KeyCodec() {
        this.canonicalMapper = JsonMapper.builder()
                .addModule(new Jdk8Module())
                .addModule(new JavaTimeModule())
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    /**
     * Derives the key of one device's resolved metadata.
     *
     * @param deviceId the device identifier, embedded verbatim
     * @return a {@link Tier#DEVICE_METADATA} key whose suffix is {@code deviceId}
     * @throws IllegalArgumentException if {@code deviceId} is null or blank
     */
    public CacheKey deriveMetadataKey(String deviceId) {
        return new CacheKey(Tier.DEVICE_METADATA, requireText(deviceId, "deviceId"));
    }

    /**
     * Derives the content-addressed key of an aggregation pipeline.
     *
     * @param pipeline the ordered pipeline stages
     * @return a {@link Tier#PIPELINE_RESULT} key whose suffix is a 64-character hex digest
     * @throws IllegalArgumentException if the pipeline is null
     * @throws SerializationException if a stage cannot be written as JSON
     */
    public CacheKey derivePipelineKey(List<? extends Map<String, ?>> pipeline) {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline must not be null");
        }
        List<? extends Map<String, ?>> normalized = withoutTrailingPagination(pipeline);
        byte[] canonical;
        try {
            canonical = canonicalMapper.writeValueAsBytes(normalized);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to canonicalize pipeline", e);
        }
        return new CacheKey(Tier.PIPELINE_RESULT, sha256Hex(canonical));
    }

    /**
     * Derives the key of one pre-aggregated chunk, {@code {dataType}:{deviceId}:{timeBucket}:{resolution}}.
     *
     * @param dataType the measurement type, e.g. "temperature"
     * @param deviceId the device identifier
     * @param timeBucket a bucket string from {@link TimeBuckets}
     * @param resolutionMinutes the aggregation resolution in minutes
     * @return a {@link Tier#AGGREGATED_CHUNK} key
     * @throws IllegalArgumentException if a component is blank or contains {@code ':'}, or the
     *     resolution is not positive
     */
    public CacheKey deriveChunkKey(
            String dataType, String deviceId, String timeBucket, int resolutionMinutes) {
        if (resolutionMinutes <= 0) {
            throw new IllegalArgumentException("resolutionMinutes must be positive: " + resolutionMinutes);
        }
        String suffix = String.join(":",
                requireComponent(dataType, "dataType"),
                requireComponent(deviceId, "deviceId"),
                requireComponent(timeBucket, "timeBucket"),
                Integer.toString(resolutionMinutes));
        return new CacheKey(Tier.AGGREGATED_CHUNK, suffix);
    }

    /**
     * Glob pattern matching every aggregated chunk of one device: {@code agg:*:{deviceId}:*}.
     * Glob metacharacters inside the device id are escaped.
     *
     * @param deviceId the device whose chunks should match
     * @return a pattern relative to the store namespace
     * @throws IllegalArgumentException if {@code deviceId} is null or blank
     */
    public String chunkPatternForDevice(String deviceId) {
        return Tier.AGGREGATED_CHUNK.prefix() + ":*:" + escapeGlob(requireText(deviceId, "deviceId")) + ":*";
    }

    /**
     * Copy of the pipeline without its trailing run of {@code $skip} and {@code $limit} stages.
     */
    public static <S extends Map<String, ?>> List<S> withoutTrailingPagination(
            List<? extends S> pipeline) {
        List<S> stages = new ArrayList<>(pipeline);
        while (!stages.isEmpty() && isPaginationStage(stages.get(stages.size() - 1))) {
            stages.remove(stages.size() - 1);
        }
        return stages;
    }

    private static boolean isPaginationStage(Map<String, ?> stage) {
        return stage != null
                && !stage.isEmpty()
                && PAGINATION_OPERATORS.containsAll(stage.keySet());
    }

    static String escapeGlob(String raw) {
        StringBuilder escaped = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            if (GLOB_METACHARACTERS.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static String sha256Hex(byte[] input) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(input));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available on this JVM", e);
        }
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    private static String requireComponent(String value, String name) {
        requireText(value, name);
        if (value.indexOf(':') >= 0) {
            throw new IllegalArgumentException(name + " must not contain ':' but was " + value);
        }
        return value;
    }
}
