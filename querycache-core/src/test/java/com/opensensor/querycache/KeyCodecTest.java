package com.opensensor.querycache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("KeyCodec")
class KeyCodecTest {

    private final KeyCodec keyCodec = new KeyCodec();

    @SafeVarargs
    private static List<Map<String, Object>> readingsPipeline(
            String deviceId, String start, String end, Map<String, Object>... tail) {
        Map<String, Object> timestamp = new LinkedHashMap<>();
        timestamp.put("$gte", start);
        timestamp.put("$lt", end);
        Map<String, Object> match = new LinkedHashMap<>();
        match.put("metadata.device_id", deviceId);
        match.put("timestamp", timestamp);
        Map<String, Object> group = Map.of(
                "$group", Map.of("_id", "$metadata.device_id", "avg", Map.of("$avg", "$temp")));
        List<Map<String, Object>> stages = new ArrayList<>();
        stages.add(Map.of("$match", match));
        stages.add(group);
        stages.addAll(List.of(tail));
        return stages;
    }

    @Nested
    @DisplayName("Pipeline key stability")
    class Stability {

        @Test
        @DisplayName("pipelines differing only in trailing skip/limit share a key")
        void paginationDoesNotAffectKey() {
            CacheKey plain = keyCodec.derivePipelineKey(readingsPipeline("A", "2024-01-01", "2024-01-02"));
            CacheKey page1 = keyCodec.derivePipelineKey(readingsPipeline("A", "2024-01-01", "2024-01-02",
                    Map.of("$skip", 10), Map.of("$limit", 50)));
            CacheKey page2 = keyCodec.derivePipelineKey(readingsPipeline("A", "2024-01-01", "2024-01-02",
                    Map.of("$skip", 20), Map.of("$limit", 50)));
            CacheKey limitOnly = keyCodec.derivePipelineKey(readingsPipeline("A", "2024-01-01", "2024-01-02",
                    Map.of("$limit", 5)));

            assertThat(page1).isEqualTo(plain).isEqualTo(page2).isEqualTo(limitOnly);
        }

        @Test
        @DisplayName("map insertion order does not affect the key")
        void fieldOrderIsCanonical() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("metadata.device_id", "A");
            first.put("temp", Map.of("$gt", 20));
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("temp", Map.of("$gt", 20));
            second.put("metadata.device_id", "A");

            assertThat(keyCodec.derivePipelineKey(List.of(Map.of("$match", first))))
                    .isEqualTo(keyCodec.derivePipelineKey(List.of(Map.of("$match", second))));
        }

        @Test
        @DisplayName("integer and long literals of the same value share a key")
        void numericRepresentationIsCanonical() {
            assertThat(keyCodec.derivePipelineKey(List.of(Map.of("$match", Map.of("temp", 20)))))
                    .isEqualTo(keyCodec.derivePipelineKey(List.of(Map.of("$match", Map.of("temp", 20L)))));
        }

        @Test
        @DisplayName("key suffix is a 64 character lowercase hex digest")
        void suffixIsSha256Hex() {
            CacheKey key = keyCodec.derivePipelineKey(readingsPipeline("A", "2024-01-01", "2024-01-02"));

            assertThat(key.tier()).isEqualTo(Tier.PIPELINE_RESULT);
            assertThat(key.suffix()).matches("[0-9a-f]{64}");
            assertThat(key.value()).startsWith("pipeline:");
        }

        @Test
        @DisplayName("java.time values are hashed by their ISO-8601 form")
        void instantsAreCanonical() {
            Instant start = Instant.parse("2024-01-15T00:00:00Z");
            CacheKey withInstant = keyCodec.derivePipelineKey(
                    List.of(Map.of("$match", Map.of("timestamp", Map.of("$gte", start)))));
            CacheKey withString = keyCodec.derivePipelineKey(
                    List.of(Map.of("$match", Map.of("timestamp", Map.of("$gte", "2024-01-15T00:00:00Z")))));

            assertThat(withInstant).isEqualTo(withString);
        }
    }

    @Nested
    @DisplayName("Pipeline key sensitivity")
    class Sensitivity {

        @Test
        @DisplayName("near-identical pipelines all map to distinct keys")
        void corpusOfNearIdenticalPipelines() {
            List<List<Map<String, Object>>> corpus = List.of(
                    readingsPipeline("A", "2024-01-01", "2024-01-02"),
                    readingsPipeline("B", "2024-01-01", "2024-01-02"),
                    readingsPipeline("A", "2024-01-01", "2024-01-03"),
                    readingsPipeline("A", "2023-12-31", "2024-01-02"),
                    readingsPipeline("A", "2024-01-01", "2024-01-02", Map.of("$match", Map.of("temp", Map.of("$gt", 0)))),
                    readingsPipeline("A", "2024-01-01", "2024-01-02", Map.of("$match", Map.of("temp", Map.of("$gt", 1)))),
                    readingsPipeline("A", "2024-01-01", "2024-01-02", Map.of("$sort", Map.of("timestamp", 1))),
                    readingsPipeline("A", "2024-01-01", "2024-01-02", Map.of("$sort", Map.of("timestamp", -1))),
                    List.of(Map.of("$match", Map.of("metadata.device_id", "A"))),
                    List.of(Map.of("$match", Map.of("metadata.device_id", "A")),
                            Map.of("$group", Map.of("_id", "$metadata.device_id", "n", Map.of("$sum", 1)))),
                    List.of(Map.of("$match", Map.of("metadata.device_id", "A")),
                            Map.of("$group", Map.of("_id", "$metadata.device_id", "n", Map.of("$sum", 2)))));

            Set<CacheKey> keys = new HashSet<>();
            corpus.forEach(pipeline -> keys.add(keyCodec.derivePipelineKey(pipeline)));

            assertThat(keys).hasSize(corpus.size());
        }

        @Test
        @DisplayName("pagination followed by further stages is part of the key")
        void nonTrailingPaginationIsKept() {
            CacheKey limitBeforeGroup = keyCodec.derivePipelineKey(List.of(
                    Map.of("$limit", 100), Map.of("$group", Map.of("_id", "all", "n", Map.of("$sum", 1)))));
            CacheKey groupOnly = keyCodec.derivePipelineKey(List.of(
                    Map.of("$group", Map.of("_id", "all", "n", Map.of("$sum", 1)))));
            CacheKey otherLimit = keyCodec.derivePipelineKey(List.of(
                    Map.of("$limit", 200), Map.of("$group", Map.of("_id", "all", "n", Map.of("$sum", 1)))));

            assertThat(limitBeforeGroup).isNotEqualTo(groupOnly).isNotEqualTo(otherLimit);
        }

        @Test
        @DisplayName("stage order is significant")
        void stageOrderMatters() {
            Map<String, Object> match = Map.of("$match", Map.of("temp", 1));
            Map<String, Object> sort = Map.of("$sort", Map.of("timestamp", 1));

            assertThat(keyCodec.derivePipelineKey(List.of(match, sort)))
                    .isNotEqualTo(keyCodec.derivePipelineKey(List.of(sort, match)));
        }
    }

    @Nested
    @DisplayName("Metadata and chunk keys")
    class IdentifierKeys {

        @Test
        @DisplayName("metadata key embeds the device id")
        void metadataKey() {
            assertThat(keyCodec.deriveMetadataKey("A").value()).isEqualTo("device_meta:A");
        }

        @Test
        @DisplayName("chunk key embeds every component in order")
        void chunkKey() {
            CacheKey key = keyCodec.deriveChunkKey("temp", "A", "2024-01-15-14", 15);

            assertThat(key.tier()).isEqualTo(Tier.AGGREGATED_CHUNK);
            assertThat(key.value()).isEqualTo("agg:temp:A:2024-01-15-14:15");
        }

        @Test
        @DisplayName("device chunk pattern escapes glob metacharacters")
        void chunkPatternEscapesGlob() {
            assertThat(keyCodec.chunkPatternForDevice("A")).isEqualTo("agg:*:A:*");
            assertThat(keyCodec.chunkPatternForDevice("dev*[1]")).isEqualTo("agg:*:dev\\*\\[1\\]:*");
        }

        @Test
        @DisplayName("rejects blank ids and colons inside chunk components")
        void rejectsInvalidComponents() {
            assertThatThrownBy(() -> keyCodec.deriveMetadataKey(" "))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> keyCodec.deriveChunkKey("temp", "a:b", "2024-01-15", 60))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> keyCodec.deriveChunkKey("temp", "A", "2024-01-15", 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> keyCodec.derivePipelineKey(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("withoutTrailingPagination leaves the input untouched")
    void withoutTrailingPaginationCopies() {
        List<Map<String, Object>> pipeline = new ArrayList<>();
        pipeline.add(Map.of("$match", Map.of("a", 1)));
        pipeline.add(Map.of("$skip", 5));
        pipeline.add(Map.of("$limit", 5));

        List<Map<String, Object>> stripped = KeyCodec.withoutTrailingPagination(pipeline);

        assertThat(stripped).containsExactly(Map.of("$match", Map.of("a", 1)));
        assertThat(pipeline).hasSize(3);
    }
}
