package com.codeops.lineage.service;

import com.codeops.lineage.exception.LineageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ContentCodec canonical encoding and shallow overlay.
 */
class ContentCodecTest {

    private final ContentCodec codec = new ContentCodec(new ObjectMapper());

    @Test
    void encode_sortsKeysAtEveryDepth() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("z", 1);
        nested.put("a", 2);
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("title", "Intro");
        content.put("blocks", nested);

        assertThat(codec.encode(content)).isEqualTo("{\"blocks\":{\"a\":2,\"z\":1},\"title\":\"Intro\"}");
    }

    @Test
    void encode_null_isEmptyObject() {
        assertThat(codec.encode(null)).isEqualTo("{}");
    }

    @Test
    void decode_readsStoredContent() {
        Map<String, Object> decoded = codec.decode("{\"items\":[\"a\",\"b\"],\"title\":\"Quiz\"}");

        assertThat(decoded).containsEntry("title", "Quiz");
        assertThat(decoded.get("items")).isEqualTo(List.of("a", "b"));
    }

    @Test
    void decode_blank_isEmptyMap() {
        assertThat(codec.decode("")).isEmpty();
    }

    @Test
    void decode_corrupt_throws() {
        assertThatThrownBy(() -> codec.decode("{not json"))
                .isInstanceOf(LineageException.class)
                .hasMessageContaining("corrupt");
    }

    @Test
    void overlay_replacesTopLevelKeysOnly() {
        Map<String, Object> base = Map.of("title", "Old", "body", Map.of("a", 1, "b", 2));
        Map<String, Object> changes = Map.of("body", Map.of("a", 9));

        Map<String, Object> merged = codec.overlay(base, changes);

        assertThat(merged).containsEntry("title", "Old");
        assertThat(merged.get("body")).isEqualTo(Map.of("a", 9));
    }

    @Test
    void overlay_nullChanges_keepsBase() {
        assertThat(codec.overlay(Map.of("k", "v"), null)).containsExactlyEntriesOf(Map.of("k", "v"));
    }
}
