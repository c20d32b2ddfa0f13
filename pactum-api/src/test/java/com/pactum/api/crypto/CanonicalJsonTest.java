package com.pactum.api.crypto;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class CanonicalJsonTest {

    @Test
    void sortsKeysAtEveryDepthWithoutWhitespace() {
        Map<String, Object> content = Map.of(
                "b", 1,
                "a", Map.of("z", true, "y", Set.of("q", "p")));

        assertThat(CanonicalJson.toJson(content)).isEqualTo("{\"a\":{\"y\":[\"p\",\"q\"],\"z\":true},\"b\":1}");
    }

    @Test
    void keepsListOrderAndNulls() {
        Map<String, Object> content = new HashMap<>();
        content.put("items", List.of("c", "a"));
        content.put("missing", null);

        assertThat(CanonicalJson.toJson(content)).isEqualTo("{\"items\":[\"c\",\"a\"],\"missing\":null}");
    }

    @Test
    void timestampsUseUtcOffsetAndMicroseconds() {
        assertThat(CanonicalJson.timestamp(Instant.parse("2026-03-01T10:00:00Z")))
                .isEqualTo("2026-03-01T10:00:00+00:00");
        assertThat(CanonicalJson.timestamp(Instant.parse("2026-03-01T10:00:00.5Z")))
                .isEqualTo("2026-03-01T10:00:00.500000+00:00");
        assertThat(CanonicalJson.timestamp(Instant.parse("2026-03-01T10:00:00.123456789Z")))
                .isEqualTo("2026-03-01T10:00:00.123456+00:00");
    }

    @Test
    void sha256MatchesKnownVector() {
        assertThat(CanonicalJson.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
