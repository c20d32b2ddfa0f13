package com.pactum.api.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Deterministic JSON rendering used for every hash in the protocol.
 * Keys are sorted at every depth, sets become sorted arrays and there is no whitespace,
 * so logically equal content always yields the same bytes.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private static final DateTimeFormatter SECONDS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private CanonicalJson() {
    }

    public static String toJson(Map<String, ?> content) {
        try {
            return MAPPER.writeValueAsString(canonicalize(content));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Content cannot be rendered as canonical JSON", e);
        }
    }

    /**
     * SHA-256 of the canonical rendering, as 64 lowercase hex characters.
     */
    public static String sha256Hex(Map<String, ?> content) {
        return sha256Hex(toJson(content));
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    /**
     * ISO-8601 in UTC with a {@code +00:00} offset. Microseconds are written as six digits
     * and left out entirely when zero; anything finer is dropped.
     */
    public static String timestamp(Instant instant) {
        Instant micros = instant.truncatedTo(ChronoUnit.MICROS);
        int fraction = micros.getNano() / 1000;
        String seconds = SECONDS.format(micros);
        return fraction == 0
                ? seconds + "+00:00"
                : seconds + String.format(".%06d", fraction) + "+00:00";
    }

    static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonicalize(v)));
            return sorted;
        }
        if (value instanceof Set<?> set) {
            List<Object> items = new ArrayList<>();
            set.forEach(item -> items.add(canonicalize(item)));
            items.sort(Comparator.comparing(String::valueOf));
            return items;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>();
            collection.forEach(item -> items.add(canonicalize(item)));
            return items;
        }
        if (value instanceof Instant instant) {
            return timestamp(instant);
        }
        if (value instanceof UUID uuid) {
            return uuid.toString();
        }
        return value;
    }
}
