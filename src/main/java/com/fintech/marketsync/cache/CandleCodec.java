package com.fintech.marketsync.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.marketsync.domain.Candle;
import com.fintech.marketsync.domain.IndicatorCandle;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Versioned cache encoding for candles.
 *
 * Raw rows are compact CSV prefixed with a format version:
 * {@code v1,<ts>,<open>,<high>,<low>,<close>,<volume>}. Unprefixed six-field rows
 * written by older collectors are still readable. Indicator rows are JSON objects
 * carrying a {@code "v"} field.
 */
@Component
public class CandleCodec {

    static final String RAW_VERSION = "v1";
    static final int JSON_VERSION = 1;
    private static final String VERSION_FIELD = "v";

    private final ObjectMapper objectMapper;

    public CandleCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encodeRaw(Candle candle) {
        return RAW_VERSION + "," + candle.timestamp() + ","
            + candle.open() + "," + candle.high() + "," + candle.low() + ","
            + candle.close() + "," + candle.volume();
    }

    /**
     * Decodes a raw row. Returns empty for rows that are malformed or from an
     * unknown format version.
     */
    public Optional<Candle> decodeRaw(String row) {
        if (row == null || row.isBlank()) {
            return Optional.empty();
        }
        String[] parts = row.split(",");
        int offset;
        if (parts.length == 7 && RAW_VERSION.equals(parts[0])) {
            offset = 1;
        } else if (parts.length == 6 && !parts[0].startsWith("v")) {
            offset = 0;
        } else {
            return Optional.empty();
        }
        try {
            return Optional.of(Candle.of(
                Long.parseLong(parts[offset].trim()),
                Double.parseDouble(parts[offset + 1].trim()),
                Double.parseDouble(parts[offset + 2].trim()),
                Double.parseDouble(parts[offset + 3].trim()),
                Double.parseDouble(parts[offset + 4].trim()),
                Double.parseDouble(parts[offset + 5].trim())
            ));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String encodeIndicator(IndicatorCandle candle) {
        ObjectNode node = objectMapper.valueToTree(candle);
        node.put(VERSION_FIELD, JSON_VERSION);
        return write(node);
    }

    public Optional<IndicatorCandle> decodeIndicator(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isObject() || node.path(VERSION_FIELD).asInt(-1) != JSON_VERSION) {
                return Optional.empty();
            }
            ((ObjectNode) node).remove(VERSION_FIELD);
            return Optional.of(objectMapper.treeToValue(node, IndicatorCandle.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Plain JSON for single-value slots such as current and latest candles. */
    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
