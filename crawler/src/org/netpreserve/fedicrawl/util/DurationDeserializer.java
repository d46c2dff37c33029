package org.netpreserve.fedicrawl.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads durations written as milliseconds ({@code 500}), shorthand ({@code 30s}, {@code 5m}, {@code 24h},
 * {@code 7d}) or ISO-8601 ({@code PT1M}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        return parse(jsonParser.getText());
    }

    public static Duration parse(String text) {
        String value = text.trim().toUpperCase(Locale.ROOT);
        if (value.startsWith("P")) return Duration.parse(value);
        if (value.endsWith("MS")) return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2)));
        if (value.endsWith("D")) return Duration.ofDays(Long.parseLong(value.substring(0, value.length() - 1)));
        return Duration.parse("PT" + value);
    }
}
