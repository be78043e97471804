package org.netpreserve.webrequest.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads durations written as milliseconds ({@code 1500}), shorthand ({@code 10s}, {@code 1m30s})
 * or ISO-8601 ({@code PT10S}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toUpperCase(Locale.ROOT);
        if (text.startsWith("P")) return Duration.parse(text);
        return Duration.parse("PT" + text);
    }
}
