package com.kmg.blend.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

// Reads offset timestamps and local ones (taken at the system zone); anything else becomes null.
public class LenientTimestampDeserializer extends StdDeserializer<OffsetDateTime> {
    private static final Logger log = LoggerFactory.getLogger(LenientTimestampDeserializer.class);

    public LenientTimestampDeserializer() {
        super(OffsetDateTime.class);
    }

    @Override
    public OffsetDateTime deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken() != JsonToken.VALUE_STRING) {
            log.debug("Ignoring non-text timestamp {}", parser.getText());
            parser.skipChildren();
            return null;
        }
        String text = parser.getText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            return parseLocal(text);
        }
    }

    private static OffsetDateTime parseLocal(String text) {
        try {
            return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toOffsetDateTime();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}': {}", text, e.getMessage());
            return null;
        }
    }
}
