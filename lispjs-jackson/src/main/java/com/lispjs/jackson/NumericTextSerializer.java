package com.lispjs.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes a numeric literal's source text as a JSON number, so the output reads
 * like an ESTree literal. Text that is not a valid JSON number (leading zeros,
 * e.g. "007") is written as a string instead, since JSON parsers reject it.
 * The digits are never reformatted either way.
 */
public class NumericTextSerializer extends JsonSerializer<String> {

    @Override
    public void serialize(String value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (isJsonInteger(value)) {
            gen.writeNumber(value);
        } else {
            gen.writeString(value);
        }
    }

    static boolean isJsonInteger(String text) {
        if (text.isEmpty() || (text.length() > 1 && text.charAt(0) == '0')) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }
}
