package com.jsdesugar.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Writes the value of a {@code Literal} the way {@code JSON.stringify} would: whole doubles
 * lose their fraction, and values JSON cannot represent become {@code null}.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Object> {

    // 2^53
    private static final double MAX_SAFE_INTEGER = 9007199254740992.0;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double || value instanceof Float) {
            writeDouble(((Number) value).doubleValue(), gen);
        } else if (value instanceof Integer i) {
            gen.writeNumber(i);
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else if (value instanceof BigDecimal bd) {
            writeDouble(bd.doubleValue(), gen);
        } else if (value instanceof Number n) {
            writeDouble(n.doubleValue(), gen);
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }

    private static void writeDouble(double d, JsonGenerator gen) throws IOException {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            gen.writeNull();
        } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE_INTEGER) {
            gen.writeNumber((long) d);
        } else if (d == Math.floor(d) && Math.abs(d) < 1e21) {
            // Past 2^53 JavaScript still prints the rounded integer digits
            gen.writeNumber(new BigInteger(String.format("%.0f", d)));
        } else {
            gen.writeNumber(d);
        }
    }
}
