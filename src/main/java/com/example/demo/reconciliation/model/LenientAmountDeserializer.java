package com.example.demo.reconciliation.model;

import com.example.demo.reconciliation.service.NormalizationService;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Reads monetary amounts either as JSON numbers or as extracted text such as
 * {@code "$1,141.92"}.
 */
public class LenientAmountDeserializer extends StdDeserializer<BigDecimal> {

    private static final NormalizationService NORMALIZER = new NormalizationService();

    public LenientAmountDeserializer() {
        super(BigDecimal.class);
    }

    @Override
    public BigDecimal deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return p.getDecimalValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            String text = p.getText();
            if (text == null || text.trim().isEmpty()) {
                return null;
            }
            BigDecimal amount = NORMALIZER.parseAmount(text);
            if (amount == null) {
                return (BigDecimal) ctxt.handleWeirdStringValue(BigDecimal.class, text,
                        "not a monetary amount");
            }
            return amount;
        }
        return (BigDecimal) ctxt.handleUnexpectedToken(BigDecimal.class, p);
    }
}
