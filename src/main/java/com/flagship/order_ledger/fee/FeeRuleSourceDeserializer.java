package com.flagship.order_ledger.fee;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.List;

/**
 * Reads a fee rule field that is either a JSON string or a JSON array.
 */
public class FeeRuleSourceDeserializer extends StdDeserializer<FeeRuleSource> {

    public FeeRuleSourceDeserializer() {
        super(FeeRuleSource.class);
    }

    @Override
    public FeeRuleSource deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return FeeRuleSource.raw(parser.getText());
        }
        if (token == JsonToken.START_ARRAY) {
            JavaType listType = context.getTypeFactory().constructCollectionType(List.class, FeeRule.class);
            List<FeeRule> rules = context.readValue(parser, listType);
            return FeeRuleSource.parsed(rules);
        }
        return (FeeRuleSource) context.handleUnexpectedToken(FeeRuleSource.class, parser);
    }

    @Override
    public FeeRuleSource getNullValue(DeserializationContext context) {
        return FeeRuleSource.parsed(List.of());
    }
}
