package app.clipvault.catalog.event;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Upstream producers send {@code tags} either as a comma-delimited string or as a JSON array.
 * Both are decoded into the canonical list from {@link TagLists}; any other shape decodes to
 * an empty list.
 */
public class TagListDeserializer extends StdDeserializer<List<String>> {

    public TagListDeserializer() {
        super(List.class);
    }

    @Override
    public List<String> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return TagLists.split(p.getText());
        }
        if (token == JsonToken.START_ARRAY) {
            List<String> raw = new ArrayList<>();
            while (p.nextToken() != JsonToken.END_ARRAY) {
                if (p.currentToken().isScalarValue()) {
                    raw.add(p.getValueAsString());
                } else {
                    p.skipChildren();
                }
            }
            return TagLists.normalize(raw);
        }
        p.skipChildren();
        return List.of();
    }

    @Override
    public List<String> getNullValue(DeserializationContext ctxt) {
        return List.of();
    }
}
