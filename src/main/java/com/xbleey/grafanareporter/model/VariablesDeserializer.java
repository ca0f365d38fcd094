package com.xbleey.grafanareporter.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads dashboard variables written either as {@code "name": "value"} (older job files)
 * or {@code "name": ["v1", "v2"]}, normalising both to a list per name.
 */
public class VariablesDeserializer extends StdDeserializer<Map<String, List<String>>> {

    public VariablesDeserializer() {
        super(Map.class);
    }

    @Override
    public Map<String, List<String>> deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {
        JsonNode node = context.readTree(parser);
        Map<String, List<String>> variables = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return variables;
        }
        if (!node.isObject()) {
            return context.reportInputMismatch(this, "variables must be a JSON object, got %s", node.getNodeType());
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isValueNode()) {
                variables.put(field.getKey(), new ArrayList<>(List.of(value.asText())));
            } else if (value.isArray()) {
                List<String> values = new ArrayList<>(value.size());
                for (JsonNode element : value) {
                    if (!element.isValueNode() || element.isNull()) {
                        return context.reportInputMismatch(this,
                                "variable '%s' must contain only scalar values", field.getKey());
                    }
                    values.add(element.asText());
                }
                variables.put(field.getKey(), values);
            } else {
                return context.reportInputMismatch(this,
                        "variable '%s' must be a string or an array of strings", field.getKey());
            }
        }
        return variables;
    }

    @Override
    public Map<String, List<String>> getNullValue(DeserializationContext context) {
        return new LinkedHashMap<>();
    }
}
