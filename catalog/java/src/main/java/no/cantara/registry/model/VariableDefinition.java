package no.cantara.registry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a stream's {@code vars} list: an ordered map of field name to value,
 * conventionally carrying {@code name}, {@code type}, {@code default} and friends.
 */
public record VariableDefinition(Map<String, VarValue> fields) {

    public VariableDefinition {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static VariableDefinition fromMap(Map<?, ?> raw) {
        Map<String, VarValue> fields = new LinkedHashMap<>();
        raw.forEach((k, v) -> fields.put(String.valueOf(k), VarValue.of(v)));
        return new VariableDefinition(fields);
    }

    public String name() {
        return fields.get("name") instanceof VarValue.Text t ? t.value() : null;
    }

    public VarValue get(String field) {
        return fields.get(field);
    }
}
