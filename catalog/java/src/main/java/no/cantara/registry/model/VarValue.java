package no.cantara.registry.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A loosely typed value inside a stream variable definition.
 */
public sealed interface VarValue {

    record Text(String value) implements VarValue {}

    record Number(BigDecimal value) implements VarValue {}

    record Bool(boolean value) implements VarValue {}

    record ListValue(List<VarValue> values) implements VarValue {
        public ListValue {
            values = List.copyOf(values);
        }
    }

    record MapValue(Map<String, VarValue> entries) implements VarValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    record Null() implements VarValue {}

    /**
     * Converts a value produced by the YAML reader. Scalars of other types
     * (dates, for instance) are kept as their string form.
     */
    static VarValue of(Object raw) {
        if (raw == null) return new Null();
        if (raw instanceof VarValue v) return v;
        if (raw instanceof String s) return new Text(s);
        if (raw instanceof Boolean b) return new Bool(b);
        if (raw instanceof BigDecimal d) return new Number(d);
        if (raw instanceof BigInteger i) return new Number(new BigDecimal(i));
        if (raw instanceof Double || raw instanceof Float) return new Number(BigDecimal.valueOf(((java.lang.Number) raw).doubleValue()));
        if (raw instanceof java.lang.Number n) return new Number(BigDecimal.valueOf(n.longValue()));
        if (raw instanceof List<?> list) {
            List<VarValue> values = new ArrayList<>(list.size());
            for (Object item : list) {
                values.add(of(item));
            }
            return new ListValue(values);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, VarValue> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), of(v)));
            return new MapValue(entries);
        }
        return new Text(raw.toString());
    }

    /** Plain Java form: String, BigDecimal, Boolean, List, Map or null. */
    default Object toPlain() {
        if (this instanceof Text t) return t.value();
        if (this instanceof Number n) return n.value();
        if (this instanceof Bool b) return b.value();
        if (this instanceof ListValue l) return l.values().stream().map(VarValue::toPlain).toList();
        if (this instanceof MapValue m) {
            Map<String, Object> plain = new LinkedHashMap<>();
            m.entries().forEach((k, v) -> plain.put(k, v.toPlain()));
            return plain;
        }
        return null;
    }
}
