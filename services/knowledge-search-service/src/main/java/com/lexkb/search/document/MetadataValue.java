package com.lexkb.search.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public interface MetadataValue {

    static MetadataValue of(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof MetadataValue value) {
            return value;
        }
        if (raw instanceof Number number) {
            return new Numeric(number.doubleValue());
        }
        if (raw instanceof Boolean flag) {
            return new Flag(flag);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, MetadataValue> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                MetadataValue converted = of(entry.getValue());
                if (entry.getKey() != null && converted != null) {
                    nested.put(entry.getKey().toString(), converted);
                }
            }
            return new Nested(nested);
        }
        return new Text(raw.toString());
    }

    static MetadataValue text(String value) {
        return new Text(value);
    }

    static MetadataValue number(double value) {
        return new Numeric(value);
    }

    record Text(String value) implements MetadataValue {
        public Text {
            value = value == null ? "" : value;
        }
    }

    record Numeric(double value) implements MetadataValue {}

    record Flag(boolean value) implements MetadataValue {}

    record Nested(Map<String, MetadataValue> values) implements MetadataValue {
        public Nested {
            values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }
}
