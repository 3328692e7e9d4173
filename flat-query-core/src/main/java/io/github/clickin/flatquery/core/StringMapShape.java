package io.github.clickin.flatquery.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code Map<String, String>} merged into the enclosing namespace. Reading drains every key left
 * in the input, keeping the first value of each.
 */
final class StringMapShape implements Shape<Map<String, String>> {
    static final StringMapShape INSTANCE = new StringMapShape();

    private StringMapShape() {}

    @Override
    public Kind kind() {
        return Kind.RECORD;
    }

    @Override
    public String describe() {
        return "Map<string, string>";
    }

    @Override
    public void write(String key, Map<String, String> value, Encoder out) {
        Objects.requireNonNull(value, key);
        value.forEach((k, v) -> out.pair(Objects.requireNonNull(k, "map key"), Objects.requireNonNull(v, k)));
    }

    @Override
    public Map<String, String> read(String key, Decoder in) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : in.fields().drain().entrySet()) {
            out.put(e.getKey(), e.getValue().get(0));
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public boolean isPresent(String key, Decoder in) {
        return !in.fields().isEmpty();
    }
}
