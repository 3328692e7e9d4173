package io.github.clickin.flatquery.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decoder-side view of flat text: every key mapped to the values seen for it, in input order.
 *
 * <p>Values are removed as they are read. A key whose values are exhausted disappears, so reading
 * it again answers "absent". Instances are owned by a single decode call and are not thread-safe.
 */
public final class FieldMap {

    private final Map<String, Deque<String>> values;
    private int remaining;

    private FieldMap(Map<String, Deque<String>> values, int remaining) {
        this.values = values;
        this.remaining = remaining;
    }

    /**
     * Parses {@code key=value&key=value} text. No percent-decoding is applied.
     *
     * <p>The empty text yields an empty map. Any piece that does not split on {@code =} into exactly
     * two parts (including empty pieces) fails the whole parse.
     *
     * @throws FlatQueryException.InvalidPair on malformed pair syntax
     */
    public static FieldMap parse(String text) {
        Objects.requireNonNull(text, "text");
        Map<String, Deque<String>> out = new LinkedHashMap<>();
        if (text.isEmpty()) return new FieldMap(out, 0);
        int count = 0;
        for (String piece : text.split("&", -1)) {
            String[] parts = piece.split("=", -1);
            if (parts.length != 2) {
                throw new FlatQueryException.InvalidPair(piece);
            }
            out.computeIfAbsent(parts[0], k -> new ArrayDeque<>()).addLast(parts[1]);
            count++;
        }
        return new FieldMap(out, count);
    }

    /**
     * Returns true if at least one value is left for {@code key}.
     */
    public boolean has(String key) {
        return values.containsKey(key);
    }

    /**
     * Returns the next value for {@code key} without consuming it, or {@code null}.
     */
    public String peek(String key) {
        Deque<String> q = values.get(key);
        return q == null ? null : q.peekFirst();
    }

    /**
     * Removes and returns the next value for {@code key}, or {@code null} if none is left.
     */
    public String take(String key) {
        Deque<String> q = values.get(key);
        if (q == null) return null;
        String v = q.pollFirst();
        remaining--;
        if (q.isEmpty()) {
            values.remove(key);
        }
        return v;
    }

    /**
     * Removes every value left for {@code key}, in input order.
     */
    public List<String> takeAll(String key) {
        Deque<String> q = values.remove(key);
        if (q == null) return List.of();
        remaining -= q.size();
        return List.copyOf(q);
    }

    /**
     * Keys that still have values, in first-seen order.
     */
    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Number of values not yet consumed, across all keys.
     */
    public int remaining() {
        return remaining;
    }

    /**
     * Removes all remaining keys, handing each one's values to the caller in first-seen order.
     */
    public Map<String, List<String>> drain() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, Deque<String>>> it = values.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, Deque<String>> e = it.next();
            out.put(e.getKey(), List.copyOf(e.getValue()));
            it.remove();
        }
        remaining = 0;
        return out;
    }

    @Override
    public String toString() {
        return "FieldMap" + values.keySet();
    }
}
