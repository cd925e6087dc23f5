package ai.authtrail.util.grpc.trailers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Ordered multimap of response headers collected during a single call.
 * Keys are compared case-insensitively (stored lower-cased), values of the same key are kept in
 * insertion order and are never overwritten.
 *
 * <p>Instances are confined to one call and are not thread-safe.
 */
public final class HeaderSet implements HeaderSink {
    private final Map<String, List<String>> entries = new LinkedHashMap<>();

    public static String normalize(String key) {
        Objects.requireNonNull(key, "key is null");
        return key.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public void attach(String key, String value) {
        Objects.requireNonNull(value, "value is null");
        var normalized = normalize(key);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Header name is empty");
        }
        entries.computeIfAbsent(normalized, k -> new ArrayList<>(1)).add(value);
    }

    public List<String> get(String key) {
        var values = entries.get(normalize(key));
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    public boolean contains(String key) {
        return entries.containsKey(normalize(key));
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void forEach(BiConsumer<String, List<String>> action) {
        entries.forEach((key, values) -> action.accept(key, Collections.unmodifiableList(values)));
    }

    public void clear() {
        entries.clear();
    }

    @Override
    public String toString() {
        return "HeaderSet" + entries;
    }
}
