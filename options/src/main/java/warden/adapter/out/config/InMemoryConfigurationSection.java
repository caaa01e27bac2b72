package warden.adapter.out.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

import warden.core.port.out.ConfigurationSection;

/**
 * Configuration section backed by a flat map of paths to values.
 *
 * <p>Path segments are separated by {@code '.'}; indexed segments such as
 * {@code SigningKeys[0].Issuer} are normalized to {@code SigningKeys.0.Issuer}.
 * Keys are matched case-insensitively. The backing map is copied, so a
 * section is an immutable snapshot.
 */
public final class InMemoryConfigurationSection implements ConfigurationSection {

    private static final Pattern INDEX = Pattern.compile("\\[(\\d+)]");
    private static final char SEPARATOR = '.';

    private final NavigableMap<String, String> data;
    private final String path;

    private InMemoryConfigurationSection(NavigableMap<String, String> data, String path) {
        this.data = data;
        this.path = path;
    }

    /**
     * Create the root section for a flat map of values.
     *
     * @param values paths mapped to values; null values are ignored
     * @return the root section (its own path is empty)
     */
    public static InMemoryConfigurationSection of(Map<String, String> values) {
        final var data = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                data.put(normalize(key), value);
            }
        });
        return new InMemoryConfigurationSection(Collections.unmodifiableNavigableMap(data), "");
    }

    /**
     * Normalize indexed path segments, {@code a[0].b} becomes {@code a.0.b}.
     */
    static String normalize(String key) {
        return INDEX.matcher(key).replaceAll(".$1");
    }

    @Override
    public String key() {
        final var lastSeparator = path.lastIndexOf(SEPARATOR);
        return lastSeparator < 0 ? path : path.substring(lastSeparator + 1);
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public String value() {
        return path.isEmpty() ? null : data.get(path);
    }

    @Override
    public ConfigurationSection getSection(String key) {
        final var normalized = normalize(key);
        return new InMemoryConfigurationSection(data, path.isEmpty() ? normalized : path + SEPARATOR + normalized);
    }

    @Override
    public List<ConfigurationSection> getChildren() {
        final var prefix = path.isEmpty() ? "" : path + SEPARATOR;
        final var childKeys = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);

        for (var key : data.tailMap(prefix, true).keySet()) {
            if (!key.regionMatches(true, 0, prefix, 0, prefix.length())) {
                break;
            }
            final var remainder = key.substring(prefix.length());
            if (remainder.isEmpty()) {
                continue;
            }
            final var end = remainder.indexOf(SEPARATOR);
            childKeys.add(end < 0 ? remainder : remainder.substring(0, end));
        }

        final var sorted = new ArrayList<>(childKeys);
        sorted.sort(ConfigurationKeyComparator.INSTANCE);
        return sorted.stream().map(this::getSection).toList();
    }

    @Override
    public String toString() {
        return "ConfigurationSection[" + path + "]";
    }
}
