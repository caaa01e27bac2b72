package warden.adapter.out.config;

import java.util.Comparator;

/**
 * Orders configuration keys: numeric keys first in numeric order, then the
 * remaining keys in case-insensitive order.
 *
 * <p>This keeps list-style sections ({@code Items.0}, {@code Items.1},
 * {@code Items.10}) in the order they were written.
 */
public final class ConfigurationKeyComparator implements Comparator<String> {

    public static final ConfigurationKeyComparator INSTANCE = new ConfigurationKeyComparator();

    private ConfigurationKeyComparator() {}

    @Override
    public int compare(String a, String b) {
        final var aIndex = index(a);
        final var bIndex = index(b);
        if (aIndex >= 0 && bIndex >= 0) {
            return Long.compare(aIndex, bIndex);
        }
        if (aIndex >= 0) {
            return -1;
        }
        if (bIndex >= 0) {
            return 1;
        }
        return String.CASE_INSENSITIVE_ORDER.compare(a, b);
    }

    private static long index(String key) {
        if (key.isEmpty() || key.length() > 18) {
            return -1;
        }
        for (int i = 0; i < key.length(); i++) {
            final var c = key.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        return Long.parseLong(key);
    }
}
