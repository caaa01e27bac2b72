package warden.core.port.out;

import java.util.List;

/**
 * Read-only node of a hierarchical, string-keyed configuration tree.
 *
 * <p>A section may carry a value of its own, children, or both. Sections are
 * returned for any key, existing or not; use {@link #exists()} to tell them
 * apart.
 */
public interface ConfigurationSection {

    /**
     * Last segment of this section's path.
     */
    String key();

    /**
     * Full path of this section, segments separated by {@code '.'}.
     */
    String path();

    /**
     * Value held directly by this section, or null if it has none.
     */
    String value();

    /**
     * Value of the direct child {@code key}, or null if absent.
     */
    default String get(String key) {
        return getSection(key).value();
    }

    /**
     * Direct child section {@code key}. Never null.
     */
    ConfigurationSection getSection(String key);

    /**
     * Direct children, numeric keys first in numeric order, then the rest in
     * case-insensitive order.
     */
    List<ConfigurationSection> getChildren();

    /**
     * Whether this section has a value or any children.
     */
    default boolean exists() {
        return value() != null || !getChildren().isEmpty();
    }
}
