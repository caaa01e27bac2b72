package warden.adapter.out.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigurationKeyComparator")
class ConfigurationKeyComparatorTest {

    private static List<String> sorted(String... keys) {
        final var list = new ArrayList<>(List.of(keys));
        list.sort(ConfigurationKeyComparator.INSTANCE);
        return list;
    }

    @Test
    @DisplayName("should sort numeric keys numerically")
    void shouldSortNumerically() {
        assertEquals(List.of("0", "2", "10", "100"), sorted("10", "2", "100", "0"));
    }

    @Test
    @DisplayName("should put numeric keys before named keys")
    void shouldPutNumbersFirst() {
        assertEquals(List.of("1", "alpha", "Beta"), sorted("Beta", "alpha", "1"));
    }

    @Test
    @DisplayName("should sort named keys ignoring case")
    void shouldIgnoreCase() {
        assertEquals(List.of("apple", "Banana", "cherry"), sorted("cherry", "Banana", "apple"));
    }

    @Test
    @DisplayName("should treat mixed keys as names")
    void shouldTreatMixedAsNames() {
        assertEquals(List.of("3", "1a", "a1"), sorted("a1", "1a", "3"));
    }
}
