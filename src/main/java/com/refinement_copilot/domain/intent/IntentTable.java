package com.refinement_copilot.domain.intent;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable lookup table holding exactly one value for every {@link Intent}.
 * <p>
 * Tables are checked for completeness when built, so a lookup can never miss at runtime.
 * A {@code null} intent resolves to the {@link Intent#FALLBACK} entry.
 */
public final class IntentTable<V> {

    private final Map<Intent, V> entries;

    private IntentTable(EnumMap<Intent, V> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Builds a table from the given entries.
     *
     * @throws IllegalStateException if any intent is missing or mapped to null
     */
    public static <V> IntentTable<V> of(Map<Intent, ? extends V> entries) {
        EnumMap<Intent, V> copy = new EnumMap<>(Intent.class);
        entries.forEach((intent, value) -> {
            if (intent != null && value != null) {
                copy.put(intent, value);
            }
        });

        List<Intent> missing = Arrays.stream(Intent.values())
            .filter(intent -> !copy.containsKey(intent))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Intent table is missing entries for: " + missing);
        }
        return new IntentTable<>(copy);
    }

    public V get(Intent intent) {
        return entries.get(intent != null ? intent : Intent.FALLBACK);
    }

    /**
     * Returns a new table where the given entries replace the current ones
     */
    public IntentTable<V> withOverrides(Map<Intent, ? extends V> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        EnumMap<Intent, V> merged = new EnumMap<>(entries);
        overrides.forEach((intent, value) -> {
            if (intent != null && value != null) {
                merged.put(intent, value);
            }
        });
        return new IntentTable<>(merged);
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
