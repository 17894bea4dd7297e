package com.example.s3explorer.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prefix options offered to administrators: the configured named prefixes followed by the ones
 * discovered in storage.
 */
public final class PrefixCatalog {

    private PrefixCatalog() {
    }

    /**
     * Union by {@link PrefixOption#value()}, keeping order. Static options come first and the first
     * occurrence of a value wins.
     */
    public static List<PrefixOption> merge(List<PrefixOption> staticOptions, List<PrefixOption> discovered) {
        Map<String, PrefixOption> merged = new LinkedHashMap<>();
        addAll(merged, staticOptions);
        addAll(merged, discovered);
        return List.copyOf(new ArrayList<>(merged.values()));
    }

    public static List<PrefixOption> fromPrefixes(List<String> prefixes) {
        List<PrefixOption> options = new ArrayList<>();
        if (prefixes != null) {
            for (String prefix : prefixes) {
                if (prefix == null || prefix.isBlank()) {
                    continue;
                }
                options.add(PrefixOption.of(prefix));
            }
        }
        return options;
    }

    private static void addAll(Map<String, PrefixOption> target, List<PrefixOption> options) {
        if (options == null) {
            return;
        }
        for (PrefixOption option : options) {
            if (option == null || option.value() == null) {
                continue;
            }
            target.putIfAbsent(option.value(), option);
        }
    }
}
