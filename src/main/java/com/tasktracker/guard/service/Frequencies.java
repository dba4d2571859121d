package com.tasktracker.guard.service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Frequency ranking shared by the baseline and summary builders. Ties keep first-seen order.
 */
final class Frequencies {

    private Frequencies() {}

    static <T> Map<String, Integer> count(Collection<T> items, Function<T, String> keyFn) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (T item : items) {
            String key = keyFn.apply(item);
            if (key != null) {
                counts.merge(key, 1, Integer::sum);
            }
        }
        return counts;
    }

    static <T> List<String> topKeys(Collection<T> items, Function<T, String> keyFn, int limit) {
        return topEntries(count(items, keyFn), limit).keySet().stream().toList();
    }

    static Map<String, Integer> topEntries(Map<String, Integer> counts, int limit) {
        Map<String, Integer> top = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(limit)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    static <T> long countMatching(Collection<T> items, Function<T, String> keyFn, String value) {
        return items.stream().map(keyFn).filter(k -> Objects.equals(k, value)).count();
    }
}
