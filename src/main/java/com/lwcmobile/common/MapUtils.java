package com.lwcmobile.common;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiPredicate;

public final class MapUtils {
    private MapUtils() {
    }

    // null map yields an empty map; surviving entries keep their order
    public static <K, V> Map<K, V> filter(Map<K, V> map, BiPredicate<? super K, ? super V> predicate) {
        Map<K, V> filtered = new LinkedHashMap<>();
        if (map == null) {
            return filtered;
        }
        for (Map.Entry<K, V> entry : map.entrySet()) {
            if (predicate.test(entry.getKey(), entry.getValue())) {
                filtered.put(entry.getKey(), entry.getValue());
            }
        }
        return filtered;
    }
}
