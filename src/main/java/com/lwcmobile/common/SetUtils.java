package com.lwcmobile.common;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

public final class SetUtils {
    private SetUtils() {
    }

    public static <V> Set<V> filter(Set<V> set, Predicate<? super V> predicate) {
        Set<V> filtered = new LinkedHashSet<>();
        if (set == null) {
            return filtered;
        }
        for (V value : set) {
            if (predicate.test(value)) {
                filtered.add(value);
            }
        }
        return filtered;
    }
}
