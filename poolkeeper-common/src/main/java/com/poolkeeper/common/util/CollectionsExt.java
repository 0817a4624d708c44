/*
 * Copyright 2018 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.poolkeeper.common.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public final class CollectionsExt {

    private CollectionsExt() {
    }

    public static <T> boolean isNullOrEmpty(Collection<T> collection) {
        return collection == null || collection.isEmpty();
    }

    @SafeVarargs
    public static <T> Set<T> asSet(T... values) {
        Set<T> result = new LinkedHashSet<>();
        Collections.addAll(result, values);
        return result;
    }

    /**
     * Returns elements of <code>first</code> not present in <code>second</code>, in the iteration order of
     * <code>first</code>.
     */
    public static <T> Set<T> difference(Collection<T> first, Collection<T> second) {
        Set<T> result = new LinkedHashSet<>(first);
        result.removeAll(second);
        return result;
    }

    /**
     * Groups items by key. Both the key order and the item order within a group follow the source list order.
     */
    public static <K, T> Map<K, List<T>> groupByOrdered(List<T> items, Function<T, K> keyMapper) {
        return items.stream().collect(Collectors.groupingBy(keyMapper, LinkedHashMap::new, Collectors.toList()));
    }
}
