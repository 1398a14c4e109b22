/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.dynarray.util;

import java.util.Comparator;

/**
 * Ready-made comparators for {@link io.github.jbellis.dynarray.list.IndexedList#sort}.
 * Any {@link Comparator} imposing a total order works; these cover the common element types.
 */
public final class Comparators {
    /** Ascending order of {@code Integer} values. */
    public static final Comparator<Integer> INTEGERS = Integer::compare;

    /** Ascending order of {@code Long} values. */
    public static final Comparator<Long> LONGS = Long::compare;

    /** Ascending order of {@code Double} values, following {@link Double#compare}. */
    public static final Comparator<Double> DOUBLES = Double::compare;

    /** Lexicographic order of strings, by UTF-16 code unit. */
    public static final Comparator<String> STRINGS = String::compareTo;

    private Comparators() {}

    /**
     * @return the natural order of a {@link Comparable} element type
     */
    public static <T extends Comparable<? super T>> Comparator<T> natural() {
        return Comparator.naturalOrder();
    }

    /**
     * @return the reverse of the natural order of a {@link Comparable} element type
     */
    public static <T extends Comparable<? super T>> Comparator<T> reversed() {
        return Comparator.reverseOrder();
    }

    /**
     * Orders values by the result of {@code toString()}. Useful for heterogeneous lists whose only
     * common supertype is {@code Object}.
     */
    public static Comparator<Object> byString() {
        return Comparator.comparing(String::valueOf);
    }
}
