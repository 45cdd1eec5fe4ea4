/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package io.hdlsolver.core.common.collection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSet;

public class Collections {

    @SafeVarargs
    public static <T> List<T> list(T... elements) {
        return unmodifiableList(Arrays.asList(elements));
    }

    public static <T> List<T> list(Collection<T> elements) {
        return unmodifiableList(new ArrayList<>(elements));
    }

    public static <T> List<T> list(List<T> first, T last) {
        List<T> list = new ArrayList<>(first);
        list.add(last);
        return unmodifiableList(list);
    }

    @SafeVarargs
    public static <T> Set<T> set(T... elements) {
        return unmodifiableSet(new LinkedHashSet<>(Arrays.asList(elements)));
    }

    public static <T> Set<T> set(Collection<T> elements) {
        return unmodifiableSet(new LinkedHashSet<>(elements));
    }

    @SafeVarargs
    public static <T> Set<T> union(Collection<? extends T>... collections) {
        Set<T> union = new LinkedHashSet<>();
        for (Collection<? extends T> c : collections) union.addAll(c);
        return unmodifiableSet(union);
    }
}
