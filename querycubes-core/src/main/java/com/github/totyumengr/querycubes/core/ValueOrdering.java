/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.querycubes.core;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordering of sample space values: {@link Entity entities} by primary key, dates on a single time line,
 * other values of the same class by natural ordering, numbers by value.
 * Values of unrelated types fall back to type name then string form, so sorting never fails on mixed spaces.
 *
 * @author mengran
 *
 */
public final class ValueOrdering implements Comparator<Object> {

    public static final ValueOrdering INSTANCE = new ValueOrdering();

    private ValueOrdering() {
        super();
    }

    @SuppressWarnings("unchecked")
    @Override
    public int compare(Object o1, Object o2) {

        Object k1 = key(o1);
        Object k2 = key(o2);
        if (k1 == k2) {
            return 0;
        }
        if (k1 == null) {
            return -1;
        }
        if (k2 == null) {
            return 1;
        }
        LocalDateTime d1 = asDateTime(k1);
        LocalDateTime d2 = asDateTime(k2);
        if (d1 != null && d2 != null) {
            return d1.compareTo(d2);
        }
        if (k1 instanceof Comparable && k1.getClass() == k2.getClass()) {
            return ((Comparable<Object>) k1).compareTo(k2);
        }
        if (k1 instanceof Number && k2 instanceof Number) {
            return Double.compare(((Number) k1).doubleValue(), ((Number) k2).doubleValue());
        }
        int byType = k1.getClass().getName().compareTo(k2.getClass().getName());
        return byType != 0 ? byType : k1.toString().compareTo(k2.toString());
    }

    /**
     * Dates of any flavour compare on one time line, a day at its start.
     */
    private static LocalDateTime asDateTime(Object value) {

        TemporalAccessor temporal = FieldPath.asTemporal(value);
        if (temporal instanceof LocalDate) {
            return ((LocalDate) temporal).atStartOfDay();
        }
        return (LocalDateTime) temporal;
    }

    private static Object key(Object value) {
        return value instanceof Entity ? ((Entity) value).getPrimaryKey() : value;
    }

    /**
     * @param values any values
     * @return distinct values sorted by this ordering
     */
    public static List<Object> sorted(Collection<?> values) {

        List<Object> sorted = new ArrayList<Object>(new LinkedHashSet<Object>(values));
        sorted.sort(INSTANCE);
        return sorted;
    }

}
