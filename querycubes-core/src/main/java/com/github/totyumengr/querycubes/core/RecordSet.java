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
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.ObjectUtils;

import com.github.totyumengr.querycubes.core.FieldPath.CalendarGranularity;
import com.github.totyumengr.querycubes.core.RecordTable.Row;

/**
 * Filtered view of a {@link RecordTable}: the table and a bitmap of selected record ids. Immutable.
 *
 * @author mengran
 *
 */
public class RecordSet implements QuerySet {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordSet.class);

    private static final Set<String> OPERATORS = new HashSet<String>(
            Arrays.asList("exact", "in", "gt", "gte", "lt", "lte"));

    private static final Set<String> DATE_COMPONENTS = new HashSet<String>(Arrays.asList("year", "month", "day"));

    private final RecordTable table;
    private final RoaringBitmap selected;

    RecordSet(RecordTable table, RoaringBitmap selected) {
        super();
        this.table = table;
        this.selected = selected;
    }

    @Override
    public RecordSet filter(Map<String, ?> lookups) {

        Assert.notNull(lookups, "Lookups can not null.");
        RoaringBitmap ands = selected.clone();
        List<Predicate<Row>> filters = new ArrayList<Predicate<Row>>(lookups.size());
        for (Entry<String, Object> entry : expand(lookups).entrySet()) {
            List<String> segments = new ArrayList<String>(FieldPath.parse(entry.getKey()).getSegments());
            String operator = "exact";
            if (segments.size() > 1 && OPERATORS.contains(segments.get(segments.size() - 1))) {
                operator = segments.remove(segments.size() - 1);
            }
            checkPath(entry.getKey(), segments);

            if (segments.size() == 1 && "exact".equals(operator)) {
                ands.and(table.index(segments.get(0), entry.getValue()));
            } else {
                filters.add(toPredicate(entry.getKey(), segments, operator, entry.getValue()));
            }
        }

        if (!filters.isEmpty()) {
            Predicate<Row> andFilter = a -> true;
            for (Predicate<Row> filter : filters) {
                andFilter = andFilter.and(filter);
            }
            RoaringBitmap matched = new RoaringBitmap();
            rows(ands).filter(andFilter).forEach(row -> matched.add(row.getId()));
            ands = matched;
        }
        LOGGER.debug("Filter {} with {} selects {} records.", table.getName(), lookups, ands.getCardinality());

        return new RecordSet(table, ands);
    }

    /**
     * Split <code>absmonth</code> and <code>absday</code> lookups into their date components.
     */
    private static Map<String, Object> expand(Map<String, ?> lookups) {

        Map<String, Object> expanded = new LinkedHashMap<String, Object>();
        for (Entry<String, ?> entry : lookups.entrySet()) {
            FieldPath path = FieldPath.parse(entry.getKey());
            if (path.getCalendarGranularity() == null) {
                expanded.put(entry.getKey(), entry.getValue());
                continue;
            }
            if (FieldPath.asTemporal(entry.getValue()) == null) {
                throw new IllegalArgumentException("Lookup " + entry.getKey() + " need a date value but "
                        + entry.getValue());
            }
            expanded.putAll(path.toLookups(entry.getValue()));
        }
        return expanded;
    }

    @Override
    public List<Object> distinctValues(FieldPath fieldPath) {

        checkPath(fieldPath.getPath(), fieldPath.getSegments());
        Stream<Object> values = values(fieldPath.getPath(), fieldPath.getSegments());
        CalendarGranularity granularity = fieldPath.getCalendarGranularity();
        if (granularity != null) {
            values = values.map(v -> truncate(fieldPath.getPath(), v, granularity));
        }
        return new ArrayList<Object>(values.filter(v -> v != null).collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    @Override
    public int count() {
        return selected.getCardinality();
    }

    /**
     * @return selected records, in id order
     */
    public Stream<Row> rows() {
        return rows(selected);
    }

    /**
     * @param fieldPath path to values, relations and date components allowed
     * @return value of the path for every selected record, <code>null</code> included
     */
    public Stream<Object> values(String fieldPath) {

        FieldPath path = FieldPath.parse(fieldPath);
        checkPath(path.getPath(), path.getSegments());
        return values(path.getPath(), path.getSegments());
    }

    public RecordTable getTable() {
        return table;
    }

    private Stream<Row> rows(RoaringBitmap ids) {

        List<Row> result = new ArrayList<Row>(ids.getCardinality());
        ids.forEach((int id) -> result.add(table.getRow(id)));
        return result.stream();
    }

    private Stream<Object> values(String path, List<String> segments) {
        return rows().map(row -> resolve(path, row, segments));
    }

    private Predicate<Row> toPredicate(String path, List<String> segments, String operator, Object expected) {

        switch (operator) {
        case "in":
            Assert.isInstanceOf(Collection.class, expected, "Lookup " + path + " need a collection.");
            Collection<?> candidates = (Collection<?>) expected;
            return row -> {
                Object actual = resolve(path, row, segments);
                return candidates.stream().anyMatch(c -> ObjectUtils.nullSafeEquals(actual, c));
            };
        case "gt":
            return row -> compare(resolve(path, row, segments), expected, c -> c > 0);
        case "gte":
            return row -> compare(resolve(path, row, segments), expected, c -> c >= 0);
        case "lt":
            return row -> compare(resolve(path, row, segments), expected, c -> c < 0);
        case "lte":
            return row -> compare(resolve(path, row, segments), expected, c -> c <= 0);
        default:
            return row -> ObjectUtils.nullSafeEquals(resolve(path, row, segments), expected);
        }
    }

    /**
     * <code>null</code> never satisfies an ordering lookup.
     */
    private static boolean compare(Object actual, Object expected, IntPredicate test) {

        if (actual == null || expected == null) {
            return false;
        }
        return test.test(ValueOrdering.INSTANCE.compare(actual, expected));
    }

    /**
     * Walk <code>segments</code> through the table and its relations, whatever records are selected. A plain field
     * may only be followed by a date component.
     * @throws InvalidFieldException on the first segment that does not resolve
     */
    private void checkPath(String path, List<String> segments) {

        RecordTable current = table;
        String plainField = null;
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (current == null) {
                if (i == segments.size() - 1 && DATE_COMPONENTS.contains(segment)) {
                    return;
                }
                throw new InvalidFieldException(path, segment, plainField);
            }
            if (!current.hasField(segment)) {
                throw new InvalidFieldException(path, segment, current.getName());
            }
            plainField = current.getName() + "." + segment;
            current = current.getRelation(segment);
        }
    }

    /**
     * Follow <code>segments</code> from <code>row</code>: fields of the current row, then fields of related rows,
     * and finally a date component of a date value.
     */
    private static Object resolve(String path, Row row, List<String> segments) {

        Object current = row;
        for (String segment : segments) {
            if (current == null) {
                return null;
            }
            if (current instanceof Row) {
                Row currentRow = (Row) current;
                if (currentRow.getTable().hasField(segment)) {
                    current = currentRow.get(segment);
                    continue;
                }
                throw new InvalidFieldException(path, segment, currentRow.getTable().getName());
            }
            TemporalAccessor date = FieldPath.asTemporal(current);
            if (date != null && DATE_COMPONENTS.contains(segment)) {
                current = date.get("year".equals(segment) ? ChronoField.YEAR
                        : "month".equals(segment) ? ChronoField.MONTH_OF_YEAR : ChronoField.DAY_OF_MONTH);
                continue;
            }
            throw new InvalidFieldException(path, segment, current.getClass().getSimpleName());
        }
        return current;
    }

    private static Object truncate(String path, Object value, CalendarGranularity granularity) {

        if (value == null) {
            return null;
        }
        TemporalAccessor date = FieldPath.asTemporal(value);
        if (date == null) {
            throw new InvalidFieldException(path, granularity.getSegment(), value.getClass().getSimpleName());
        }
        LocalDate day = LocalDate.of(date.get(ChronoField.YEAR), date.get(ChronoField.MONTH_OF_YEAR),
                date.get(ChronoField.DAY_OF_MONTH));
        return granularity == CalendarGranularity.MONTH ? day.withDayOfMonth(1) : day;
    }

    @Override
    public int hashCode() {
        return selected.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RecordSet)) {
            return false;
        }
        RecordSet other = (RecordSet) obj;
        return table == other.table && selected.equals(other.selected);
    }

    @Override
    public String toString() {
        return "RecordSet [table=" + table.getName() + ", records=" + selected.getCardinality() + "]";
    }

}
