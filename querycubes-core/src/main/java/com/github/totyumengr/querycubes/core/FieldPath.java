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
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Parsed form of a field lookup such as <code>author__instrument__name</code> or <code>release_date__absmonth</code>.
 *
 * <p>Segments are separated by <code>__</code> (a <code>.</code> is accepted too). Two terminal pseudo-segments are
 * reserved: <code>absmonth</code> and <code>absday</code>. They are not part of {@link #getSegments()}, they are kept
 * as {@link #getCalendarGranularity()} and expand a date constraint into its year, month (and day) components.
 *
 * @author mengran
 *
 */
public final class FieldPath {

    public static final String SEPARATOR = "__";

    public enum CalendarGranularity {

        MONTH("absmonth"), DAY("absday");

        private final String segment;

        private CalendarGranularity(String segment) {
            this.segment = segment;
        }

        public String getSegment() {
            return segment;
        }

        static CalendarGranularity of(String segment) {
            for (CalendarGranularity g : values()) {
                if (g.segment.equals(segment)) {
                    return g;
                }
            }
            return null;
        }
    }

    private final String path;
    private final List<String> segments;
    private final CalendarGranularity calendarGranularity;

    private FieldPath(String path, List<String> segments, CalendarGranularity calendarGranularity) {
        super();
        this.path = path;
        this.segments = Collections.unmodifiableList(segments);
        this.calendarGranularity = calendarGranularity;
    }

    public static FieldPath parse(String path) {

        Assert.hasText(path, "Field path can not empty.");
        String normalized = path.replace(".", SEPARATOR);
        List<String> segments = new ArrayList<String>(Arrays.asList(normalized.split(SEPARATOR)));
        for (String segment : segments) {
            if (!StringUtils.hasText(segment)) {
                throw new IllegalArgumentException("Empty segment in field path " + path);
            }
        }

        CalendarGranularity granularity = CalendarGranularity.of(segments.get(segments.size() - 1));
        if (granularity != null) {
            if (segments.size() == 1) {
                throw new IllegalArgumentException("Field path " + path + " need a date field before "
                        + granularity.getSegment());
            }
            segments.remove(segments.size() - 1);
        }
        return new FieldPath(normalized, segments, granularity);
    }

    public String getPath() {
        return path;
    }

    public List<String> getSegments() {
        return segments;
    }

    public CalendarGranularity getCalendarGranularity() {
        return calendarGranularity;
    }

    /**
     * @return lookup of the field without the calendar pseudo-segment, e.g. <code>release_date</code> for
     *  <code>release_date__absmonth</code>.
     */
    public String getBaseLookup() {
        return StringUtils.collectionToDelimitedString(segments, SEPARATOR);
    }

    /**
     * Translate a constraint value into lookups of a filter. Calendar dimensions constrained to a date-like value
     * split into <code>year</code>, <code>month</code> (and <code>day</code>) lookups, others give a single
     * equality lookup on {@link #getPath()}.
     * @param value constraint value
     * @return lookups, never empty
     */
    public Map<String, Object> toLookups(Object value) {

        Map<String, Object> lookups = new LinkedHashMap<String, Object>(4);
        TemporalAccessor date = calendarGranularity == null ? null : asTemporal(value);
        if (date == null) {
            lookups.put(path, value);
            return lookups;
        }

        String base = getBaseLookup() + SEPARATOR;
        lookups.put(base + "year", date.get(ChronoField.YEAR));
        lookups.put(base + "month", date.get(ChronoField.MONTH_OF_YEAR));
        if (calendarGranularity == CalendarGranularity.DAY) {
            lookups.put(base + "day", date.get(ChronoField.DAY_OF_MONTH));
        }
        return lookups;
    }

    static TemporalAccessor asTemporal(Object value) {

        if (value instanceof LocalDate || value instanceof LocalDateTime) {
            return (TemporalAccessor) value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Date) {
            return new java.sql.Timestamp(((Date) value).getTime()).toLocalDateTime();
        }
        return null;
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FieldPath)) {
            return false;
        }
        return path.equals(((FieldPath) obj).path);
    }

    @Override
    public String toString() {
        return path;
    }

}
