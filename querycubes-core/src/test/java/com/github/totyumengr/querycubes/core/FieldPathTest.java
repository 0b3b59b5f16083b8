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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.github.totyumengr.querycubes.core.FieldPath.CalendarGranularity;

/**
 * @author mengran
 *
 */
public class FieldPathTest {

    @Test
    public void testParse() {

        FieldPath path = FieldPath.parse("author__instrument__name");
        Assert.assertEquals(Arrays.asList("author", "instrument", "name"), path.getSegments());
        Assert.assertNull(path.getCalendarGranularity());
        Assert.assertEquals(path, FieldPath.parse("author.instrument.name"));
        Assert.assertEquals("author__instrument__name", FieldPath.parse("author.instrument.name").getPath());
    }

    @Test
    public void testCalendarGranularity() {

        FieldPath month = FieldPath.parse("release_date__absmonth");
        Assert.assertEquals(CalendarGranularity.MONTH, month.getCalendarGranularity());
        Assert.assertEquals(Collections.singletonList("release_date"), month.getSegments());
        Assert.assertEquals("release_date", month.getBaseLookup());

        FieldPath day = FieldPath.parse("song__release_date__absday");
        Assert.assertEquals(CalendarGranularity.DAY, day.getCalendarGranularity());
        Assert.assertEquals("song__release_date", day.getBaseLookup());
    }

    @Test
    public void testToLookups() {

        Map<String, Object> month = new LinkedHashMap<String, Object>();
        month.put("release_date__year", 1959);
        month.put("release_date__month", 8);
        Assert.assertEquals(month, FieldPath.parse("release_date__absmonth").toLookups(LocalDate.of(1959, 8, 17)));

        Map<String, Object> day = new LinkedHashMap<String, Object>(month);
        day.put("release_date__day", 17);
        Assert.assertEquals(day,
                FieldPath.parse("release_date__absday").toLookups(LocalDateTime.of(1959, 8, 17, 20, 0)));

        Assert.assertEquals(Collections.singletonMap("firstname", "Miles"),
                FieldPath.parse("firstname").toLookups("Miles"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptySegment() {
        FieldPath.parse("author____name");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGranularityWithoutField() {
        FieldPath.parse("absmonth");
    }

}
