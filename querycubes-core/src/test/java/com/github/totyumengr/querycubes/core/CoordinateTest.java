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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.Assert;
import org.junit.Test;

/**
 * @author mengran
 *
 */
public class CoordinateTest {

    @Test
    public void testEqualityIgnoresOrder() {

        Map<String, Object> xy = new LinkedHashMap<String, Object>();
        xy.put("x", 1);
        xy.put("y", 2);
        Map<String, Object> yx = new LinkedHashMap<String, Object>();
        yx.put("y", 2);
        yx.put("x", 1);

        Coordinate a = Coordinate.of(xy);
        Coordinate b = Coordinate.of(yx);
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertEquals(a, Coordinate.of("y", 2).with("x", 1));
        Assert.assertEquals(xy, a);
        Assert.assertNotEquals(a, Coordinate.of("x", 1));
    }

    @Test
    public void testToString() {
        Assert.assertEquals("Coordinate(a=1, b=Miles)", Coordinate.of("b", "Miles").with("a", 1).toString());
        Assert.assertEquals("Coordinate()", Coordinate.empty().toString());
    }

    @Test
    public void testValueOf() {

        Coordinate coordinate = Coordinate.of("firstname", "Miles");
        Assert.assertEquals("Miles", coordinate.valueOf("firstname"));
        Assert.assertNull(coordinate.get("lastname"));
        try {
            coordinate.valueOf("lastname");
            Assert.fail();
        } catch (NoSuchElementException e) {
            Assert.assertTrue(e.getMessage().contains("lastname"));
        }
    }

    @Test
    public void testWithLeavesOriginal() {

        Coordinate miles = Coordinate.of("firstname", "Miles");
        Coordinate milesOnTrumpet = miles.with("instrument", "trumpet");
        Assert.assertEquals(1, miles.size());
        Assert.assertEquals(2, milesOnTrumpet.size());
        Assert.assertEquals(Coordinate.of("firstname", "Bill"), miles.with("firstname", "Bill"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testPut() {
        Coordinate.of("firstname", "Miles").put("firstname", "Bill");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testRemove() {
        Coordinate.of("firstname", "Miles").remove("firstname");
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testEntrySetIsReadOnly() {
        Coordinate.of("firstname", "Miles").entrySet().clear();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullValue() {
        Coordinate.of("firstname", null);
    }

}
