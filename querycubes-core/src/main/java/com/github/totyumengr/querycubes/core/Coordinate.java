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

import java.util.AbstractMap;
import java.util.Collections;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;

import org.springframework.util.Assert;

/**
 * A point of a cube's sample space: dimension name to value. Keys iterate sorted, so two coordinates built from
 * the same pairs in a different order are equal, hash the same and print the same.
 *
 * <p>Read-only, every mutator of {@link Map} throws {@link UnsupportedOperationException}.
 *
 * @author mengran
 *
 */
public final class Coordinate extends AbstractMap<String, Object> {

    private static final Coordinate EMPTY = new Coordinate(new TreeMap<String, Object>());

    private final TreeMap<String, Object> pairs;

    private Coordinate(TreeMap<String, Object> pairs) {
        super();
        this.pairs = pairs;
    }

    public static Coordinate of(Map<String, ?> pairs) {

        Assert.notNull(pairs, "Coordinate pairs can not null.");
        TreeMap<String, Object> sorted = new TreeMap<String, Object>();
        for (Entry<String, ?> e : pairs.entrySet()) {
            Assert.hasText(e.getKey(), "Coordinate key can not empty.");
            Assert.notNull(e.getValue(), "Coordinate value of " + e.getKey() + " can not null.");
            sorted.put(e.getKey(), e.getValue());
        }
        return new Coordinate(sorted);
    }

    public static Coordinate of(String name, Object value) {
        return of(Collections.singletonMap(name, value));
    }

    public static Coordinate empty() {
        return EMPTY;
    }

    /**
     * @param name dimension name
     * @param value dimension value
     * @return a new coordinate with one more pair
     */
    public Coordinate with(String name, Object value) {

        TreeMap<String, Object> copy = new TreeMap<String, Object>(pairs);
        copy.put(name, value);
        return of(copy);
    }

    /**
     * @param name dimension name
     * @return value of the dimension
     * @throws NoSuchElementException if this coordinate has no such dimension
     */
    public Object valueOf(String name) {

        Object value = name == null ? null : pairs.get(name);
        if (value == null) {
            throw new NoSuchElementException("No value of " + name + " in " + this);
        }
        return value;
    }

    @Override
    public Set<Entry<String, Object>> entrySet() {
        return Collections.unmodifiableMap(pairs).entrySet();
    }

    @Override
    public Object get(Object key) {
        return key instanceof String ? pairs.get(key) : null;
    }

    @Override
    public boolean containsKey(Object key) {
        return key instanceof String && pairs.containsKey(key);
    }

    @Override
    public int size() {
        return pairs.size();
    }

    @Override
    public Object put(String key, Object value) {
        throw new UnsupportedOperationException("Coordinate is read-only.");
    }

    @Override
    public Object remove(Object key) {
        throw new UnsupportedOperationException("Coordinate is read-only.");
    }

    @Override
    public void clear() {
        throw new UnsupportedOperationException("Coordinate is read-only.");
    }

    // equals and hashCode of AbstractMap do not depend on iteration order

    @Override
    public String toString() {

        StringBuilder sb = new StringBuilder("Coordinate(");
        boolean first = true;
        for (Entry<String, Object> e : pairs.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }

}
