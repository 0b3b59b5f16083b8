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
package com.github.totyumengr.querycubes.web;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.github.totyumengr.querycubes.core.Coordinate;
import com.github.totyumengr.querycubes.core.Cube;
import com.github.totyumengr.querycubes.core.Dimension;
import com.github.totyumengr.querycubes.core.InvalidDimensionException;

/**
 * Parse the textual cube arguments of requests: dimension lists like <code>"instrument, firstname"</code> and
 * coordinates like <code>"instrument=piano, firstname=Bill"</code>.
 *
 * @author mengran
 *
 */
public final class CubeArguments {

    private static final Logger LOGGER = LoggerFactory.getLogger(CubeArguments.class);

    private static final Pattern COMMA = Pattern.compile("\\s*,\\s*");
    private static final Pattern EQUALS = Pattern.compile("\\s*=\\s*");

    private CubeArguments() {
        super();
    }

    /**
     * @param args comma separated names, may be <code>null</code>
     * @return names in order, empty ones dropped
     */
    public static List<String> names(String args) {

        if (!StringUtils.hasText(args)) {
            return Collections.emptyList();
        }
        List<String> names = new ArrayList<String>();
        for (String name : COMMA.split(args.trim())) {
            if (StringUtils.hasText(name)) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * @param args comma separated <code>name=value</code> pairs
     * @return name to textual value, in order
     * @throws IllegalArgumentException if a pair has no <code>=</code>
     */
    public static Map<String, String> pairs(String args) {

        Map<String, String> pairs = new LinkedHashMap<String, String>();
        for (String pair : names(args)) {
            String[] split = EQUALS.split(pair, 2);
            if (split.length != 2 || !StringUtils.hasText(split[0])) {
                throw new IllegalArgumentException("Coordinate " + pair + " is not in name=value form.");
            }
            pairs.put(split[0], split[1]);
        }
        return pairs;
    }

    /**
     * Resolve textual coordinates against the sample spaces of <code>cube</code>. A text matches a sample value
     * when it equals its string or pretty form.
     * @param cube cube to look at
     * @param args comma separated <code>name=value</code> pairs
     * @return coordinate, <code>null</code> if a value is not in the sample space of its dimension
     * @throws InvalidDimensionException if a name is not declared
     */
    public static Coordinate coordinate(Cube<?> cube, String args) {

        Coordinate coordinate = Coordinate.empty();
        for (Map.Entry<String, String> pair : pairs(args).entrySet()) {
            Dimension dimension = cube.getDimension(pair.getKey());
            Object value = sampleValue(dimension, pair.getValue());
            if (value == null) {
                LOGGER.debug("No value {} in sample space of {}", pair.getValue(), dimension);
                return null;
            }
            coordinate = coordinate.with(pair.getKey(), value);
        }
        return coordinate;
    }

    private static Object sampleValue(Dimension dimension, String text) {

        for (Object value : dimension.getSampleSpace()) {
            if (text.equals(String.valueOf(value)) || text.equals(dimension.pretty(value))) {
                return value;
            }
        }
        return null;
    }

    /**
     * @param cube cube to reduce
     * @param args comma separated dimension names
     * @param <M> measure type
     * @return sub-cube over the named dimensions, <code>cube</code> itself when no name is given or a name is not
     *  declared
     */
    public static <M> Cube<M> subcube(Cube<M> cube, String args) {

        List<String> names = names(args);
        if (names.isEmpty()) {
            return cube;
        }
        try {
            return cube.subcube(names, null);
        } catch (InvalidDimensionException e) {
            LOGGER.debug("Keep {} as {} is not declared.", cube, e.getDimensionName());
            return cube;
        }
    }

    /**
     * @param cube constrained cube
     * @param dimName dimension name
     * @return pretty form of the constraint of the dimension, <code>null</code> when free
     */
    public static String constraint(Cube<?> cube, String dimName) {
        return cube.getDimension(dimName).getPrettyConstraint();
    }

}
