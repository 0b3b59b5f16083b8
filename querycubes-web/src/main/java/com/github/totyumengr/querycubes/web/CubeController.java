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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.util.StopWatch;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import com.github.totyumengr.querycubes.core.Coordinate;
import com.github.totyumengr.querycubes.core.Cube;
import com.github.totyumengr.querycubes.core.PivotTable;

/**
 * JSON views of the cubes of {@link CubeCatalog}.
 * @author mengran
 *
 */
@Controller
@RequestMapping("/cubes")
public class CubeController {

    private static final Logger LOGGER = LoggerFactory.getLogger(CubeController.class);

    private final CubeCatalog catalog;

    @Autowired
    public CubeController(CubeCatalog catalog) {
        this.catalog = catalog;
    }

    @RequestMapping(method = RequestMethod.GET)
    public @ResponseBody Collection<String> cubes() {
        return catalog.getNames();
    }

    /**
     * Pivot table of a cube.
     * @param cubeName cube
     * @param dimensions <code>"column dimension, row dimension"</code>
     * @return table as a dictionary
     */
    @RequestMapping(value = "/{cube}/table", method = RequestMethod.GET)
    public @ResponseBody Map<String, Object> table(@PathVariable("cube") String cubeName,
            @RequestParam(value = "dimensions", required = false) String dimensions) {

        Cube<?> cube = catalog.getCube(cubeName);
        List<String> names = CubeArguments.names(dimensions);
        if (names.size() != 2) {
            throw new IllegalArgumentException("You must provide two dimensions, columns first then rows: "
                    + dimensions);
        }

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        Map<String, Object> table = new LinkedHashMap<String, Object>();
        table.put("cube", cube.toString());
        table.putAll(PivotTable.of(cube, names.get(0), names.get(1)).toMap());
        stopWatch.stop();
        LOGGER.info("Success to build table of {} by {} using {}ms.", cubeName, names, stopWatch.getTotalTimeMillis());

        return table;
    }

    /**
     * @param cubeName cube
     * @param coords <code>"d1=v1, d2=v2"</code>
     * @return measure at the coordinates, empty body when a value is out of its sample space
     */
    @RequestMapping(value = "/{cube}/measure", method = RequestMethod.GET)
    public ResponseEntity<Object> measure(@PathVariable("cube") String cubeName,
            @RequestParam(value = "coords", required = false) String coords) {

        Cube<?> cube = catalog.getCube(cubeName);
        Coordinate coordinate = CubeArguments.coordinate(cube, coords);
        if (coordinate == null) {
            return ResponseEntity.ok().build();
        }
        Object measure = cube.measure(coordinate);
        LOGGER.debug("Measure of {} at {} is {}", cubeName, coordinate, measure);

        return ResponseEntity.ok(measure);
    }

    /**
     * Sub-cubes of a cube by dimensions, each as its pretty constraint and measure.
     * @param cubeName cube
     * @param by <code>"d1, d2"</code>
     * @return entries in sub-cube order
     */
    @RequestMapping(value = "/{cube}/subcubes", method = RequestMethod.GET)
    public @ResponseBody List<Map<String, Object>> subcubes(@PathVariable("cube") String cubeName,
            @RequestParam("by") String by) {

        Cube<?> cube = catalog.getCube(cubeName);
        List<String> names = CubeArguments.names(by);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("You must provide a dimension at least.");
        }
        return cube.subcubes(names).map(subcube -> {
            Map<String, Object> constraint = new LinkedHashMap<String, Object>();
            for (String name : names) {
                constraint.put(name, CubeArguments.constraint(subcube, name));
            }
            Map<String, Object> entry = new LinkedHashMap<String, Object>();
            entry.put("constraint", constraint);
            entry.put("measure", subcube.measure());
            return entry;
        }).collect(Collectors.toList());
    }

    /**
     * @param cubeName cube
     * @param dimensions <code>"d1, d2"</code>, an undeclared name keeps the whole cube
     * @return dimensions of the sub-cube and its measure dictionary over them
     */
    @RequestMapping(value = "/{cube}/subcube", method = RequestMethod.GET)
    public @ResponseBody Map<String, Object> subcube(@PathVariable("cube") String cubeName,
            @RequestParam(value = "dimensions", required = false) String dimensions) {

        Cube<?> subcube = CubeArguments.subcube(catalog.getCube(cubeName), dimensions);
        List<String> free = subcube.getFreeDimensions();

        Map<String, Object> result = new LinkedHashMap<String, Object>();
        result.put("cube", subcube.toString());
        result.put("dimensions", free);
        result.put("measures", subcube.measureDict(true, free.toArray(new String[0])));
        return result;
    }

    /**
     * @param cubeName cube
     * @param dimensions <code>"d1, d2"</code>, outermost first
     * @param full attach the measure at every level
     * @return nested measure dictionary
     */
    @RequestMapping(value = "/{cube}/measures", method = RequestMethod.GET)
    public @ResponseBody Map<Object, Object> measures(@PathVariable("cube") String cubeName,
            @RequestParam(value = "dimensions", required = false) String dimensions,
            @RequestParam(value = "full", required = false, defaultValue = "true") boolean full) {

        Cube<?> cube = catalog.getCube(cubeName);
        List<String> names = CubeArguments.names(dimensions);
        return cube.measureDict(full, names.toArray(new String[0]));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {

        LOGGER.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Collections.singletonMap("error", e.getMessage()));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, String>> notFound(NoSuchElementException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Collections.singletonMap("error", e.getMessage()));
    }

}
