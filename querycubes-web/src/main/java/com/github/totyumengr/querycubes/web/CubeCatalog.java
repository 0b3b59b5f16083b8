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

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.querycubes.core.Aggregation;
import com.github.totyumengr.querycubes.core.Aggregations;
import com.github.totyumengr.querycubes.core.Cube;
import com.github.totyumengr.querycubes.core.Cube.CubeBuilder;
import com.github.totyumengr.querycubes.core.DimensionSpec;
import com.github.totyumengr.querycubes.core.RecordSet;
import com.github.totyumengr.querycubes.core.RecordTable;
import com.github.totyumengr.querycubes.core.RecordTableReader;

/**
 * Named cubes declared by the dataset at <code>querycubes.dataset</code>. Besides its <code>tables</code>, the
 * dataset declares
 * <pre>
 * "cubes": [
 *   {"name": "songs", "table": "song", "aggregation": "sum:plays", "filter": {"plays__gt": 0},
 *    "dimensions": [{"name": "year", "field": "release_date__year"}, {"name": "author", "sampleSpace": [...]}]}
 * ]
 * </pre>
 * Aggregation is one of <code>count</code>, <code>sum:{field}</code> or <code>distinctCount:{field}</code>.
 *
 * @author mengran
 *
 */
@Component
public class CubeCatalog {

    private static final Logger LOGGER = LoggerFactory.getLogger(CubeCatalog.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Map<String, Cube<?>> cubes = new LinkedHashMap<String, Cube<?>>();

    public CubeCatalog(@Value("${querycubes.dataset}") Resource dataset) throws IOException {

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        JsonNode root;
        try (InputStream in = dataset.getInputStream()) {
            root = objectMapper.readTree(in);
        }
        Map<String, RecordTable> tables = new RecordTableReader(objectMapper).read(root);
        for (JsonNode cubeNode : root.path("cubes")) {
            String name = cubeNode.path("name").asText();
            if (cubes.containsKey(name)) {
                throw new IllegalStateException("Cube " + name + " has exists.");
            }
            cubes.put(name, cube(cubeNode, tables));
        }
        stopWatch.stop();
        LOGGER.info("Load {} cubes {} from {} in {} ms.", cubes.size(), cubes.keySet(), dataset,
                stopWatch.getTotalTimeMillis());
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(cubes.keySet());
    }

    /**
     * @param name cube name
     * @return declared cube, all dimensions free
     * @throws NoSuchElementException if no cube of the name
     */
    public Cube<?> getCube(String name) {

        Cube<?> cube = cubes.get(name);
        if (cube == null) {
            throw new NoSuchElementException("No cube " + name + " in " + cubes.keySet());
        }
        return cube;
    }

    private Cube<?> cube(JsonNode cubeNode, Map<String, RecordTable> tables) {

        String tableName = cubeNode.path("table").asText();
        RecordTable table = tables.get(tableName);
        if (table == null) {
            throw new IllegalArgumentException("Cube " + cubeNode.path("name").asText() + " refers to undeclared table "
                    + tableName);
        }
        RecordSet records = table.all();
        if (cubeNode.has("filter")) {
            Map<String, Object> lookups = objectMapper.convertValue(cubeNode.get("filter"),
                    new TypeReference<LinkedHashMap<String, Object>>() {});
            records = records.filter(lookups);
        }
        return cube(records, aggregation(cubeNode.path("aggregation").asText("count")), cubeNode.path("dimensions"));
    }

    private <M> Cube<M> cube(RecordSet records, Aggregation<M> aggregation, JsonNode dimensionNodes) {

        CubeBuilder<M> builder = Cube.builder(records, aggregation);
        for (JsonNode dimensionNode : dimensionNodes) {
            DimensionSpec spec = dimensionNode.hasNonNull("field")
                    ? DimensionSpec.field(dimensionNode.get("field").asText()) : DimensionSpec.named();
            if (dimensionNode.has("sampleSpace")) {
                List<Object> values = objectMapper.convertValue(dimensionNode.get("sampleSpace"),
                        new TypeReference<List<Object>>() {});
                spec = spec.withSampleSpace(values);
            }
            builder.dimension(dimensionNode.path("name").asText(), spec);
        }
        return builder.build();
    }

    static Aggregation<?> aggregation(String declaration) {

        int colon = declaration.indexOf(':');
        String function = colon < 0 ? declaration : declaration.substring(0, colon);
        String field = colon < 0 ? null : declaration.substring(colon + 1).trim();
        switch (function.trim()) {
        case "count":
            return Aggregations.count();
        case "sum":
            return Aggregations.sum(field);
        case "distinctCount":
            return Aggregations.distinctCount(field);
        default:
            throw new IllegalArgumentException("Unknown aggregation " + declaration);
        }
    }

}
