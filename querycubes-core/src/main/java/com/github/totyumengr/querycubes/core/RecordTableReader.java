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

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StopWatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.querycubes.core.RecordTable.RecordTableBuilder;

/**
 * Read {@link RecordTable}s from a JSON dataset:
 * <pre>
 * {"tables": [
 *   {"name": "musician", "fields": ["firstname", "instrument"], "label": "firstname",
 *    "relations": {"instrument": "instrument"}, "dates": ["born"],
 *    "records": [[1, "Miles", 1], ...]}
 * ]}
 * </pre>
 * First element of a record is its primary key. A relation field holds the primary key of a record of a table
 * declared before, a date field holds an ISO date.
 *
 * @author mengran
 *
 */
public final class RecordTableReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordTableReader.class);

    private final ObjectMapper objectMapper;

    public RecordTableReader(ObjectMapper objectMapper) {
        super();
        this.objectMapper = objectMapper;
    }

    public RecordTableReader() {
        this(new ObjectMapper());
    }

    /**
     * @param in JSON dataset, not closed
     * @return tables by name, in declaration order
     * @throws IOException if not a JSON document
     */
    public Map<String, RecordTable> read(InputStream in) throws IOException {
        return read(objectMapper.readTree(in));
    }

    /**
     * @param root dataset document
     * @return tables by name, in declaration order
     */
    public Map<String, RecordTable> read(JsonNode root) {

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        Map<String, RecordTable> tables = new LinkedHashMap<String, RecordTable>();
        JsonNode tableNodes = root.path("tables");
        if (!tableNodes.isArray()) {
            throw new IllegalArgumentException("Dataset need a tables array.");
        }
        for (JsonNode tableNode : tableNodes) {
            RecordTable table = readTable(tableNode, tables);
            if (tables.containsKey(table.getName())) {
                throw new IllegalStateException("Table " + table.getName() + " has exists.");
            }
            tables.put(table.getName(), table);
        }
        stopWatch.stop();
        LOGGER.info("Read {} tables {} in {} ms.", tables.size(), tables.keySet(), stopWatch.getTotalTimeMillis());

        return tables;
    }

    private RecordTable readTable(JsonNode tableNode, Map<String, RecordTable> declared) {

        String name = tableNode.path("name").asText();
        List<String> fields = texts(tableNode.path("fields"));
        Set<String> dates = new HashSet<String>(texts(tableNode.path("dates")));
        Map<String, RecordTable> relations = new LinkedHashMap<String, RecordTable>();
        Iterator<Map.Entry<String, JsonNode>> it = tableNode.path("relations").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> relation = it.next();
            RecordTable related = declared.get(relation.getValue().asText());
            if (related == null) {
                throw new IllegalArgumentException("Relation " + name + "." + relation.getKey()
                        + " refers to undeclared table " + relation.getValue().asText());
            }
            relations.put(relation.getKey(), related);
        }

        RecordTableBuilder builder = new RecordTableBuilder().build(name).addFields(fields);
        relations.forEach(builder::addRelation);
        if (tableNode.hasNonNull("label")) {
            builder.labelBy(tableNode.get("label").asText());
        }
        for (JsonNode recordNode : tableNode.path("records")) {
            Integer primaryKey = recordNode.path(0).asInt();
            List<Object> values = new ArrayList<Object>(fields.size());
            for (int i = 0; i < fields.size(); i++) {
                values.add(value(fields.get(i), recordNode.path(i + 1), relations, dates));
            }
            builder.addRecord(primaryKey, values);
        }
        return builder.done();
    }

    private static Object value(String field, JsonNode node, Map<String, RecordTable> relations, Set<String> dates) {

        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        RecordTable related = relations.get(field);
        if (related != null) {
            RecordTable.Row row = related.getRow(node.asInt());
            if (row == null) {
                throw new IllegalArgumentException("No record " + node.asInt() + " in " + related.getName());
            }
            return row;
        }
        if (dates.contains(field)) {
            return LocalDate.parse(node.asText());
        }
        if (node.isIntegralNumber()) {
            return node.isInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    private static List<String> texts(JsonNode array) {

        if (!array.isArray()) {
            return Collections.emptyList();
        }
        List<String> texts = new ArrayList<String>(array.size());
        for (JsonNode node : array) {
            texts.add(node.asText());
        }
        return texts;
    }

}
