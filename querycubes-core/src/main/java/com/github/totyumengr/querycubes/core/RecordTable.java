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

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

/**
 * In-memory table of records, the default {@link QuerySet} backend. A field value may be a {@link Row} of another
 * table, which is how relations are modelled: <code>instrument__name</code> on a musician follows its instrument
 * row to the <code>name</code> field.
 *
 * <p>Exact lookups on top-level fields are answered from a bitmap index, see
 * <a href="https://github.com/lemire/RoaringBitmap">RoaringBitmap</a>.
 *
 * @author mengran
 *
 */
public class RecordTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordTable.class);

    Meta meta;

    private Map<Integer, Row> rows;

    /**
     * Bitmap index for speed up filtering. Key is {@link #indexKey(String, Object)}.
     */
    private Map<String, RoaringBitmap> bitmapIndex = new HashMap<String, RoaringBitmap>();

    private RoaringBitmap allIds = new RoaringBitmap();

    static class Meta {

        String name;
        /**
         * Field whose value renders a row, <code>null</code> renders <code>name#id</code>.
         */
        String labelField;
        private LinkedHashMap<String, Integer> fieldNames = new LinkedHashMap<String, Integer>();
        /**
         * Relation field to the table of its rows.
         */
        private Map<String, RecordTable> relations = new LinkedHashMap<String, RecordTable>();

        @Override
        public String toString() {
            return "Meta [name=" + name + ", fieldNames=" + fieldNames.keySet() + ", relations="
                    + relations.keySet() + "]";
        }
    }

    /**
     * Holding detail data, filter and aggregation target object.
     * @author mengran
     *
     */
    public class Row implements Entity {

        private final int id;     // Equal to PK.

        private Object[] values = null;

        private Row(int id) {
            super();
            this.id = id;
        }

        public int getId() {
            return id;
        }

        @Override
        public Integer getPrimaryKey() {
            return id;
        }

        public RecordTable getTable() {
            return RecordTable.this;
        }

        /**
         * @param fieldName field of the table
         * @return value, may be <code>null</code>
         * @throws InvalidFieldException if the table has no such field
         */
        public Object get(String fieldName) {
            return values[RecordTable.this.getFieldIndex(fieldName)];
        }

        @Override
        public String toString() {

            if (meta.labelField != null) {
                return String.valueOf(get(meta.labelField));
            }
            return meta.name + "#" + id;
        }

    }

    private RecordTable(String name) {
        // Internal
        Meta meta = new Meta();
        meta.name = name;
        Assert.hasText(name, "Table name can not empty.");

        this.meta = meta;
        this.rows = new LinkedHashMap<Integer, Row>();
    }

    /**
     * Builder pattern class for {@link RecordTable}, chain model begin with {@link #build(String)}
     * and end with {@link #done()}.
     *
     * @author mengran
     *
     */
    public static class RecordTableBuilder {

        private RecordTable current;

        public RecordTableBuilder build(String name) {

            if (current != null) {
                throw new IllegalStateException("Previous building " + current + " is doing call #done to finish it.");
            }
            current = new RecordTable(name);
            return this;
        }

        public RecordTableBuilder addFields(List<String> fieldNames) {

            RecordTable table = current();
            for (String fieldName : fieldNames) {
                Assert.hasText(fieldName, "Field name can not empty.");
                if (fieldName.contains(FieldPath.SEPARATOR) || fieldName.contains(".")) {
                    throw new IllegalArgumentException("Field name " + fieldName + " can not contain a separator.");
                }
                if (table.meta.fieldNames.containsKey(fieldName)) {
                    throw new IllegalStateException("Field " + fieldName + " has exists.");
                }
                table.meta.fieldNames.put(fieldName, table.meta.fieldNames.size());
            }
            return this;
        }

        public RecordTableBuilder labelBy(String fieldName) {

            RecordTable table = current();
            table.getFieldIndex(fieldName);
            table.meta.labelField = fieldName;
            return this;
        }

        /**
         * Declare <code>fieldName</code> as a relation: its values are rows of <code>related</code>.
         * @param fieldName added field
         * @param related table of the field values
         * @return this builder
         */
        public RecordTableBuilder addRelation(String fieldName, RecordTable related) {

            RecordTable table = current();
            table.getFieldIndex(fieldName);
            Assert.notNull(related, "Related table can not null.");
            RecordTable declared = table.meta.relations.get(fieldName);
            if (declared != null && declared != related) {
                throw new IllegalStateException("Field " + fieldName + " has related to " + declared.getName());
            }
            table.meta.relations.put(fieldName, related);
            return this;
        }

        public RecordTableBuilder addRecord(Integer primaryKey, List<?> values) {

            RecordTable table = current();
            Assert.notNull(primaryKey, "Primary key can not null.");
            Assert.isTrue(table.meta.fieldNames.size() > 0, "Table must have a field at least.");
            if (values.size() != table.meta.fieldNames.size()) {
                throw new IllegalArgumentException("Record " + primaryKey + " has " + values.size()
                        + " values but table " + table.meta.name + " has " + table.meta.fieldNames.size() + " fields.");
            }
            if (table.rows.containsKey(primaryKey)) {
                throw new IllegalStateException("Record " + primaryKey + " has exists.");
            }

            Row row = table.new Row(primaryKey);
            row.values = values.toArray(new Object[0]);
            // Rows of other tables make their field a relation
            for (Entry<String, Integer> field : table.meta.fieldNames.entrySet()) {
                Object value = row.values[field.getValue()];
                if (value instanceof Row) {
                    addRelation(field.getKey(), ((Row) value).getTable());
                }
            }
            table.rows.put(primaryKey, row);
            table.allIds.add(primaryKey);

            // Index field values
            for (Entry<String, Integer> field : table.meta.fieldNames.entrySet()) {
                String key = indexKey(field.getKey(), row.values[field.getValue()]);
                RoaringBitmap bitmap = table.bitmapIndex.get(key);
                if (bitmap == null) {
                    bitmap = new RoaringBitmap();
                    table.bitmapIndex.put(key, bitmap);
                }
                bitmap.add(primaryKey);
            }
            return this;
        }

        public RecordTable done() {

            RecordTable table = current();
            current = null;

            StopWatch stopWatch = new StopWatch();
            stopWatch.start();
            long usedBytes = 0;
            for (RoaringBitmap bitmap : table.bitmapIndex.values()) {
                bitmap.runOptimize();
                usedBytes = usedBytes + bitmap.getSizeInBytes();
            }
            stopWatch.stop();
            LOGGER.info("Build completed: name {} with {} fields and {} records, {} indexes used {} kb in {} ms.",
                    table.meta.name, table.meta.fieldNames.size(), table.rows.size(), table.bitmapIndex.size(),
                    usedBytes / 1024, stopWatch.getTotalTimeMillis());

            return table;
        }

        private RecordTable current() {

            if (current == null) {
                throw new IllegalStateException("Current building is not started, call #build first.");
            }
            return current;
        }
    }

    static String indexKey(String fieldName, Object value) {

        if (value == null) {
            return fieldName + ":null";
        }
        if (value instanceof Row) {
            Row row = (Row) value;
            return fieldName + ":" + row.getTable().getName() + "#" + row.getId();
        }
        return fieldName + ":" + value.getClass().getName() + ":" + value;
    }

    /**
     * @param fieldName top-level field
     * @param value exact value
     * @return ids of the records whose field equals <code>value</code>, empty bitmap when none
     */
    RoaringBitmap index(String fieldName, Object value) {

        getFieldIndex(fieldName);
        RoaringBitmap bitmap = bitmapIndex.get(indexKey(fieldName, value));
        return bitmap == null ? new RoaringBitmap() : bitmap;
    }

    /**
     * @return all records of the table as a query set
     */
    public RecordSet all() {
        return new RecordSet(this, allIds.clone());
    }

    public String getName() {
        return meta.name;
    }

    public Set<String> getFieldNames() {
        return Collections.unmodifiableSet(meta.fieldNames.keySet());
    }

    public boolean hasField(String fieldName) {
        return fieldName != null && meta.fieldNames.containsKey(fieldName);
    }

    /**
     * @param fieldName field of the table
     * @return table of the field values, <code>null</code> if the field is not a relation
     */
    public RecordTable getRelation(String fieldName) {
        return meta.relations.get(fieldName);
    }

    /**
     * @param primaryKey id of a record
     * @return record, <code>null</code> if not found
     */
    public Row getRow(int primaryKey) {
        return rows.get(primaryKey);
    }

    public Collection<Row> getRows() {
        return Collections.unmodifiableCollection(rows.values());
    }

    /**
     * Field index by search {@link #meta}.
     * @param fieldName field name
     * @return field index of the table
     * @throws InvalidFieldException if field name is empty or invalid.
     */
    public int getFieldIndex(String fieldName) throws InvalidFieldException {

        Integer index = fieldName == null ? null : meta.fieldNames.get(fieldName);
        if (index == null) {
            throw new InvalidFieldException(String.valueOf(fieldName), String.valueOf(fieldName), meta.name);
        }
        return index;
    }

    @Override
    public String toString() {
        return "RecordTable [meta=" + meta + ", records=" + rows.size() + "]";
    }

}
