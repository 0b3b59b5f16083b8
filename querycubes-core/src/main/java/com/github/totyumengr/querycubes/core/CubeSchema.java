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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.util.Assert;

/**
 * Shape of a cube: ordered dimension names and their {@link DimensionSpec templates}. Declare it once, then create
 * any number of independent cubes with {@link Cube#fromSchema(CubeSchema, QuerySet, Aggregation)}.
 *
 * @author mengran
 *
 */
public final class CubeSchema {

    private final Map<String, DimensionSpec> dimensions;

    private CubeSchema(LinkedHashMap<String, DimensionSpec> dimensions) {
        super();
        this.dimensions = Collections.unmodifiableMap(dimensions);
    }

    public static CubeSchemaBuilder builder() {
        return new CubeSchemaBuilder();
    }

    /**
     * @param fields field paths, each one is both name and field of a dimension
     * @return schema with discovered sample spaces
     */
    public static CubeSchema of(String... fields) {

        CubeSchemaBuilder builder = builder();
        for (String field : fields) {
            builder.dimension(field);
        }
        return builder.build();
    }

    public Map<String, DimensionSpec> getDimensions() {
        return dimensions;
    }

    @Override
    public String toString() {
        return "CubeSchema " + dimensions.keySet();
    }

    /**
     * Builder pattern class for {@link CubeSchema}, chain model end with {@link #build()}.
     * @author mengran
     *
     */
    public static class CubeSchemaBuilder {

        private final LinkedHashMap<String, DimensionSpec> dimensions = new LinkedHashMap<String, DimensionSpec>();

        private CubeSchemaBuilder() {
            super();
        }

        public CubeSchemaBuilder dimension(String name) {
            return dimension(name, DimensionSpec.named());
        }

        public CubeSchemaBuilder dimension(String name, DimensionSpec spec) {

            Assert.hasText(name, "Dimension name can not empty.");
            Assert.notNull(spec, "Dimension spec of " + name + " can not null.");
            if (dimensions.containsKey(name)) {
                throw new IllegalStateException("Dimension " + name + " has exists.");
            }
            dimensions.put(name, spec);
            return this;
        }

        public CubeSchemaBuilder dimensions(List<String> names) {

            for (String name : names) {
                dimension(name);
            }
            return this;
        }

        public CubeSchema build() {

            Assert.isTrue(dimensions.size() > 0, "Cube must have a dimension at least.");
            return new CubeSchema(new LinkedHashMap<String, DimensionSpec>(dimensions));
        }
    }

}
