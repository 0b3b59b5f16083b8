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
import java.util.function.Function;

import org.springframework.util.Assert;

/**
 * Template of a {@link Dimension}, declared once in a {@link CubeSchema} and bound to a query set every time a
 * {@link Cube} is created from the schema. Instances are immutable, <code>with*</code> methods return copies.
 *
 * @author mengran
 *
 */
public final class DimensionSpec {

    private static final Function<Object, String> TO_STRING = new Function<Object, String>() {
        @Override
        public String apply(Object t) {
            return String.valueOf(t);
        }
    };

    private final String field;
    private final SampleSpace sampleSpace;
    private final QuerySet querySet;
    private final Function<Object, String> prettyPrinter;

    private DimensionSpec(String field, SampleSpace sampleSpace, QuerySet querySet,
            Function<Object, String> prettyPrinter) {
        super();
        this.field = field;
        this.sampleSpace = sampleSpace;
        this.querySet = querySet;
        this.prettyPrinter = prettyPrinter;
    }

    /**
     * @return spec whose field path is the dimension name
     */
    public static DimensionSpec named() {
        return new DimensionSpec(null, SampleSpace.discovered(), null, TO_STRING);
    }

    public static DimensionSpec field(String field) {

        Assert.hasText(field, "Dimension field can not empty.");
        FieldPath.parse(field);
        return new DimensionSpec(field, SampleSpace.discovered(), null, TO_STRING);
    }

    public DimensionSpec withSampleSpace(SampleSpace sampleSpace) {

        Assert.notNull(sampleSpace, "Sample space can not null.");
        return new DimensionSpec(field, sampleSpace, querySet, prettyPrinter);
    }

    public DimensionSpec withSampleSpace(Collection<?> values) {
        return withSampleSpace(SampleSpace.of(values));
    }

    /**
     * @param querySet query set the dimension discovers its sample space from, instead of the cube's one
     * @return copy with its own query set
     */
    public DimensionSpec withQuerySet(QuerySet querySet) {
        return new DimensionSpec(field, sampleSpace, querySet, prettyPrinter);
    }

    public DimensionSpec withPrettyPrinter(Function<Object, String> prettyPrinter) {

        Assert.notNull(prettyPrinter, "Pretty printer can not null.");
        return new DimensionSpec(field, sampleSpace, querySet, prettyPrinter);
    }

    public String getField() {
        return field;
    }

    public SampleSpace getSampleSpace() {
        return sampleSpace;
    }

    public QuerySet getQuerySet() {
        return querySet;
    }

    public Function<Object, String> getPrettyPrinter() {
        return prettyPrinter;
    }

    @Override
    public String toString() {
        return "DimensionSpec [field=" + field + ", sampleSpace=" + sampleSpace + "]";
    }

}
