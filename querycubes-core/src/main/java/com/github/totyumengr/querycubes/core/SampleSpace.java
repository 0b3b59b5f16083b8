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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import org.springframework.util.Assert;

/**
 * Where a {@link Dimension} takes its values from: an explicit collection, a function of the bound
 * {@link QuerySet}, or the distinct values of the dimension's field in that query set.
 *
 * @author mengran
 *
 */
public abstract class SampleSpace {

    private static final SampleSpace DISCOVERED = new Discovered();

    private SampleSpace() {
        super();
    }

    /**
     * @param values explicit values, copied
     * @return fixed sample space
     */
    public static SampleSpace of(Collection<?> values) {

        Assert.notNull(values, "Sample space values can not null.");
        return new Explicit(values);
    }

    public static SampleSpace derived(Function<QuerySet, ? extends Collection<?>> function) {

        Assert.notNull(function, "Sample space function can not null.");
        return new Derived(function);
    }

    /**
     * @return sample space made of the distinct values of the field, see {@link QuerySet#distinctValues(FieldPath)}
     */
    public static SampleSpace discovered() {
        return DISCOVERED;
    }

    /**
     * @param fieldPath field of the dimension
     * @param querySet bound query set, may be <code>null</code>
     * @return unsorted values
     */
    abstract Collection<?> resolve(FieldPath fieldPath, QuerySet querySet);

    static final class Explicit extends SampleSpace {

        private final List<Object> values;

        private Explicit(Collection<?> values) {
            this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
        }

        @Override
        Collection<?> resolve(FieldPath fieldPath, QuerySet querySet) {
            return values;
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Explicit && values.equals(((Explicit) obj).values);
        }

        @Override
        public String toString() {
            return "SampleSpace" + values;
        }
    }

    static final class Derived extends SampleSpace {

        private final Function<QuerySet, ? extends Collection<?>> function;

        private Derived(Function<QuerySet, ? extends Collection<?>> function) {
            this.function = function;
        }

        @Override
        Collection<?> resolve(FieldPath fieldPath, QuerySet querySet) {

            Collection<?> values = function.apply(querySet);
            return values == null ? Collections.emptyList() : values;
        }

        @Override
        public int hashCode() {
            return function.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Derived && function == ((Derived) obj).function;
        }

        @Override
        public String toString() {
            return "SampleSpace[derived]";
        }
    }

    static final class Discovered extends SampleSpace {

        @Override
        Collection<?> resolve(FieldPath fieldPath, QuerySet querySet) {

            if (querySet == null) {
                return Collections.emptyList();
            }
            return querySet.distinctValues(fieldPath);
        }

        @Override
        public String toString() {
            return "SampleSpace[discovered]";
        }
    }

}
