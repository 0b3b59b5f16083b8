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

import java.util.List;
import java.util.Map;

/**
 * The queryable collection a {@link Cube} aggregates over. Implementations are immutable: {@link #filter(Map)}
 * returns a new collection and leaves the receiver untouched.
 *
 * <p>Lookup keys are field paths (see {@link FieldPath}) optionally ending with an operator segment:
 * <code>exact</code> (default), <code>in</code>, <code>gt</code>, <code>gte</code>, <code>lt</code>, <code>lte</code>,
 * or a date component <code>year</code>, <code>month</code>, <code>day</code>.
 *
 * @author mengran
 *
 */
public interface QuerySet {

    /**
     * Filtering twice is equal to filtering once with all lookups of both calls.
     * @param lookups field lookup and its expected value
     * @return sub-collection matching <b>all</b> lookups
     * @throws InvalidFieldException if a lookup does not resolve against the record type
     */
    QuerySet filter(Map<String, ?> lookups);

    /**
     * @param fieldPath path to values
     * @return distinct, non-null values taken by the field over this collection, in no particular order
     * @throws InvalidFieldException if the path does not resolve against the record type
     */
    List<Object> distinctValues(FieldPath fieldPath);

    /**
     * @return number of records in this collection
     */
    int count();

}
