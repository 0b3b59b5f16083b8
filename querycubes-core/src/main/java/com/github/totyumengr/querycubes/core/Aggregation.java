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

/**
 * Measure function of a {@link Cube}, it receives the filtered {@link QuerySet} and calculates a scalar on it.
 *
 * @param <M> measure type
 * @author mengran
 *
 * @see Aggregations
 */
@FunctionalInterface
public interface Aggregation<M> {

    M aggregate(QuerySet querySet);

    /**
     * Stock {@link Aggregations} report <code>0</code> on empty cells. A lambda has no zero of its own type, so it
     * keeps <code>null</code> unless the cube is given one with {@link Cube.CubeBuilder#measureOnEmpty(Object)} or
     * {@link Cube#withMeasureOnEmpty(Object)}.
     * @return value a cube reports when {@link #aggregate(QuerySet)} gives <code>null</code>. <code>null</code> means
     *  no substitution.
     */
    default M onEmpty() {
        return null;
    }

}
