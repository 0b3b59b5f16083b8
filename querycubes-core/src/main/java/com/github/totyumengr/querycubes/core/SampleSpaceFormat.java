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
 * Shape of {@link Cube#getSampleSpace(SampleSpaceFormat, String...)} elements.
 * @author mengran
 *
 */
public enum SampleSpaceFormat {

    /** {@link Coordinate} per point. */
    DICT,
    /** List of values per point, in the order dimensions were requested. */
    TUPLE,
    /** Raw values, only for exactly one dimension. */
    FLAT

}
