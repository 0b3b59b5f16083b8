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

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

/**
 * @author mengran
 *
 */
public class CubeSchemaTest {

    private static JazzFixture jazz;

    @BeforeClass
    public static void prepare() throws Throwable {
        jazz = JazzFixture.load();
    }

    @Test
    public void testManyCubesFromOneSchema() {

        CubeSchema schema = CubeSchema.builder()
                .dimension("instrument", DimensionSpec.field("instrument__name"))
                .dimension("firstname")
                .build();
        Assert.assertEquals(Arrays.asList("instrument", "firstname"),
                schema.getDimensions().keySet().stream().collect(Collectors.toList()));

        Cube<Integer> all = Cube.fromSchema(schema, jazz.musicians.all(), Aggregations.count());
        Cube<Integer> pianists = Cube.fromSchema(schema,
                jazz.musicians.all().filter(Collections.singletonMap("instrument__name", "piano")),
                Aggregations.count());

        Assert.assertEquals(Arrays.asList("instrument", "firstname"), all.getFreeDimensions());
        Assert.assertEquals(6, (int) all.measure());
        Assert.assertEquals(3, (int) pianists.measure());
        Assert.assertEquals(Arrays.asList("piano"), pianists.getSampleSpace("instrument"));
        Assert.assertEquals(3, all.getSampleSpace("instrument").size());

        Cube<Integer> miles = all.constrain("firstname", "Miles");
        Assert.assertTrue(all.getConstraint().isEmpty());
        Assert.assertEquals("Miles", miles.getConstraint().get("firstname"));
    }

    @Test
    public void testOf() {

        CubeSchema schema = CubeSchema.of("firstname", "instrument__name");
        Assert.assertEquals("instrument__name", Cube.fromSchema(schema, jazz.musicians.all(), Aggregations.count())
                .getDimension("instrument__name").getFieldPath().getPath());
    }

    @Test(expected = IllegalStateException.class)
    public void testDuplicatedDimension() {
        CubeSchema.builder().dimension("firstname").dimension("firstname");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoDimension() {
        CubeSchema.builder().build();
    }

}
