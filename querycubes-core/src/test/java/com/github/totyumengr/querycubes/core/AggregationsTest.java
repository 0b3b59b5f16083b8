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

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

/**
 * @author mengran
 *
 */
public class AggregationsTest {

    private static JazzFixture jazz;

    @BeforeClass
    public static void prepare() throws Throwable {
        jazz = JazzFixture.load();
    }

    @Test
    public void testCount() {

        Assert.assertEquals(Integer.valueOf(6), Aggregations.count().aggregate(jazz.songs.all()));
        Assert.assertEquals(Integer.valueOf(0), Aggregations.count().onEmpty());
    }

    @Test
    public void testSum() {

        Aggregation<BigDecimal> plays = Aggregations.sum("plays");
        Assert.assertEquals(new BigDecimal("285.50000000"), plays.aggregate(jazz.songs.all()));
        Assert.assertEquals(Aggregations.IND_SCALE, plays.onEmpty().scale());

        Cube<BigDecimal> cube = Cube.builder(jazz.songs.all(), plays)
                .dimension("author", DimensionSpec.field("author__firstname")).build();
        Assert.assertEquals(new BigDecimal("200.00000000"), cube.measure(Coordinate.of("author", "Miles")));
        // null plays are skipped
        Assert.assertEquals(new BigDecimal("30.00000000"), cube.measure(Coordinate.of("author", "Thelonious")));
        Assert.assertEquals(BigDecimal.ZERO.setScale(Aggregations.IND_SCALE),
                cube.measure(Coordinate.of("author", "Erroll")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSumNeedsRecordSet() {

        QuerySet foreign = new QuerySet() {

            @Override
            public QuerySet filter(Map<String, ?> lookups) {
                return this;
            }

            @Override
            public List<Object> distinctValues(FieldPath fieldPath) {
                return Collections.emptyList();
            }

            @Override
            public int count() {
                return 0;
            }
        };
        Aggregations.sum("plays").aggregate(foreign);
    }

    @Test
    public void testDistinctCount() {

        Assert.assertEquals(Integer.valueOf(4), Aggregations.distinctCount("author").aggregate(jazz.songs.all()));
        Cube<Integer> cube = Cube.builder(jazz.songs.all(), Aggregations.distinctCount("release_date__absmonth"))
                .dimension("instrument", DimensionSpec.field("author__instrument__name")).build();
        Assert.assertEquals(Integer.valueOf(3), cube.measure(Coordinate.of("instrument", "piano")));
    }

}
