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
import java.math.RoundingMode;

import org.springframework.util.Assert;

/**
 * <p>Stock {@link Aggregation aggregations}.
 * @author mengran
 *
 */
public final class Aggregations {

    /**
     * Calculation scale
     */
    public static final int IND_SCALE = 8;

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(IND_SCALE, RoundingMode.HALF_UP);

    private Aggregations() {
        super();
    }

    /**
     * It equal to "SELECT COUNT(*) FROM {query set}".
     * @return record count aggregation
     */
    public static Aggregation<Integer> count() {

        return new Aggregation<Integer>() {

            @Override
            public Integer aggregate(QuerySet querySet) {
                return querySet.count();
            }

            @Override
            public Integer onEmpty() {
                return 0;
            }

            @Override
            public String toString() {
                return "count";
            }
        };
    }

    /**
     * It equal to "SELECT COUNT(DISTINCT {fieldPath}) FROM {query set}".
     * @param fieldPath field to count
     * @return distinct count aggregation
     */
    public static Aggregation<Integer> distinctCount(String fieldPath) {

        FieldPath path = FieldPath.parse(fieldPath);
        return new Aggregation<Integer>() {

            @Override
            public Integer aggregate(QuerySet querySet) {
                return querySet.distinctValues(path).size();
            }

            @Override
            public Integer onEmpty() {
                return 0;
            }

            @Override
            public String toString() {
                return "distinctCount(" + path + ")";
            }
        };
    }

    /**
     * Sum calculation of given field. It equal to "SELECT SUM({fieldPath}) FROM {record set}", <code>null</code>
     * values are skipped.
     * @param fieldPath numeric field to sum
     * @return sum aggregation formated using {@value #IND_SCALE}, only for {@link RecordSet}
     */
    public static Aggregation<BigDecimal> sum(String fieldPath) {

        FieldPath.parse(fieldPath);
        return new Aggregation<BigDecimal>() {

            @Override
            public BigDecimal aggregate(QuerySet querySet) {

                Assert.isInstanceOf(RecordSet.class, querySet, "Sum is supported on record sets only.");
                return ((RecordSet) querySet).values(fieldPath).filter(v -> v != null)
                        .map(v -> new BigDecimal(v.toString()))
                        .reduce(ZERO, (x, y) -> x.add(y))
                        .setScale(IND_SCALE, RoundingMode.HALF_UP);
            }

            @Override
            public BigDecimal onEmpty() {
                return ZERO;
            }

            @Override
            public String toString() {
                return "sum(" + fieldPath + ")";
            }
        };
    }

}
