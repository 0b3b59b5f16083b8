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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * @author mengran
 *
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class CubeTest {

    private static JazzFixture jazz;

    private static Cube<Integer> cube;

    @BeforeClass
    public static void prepare() throws Throwable {

        jazz = JazzFixture.load();
        cube = jazz.musicianCube();
    }

    @Test
    public void test_a_measure() {

        Assert.assertEquals(6, (int) cube.measure());
        Assert.assertEquals(1, (int) cube.measure(Coordinate.of("firstname", "Miles").with("instrument", "trumpet")));
        Assert.assertEquals(0, (int) cube.measure(Coordinate.of("firstname", "Miles").with("instrument", "piano")));
        Assert.assertEquals(3, (int) cube.measure(Coordinate.of("instrument", "piano")));
        Assert.assertEquals(2, (int) cube.constrain("firstname", "Bill").measure());
    }

    @Test(expected = InvalidDimensionException.class)
    public void test_a_measure_undeclared() {
        cube.measure(Coordinate.of("lastname", "Davis"));
    }

    @Test(expected = ConflictingConstraintException.class)
    public void test_a_measure_conflicting() {
        cube.constrain("firstname", "Miles").measure(Coordinate.of("firstname", "Bill"));
    }

    @Test
    public void test_b_subcubes_order() {

        List<Object> instruments = cube.subcubes("instrument")
                .map(c -> c.getDimension("instrument").getConstraint()).collect(Collectors.toList());
        Assert.assertEquals(Arrays.asList("piano", "sax", "trumpet"), instruments);

        List<Cube<Integer>> first = cube.subcubes("firstname", "instrument").collect(Collectors.toList());
        List<Cube<Integer>> second = cube.subcubes("firstname", "instrument").collect(Collectors.toList());
        Assert.assertEquals(15, first.size());
        Assert.assertEquals(first, second);

        // First name varies slowest
        Assert.assertEquals(Coordinate.of("firstname", "Bill").with("instrument", "piano"),
                Coordinate.of(first.get(0).getConstraint()));
        Assert.assertEquals(Coordinate.of("firstname", "Bill").with("instrument", "sax"),
                Coordinate.of(first.get(1).getConstraint()));
        Assert.assertEquals(Coordinate.of("firstname", "Thelonious").with("instrument", "trumpet"),
                Coordinate.of(first.get(14).getConstraint()));
    }

    @Test
    public void test_b_subcubes_constrained() {

        Cube<Integer> miles = cube.constrain("firstname", "Miles");
        List<Cube<Integer>> subcubes = miles.subcubes("firstname").collect(Collectors.toList());
        Assert.assertEquals(Collections.singletonList(miles), subcubes);

        // Duplicated names count once
        Assert.assertEquals(3, cube.subcubes("instrument", "instrument").count());
        Assert.assertEquals(3, miles.subcubes("firstname", "instrument").count());
    }

    @Test
    public void test_b_subcubes_lazy() {

        AtomicInteger aggregated = new AtomicInteger();
        Aggregation<Integer> counting = querySet -> {
            aggregated.incrementAndGet();
            return querySet.count();
        };
        Cube<Integer> countingCube = Cube.builder(jazz.musicians.all(), counting)
                .dimension("instrument", DimensionSpec.field("instrument__name")).dimensions("firstname").build();
        Assert.assertEquals(1, (int) countingCube.subcubes("firstname", "instrument").map(Cube::measure)
                .findFirst().get());
        Assert.assertEquals(1, aggregated.get());
    }

    @Test(expected = InvalidDimensionException.class)
    public void test_b_subcubes_undeclared() {
        cube.subcubes("lastname");
    }

    @Test
    public void test_c_constrain() {

        Cube<Integer> miles = cube.constrain(Collections.singletonMap("firstname", "Miles"));
        Assert.assertEquals(miles, miles.constrain(Collections.singletonMap("firstname", "Miles")));
        Assert.assertEquals(Collections.singletonList("Miles"), miles.getSampleSpace("firstname"));
        Assert.assertEquals(Collections.singletonList("instrument"), miles.getFreeDimensions());
        Assert.assertTrue(cube.getConstraint().isEmpty());
        try {
            miles.constrain("firstname", "Bill");
            Assert.fail();
        } catch (ConflictingConstraintException e) {
            Assert.assertEquals("firstname", e.getDimensionName());
        }
        try {
            cube.constrain("lastname", "Davis");
            Assert.fail();
        } catch (InvalidDimensionException e) {
            Assert.assertEquals("lastname", e.getDimensionName());
        }
    }

    @Test
    public void test_d_measure_dict() {

        Map<Object, Object> dict = cube.measureDict("firstname");
        Assert.assertEquals(cube.measure(), dict.get(Cube.MEASURE));
        @SuppressWarnings("unchecked")
        Map<Object, Object> subcubes = (Map<Object, Object>) dict.get(Cube.SUBCUBES);
        Assert.assertEquals(Arrays.asList("Bill", "Erroll", "Freddie", "Miles", "Thelonious"),
                subcubes.keySet().stream().collect(Collectors.toList()));
        Assert.assertEquals(Collections.singletonMap(Cube.MEASURE, 2), subcubes.get("Bill"));
        Assert.assertEquals(Collections.singletonMap(Cube.MEASURE, 1), subcubes.get("Miles"));

        Assert.assertEquals(Collections.singletonMap(Cube.MEASURE, 6), cube.measureDict());
    }

    @Test
    public void test_d_measure_list() {

        List<Object> list = cube.measureList("firstname", "instrument");
        Assert.assertEquals(Arrays.asList(
                Arrays.asList(1, 1, 0),
                Arrays.asList(1, 0, 0),
                Arrays.asList(0, 0, 1),
                Arrays.asList(0, 0, 1),
                Arrays.asList(1, 0, 0)), list);
        Assert.assertEquals(Collections.singletonList(6), cube.measureList());
        Assert.assertEquals(Arrays.asList(3, 1, 2), cube.measureList("instrument"));
    }

    @Test
    public void test_d_measure_dict_and_list_agree() {

        Map<Object, Object> dict = cube.measureDict(false, "firstname", "instrument");
        List<Object> list = cube.measureList("firstname", "instrument");
        int i = 0;
        for (Object byFirstname : dict.values()) {
            int j = 0;
            for (Object leaf : ((Map<?, ?>) byFirstname).values()) {
                Assert.assertEquals(((Map<?, ?>) leaf).get(Cube.MEASURE), ((List<?>) list.get(i)).get(j));
                j++;
            }
            i++;
        }
        Assert.assertEquals(5, i);
    }

    @Test
    public void test_e_resample() {

        Cube<Integer> piano = cube.resample("instrument", Arrays.asList("piano"));
        Assert.assertEquals(Collections.singletonList("piano"), piano.getSampleSpace("instrument"));

        Map<Object, Object> dict = piano.measureDict(false, "instrument", "firstname");
        Assert.assertEquals(Collections.singleton("piano"), dict.keySet());
        Map<?, ?> byFirstname = (Map<?, ?>) dict.get("piano");
        Assert.assertEquals(Collections.singletonMap(Cube.MEASURE, 1), byFirstname.get("Erroll"));
        Assert.assertEquals(Collections.singletonMap(Cube.MEASURE, 1), byFirstname.get("Bill"));
        Assert.assertEquals(Collections.singletonMap(Cube.MEASURE, 1), byFirstname.get("Thelonious"));
        Assert.assertEquals(Collections.singletonMap(Cube.MEASURE, 0), byFirstname.get("Miles"));
        Assert.assertEquals(Collections.singletonMap(Cube.MEASURE, 0), byFirstname.get("Freddie"));
        int total = byFirstname.values().stream().mapToInt(m -> (Integer) ((Map<?, ?>) m).get(Cube.MEASURE)).sum();
        Assert.assertEquals(3, total);
    }

    @Test
    public void test_e_resample_bounds() {

        Assert.assertEquals(Arrays.asList("Erroll", "Freddie", "Miles"),
                cube.resample("firstname", "C", "N").getSampleSpace("firstname"));
        Assert.assertEquals(Arrays.asList("Miles", "Thelonious"),
                cube.resample("firstname", "Miles", null).getSampleSpace("firstname"));
        Assert.assertEquals(Arrays.asList("drums", "piano"),
                cube.resample("instrument", Arrays.asList("sax", "piano", "drums"), null, "piano")
                    .getSampleSpace("instrument"));
        // Original cube is untouched
        Assert.assertEquals(5, cube.getSampleSpace("firstname").size());
    }

    @Test
    public void test_f_subcube() {

        Cube<Integer> reduced = cube.constrain("firstname", "Miles").subcube("instrument");
        Assert.assertEquals(Collections.singleton("instrument"), reduced.getDimensions().keySet());
        Assert.assertTrue(reduced.getConstraint().isEmpty());
        Assert.assertEquals(6, (int) reduced.measure());

        Cube<Integer> trumpet = cube.subcube(Arrays.asList("instrument", "firstname"),
                Collections.singletonMap("instrument", "trumpet"));
        Assert.assertEquals(2, (int) trumpet.measure());
        Assert.assertEquals(cube.constrain("instrument", "trumpet"), trumpet);
        Assert.assertEquals(cube, cube.subcube(null, null));
    }

    @Test(expected = InvalidDimensionException.class)
    public void test_f_subcube_undeclared() {
        cube.subcube("instrument", "lastname");
    }

    @Test(expected = InvalidDimensionException.class)
    public void test_f_subcube_constraint_out_of_subset() {
        cube.subcube(Arrays.asList("instrument"), Collections.singletonMap("firstname", "Miles"));
    }

    @Test
    public void test_g_sample_space_formats() {

        List<?> tuples = cube.getSampleSpace(SampleSpaceFormat.TUPLE, "firstname", "instrument");
        Assert.assertEquals(15, tuples.size());
        Assert.assertEquals(Arrays.asList("Bill", "piano"), tuples.get(0));

        List<?> dicts = cube.getSampleSpace(SampleSpaceFormat.DICT, "instrument");
        Assert.assertEquals(Arrays.asList(Coordinate.of("instrument", "piano"), Coordinate.of("instrument", "sax"),
                Coordinate.of("instrument", "trumpet")), dicts);

        Assert.assertEquals(Arrays.asList("piano", "sax", "trumpet"),
                cube.getSampleSpace(SampleSpaceFormat.FLAT, "instrument"));
        try {
            cube.getSampleSpace(SampleSpaceFormat.FLAT, "firstname", "instrument");
            Assert.fail();
        } catch (UnsupportedFormatException e) {
            Assert.assertEquals(SampleSpaceFormat.FLAT, e.getFormat());
        }
    }

    @Test
    public void test_h_measures_and_coordinates() {

        Map<Coordinate, Integer> measures = cube.measures("instrument");
        Assert.assertEquals(Arrays.asList(3, 1, 2), measures.values().stream().collect(Collectors.toList()));
        Assert.assertEquals(Integer.valueOf(2), measures.get(Coordinate.of("instrument", "trumpet")));

        Assert.assertEquals(15, cube.measures().size());
        Assert.assertEquals(6, cube.measures().values().stream().mapToInt(Integer::intValue).sum());

        List<Coordinate> coordinates = cube.constrain("instrument", "sax").coordinates();
        Assert.assertEquals(5, coordinates.size());
        Assert.assertEquals(Coordinate.of("firstname", "Bill"), coordinates.get(0));
    }

    @Test
    public void test_i_filter() {

        Cube<Integer> evans = cube.filter(jazz.musicians.all().filter(Collections.singletonMap("lastname", "Evans")));
        Assert.assertEquals(2, (int) evans.measure());
        Assert.assertEquals(Collections.singletonList("Bill"), evans.getSampleSpace("firstname"));
        Assert.assertEquals(Arrays.asList("piano", "sax"), evans.getSampleSpace("instrument"));
        Assert.assertEquals(6, (int) cube.measure());
    }

    @Test
    public void test_j_to_string() {

        Assert.assertEquals("Cube(firstname, instrument)", cube.toString());
        Assert.assertEquals("Cube(firstname, instrument=piano)", cube.constrain("instrument", "piano").toString());
        Assert.assertEquals("Cube(firstname=Bill, instrument=piano)",
                cube.constrain(Coordinate.of("instrument", "piano").with("firstname", "Bill")).toString());
    }

    @Test
    public void test_k_ordering() {

        Comparator<Coordinate> byInstrumentDesc = Comparator.comparing(
                (Coordinate c) -> (String) c.valueOf("instrument")).reversed();
        Cube<Integer> ordered = cube.withOrdering(byInstrumentDesc);
        List<Object> instruments = ordered.subcubes("instrument")
                .map(c -> c.getDimension("instrument").getConstraint()).collect(Collectors.toList());
        Assert.assertEquals(Arrays.asList("trumpet", "sax", "piano"), instruments);

        // Ties keep sample space order
        List<Cube<Integer>> subcubes = ordered.subcubes("instrument", "firstname").collect(Collectors.toList());
        Assert.assertEquals(Coordinate.of("firstname", "Bill").with("instrument", "trumpet"),
                Coordinate.of(subcubes.get(0).getConstraint()));
        Assert.assertEquals(Coordinate.of("firstname", "Erroll").with("instrument", "trumpet"),
                Coordinate.of(subcubes.get(1).getConstraint()));

        Assert.assertNull(ordered.withOrdering(null).getOrdering());
    }

    @Test
    public void test_k_ordering_dropped_by_subcube() {

        Comparator<Coordinate> byInstrument = Comparator.comparing((Coordinate c) -> (String) c.valueOf("instrument"));
        Cube<Integer> ordered = cube.withOrdering(byInstrument);
        Assert.assertSame(byInstrument, ordered.subcube("firstname", "instrument").getOrdering());

        Cube<Integer> firstnames = ordered.subcube("firstname");
        Assert.assertNull(firstnames.getOrdering());
        List<Object> names = firstnames.subcubes("firstname")
                .map(c -> c.getDimension("firstname").getConstraint()).collect(Collectors.toList());
        Assert.assertEquals(Arrays.asList("Bill", "Erroll", "Freddie", "Miles", "Thelonious"), names);
    }

    @Test
    public void test_l_measure_on_empty() {

        Aggregation<Integer> nullOnEmpty = querySet -> querySet.count() == 0 ? null : querySet.count();
        Cube<Integer> plain = Cube.builder(jazz.musicians.all(), nullOnEmpty)
                .dimension("instrument", DimensionSpec.field("instrument__name")).dimensions("firstname").build();
        Coordinate milesOnPiano = Coordinate.of("firstname", "Miles").with("instrument", "piano");
        Assert.assertNull(plain.measure(milesOnPiano));
        Assert.assertEquals(-1, (int) plain.withMeasureOnEmpty(-1).measure(milesOnPiano));

        Cube<Integer> built = Cube.builder(jazz.musicians.all(), nullOnEmpty).dimensions("firstname")
                .measureOnEmpty(0).build();
        Assert.assertEquals(0, (int) built.measure(Coordinate.of("firstname", "Nobody")));

        Aggregation<Integer> zeroOnEmpty = new Aggregation<Integer>() {

            @Override
            public Integer aggregate(QuerySet querySet) {
                return nullOnEmpty.aggregate(querySet);
            }

            @Override
            public Integer onEmpty() {
                return 0;
            }
        };
        Cube<Integer> declared = Cube.builder(jazz.musicians.all(), zeroOnEmpty).dimensions("firstname").build();
        Assert.assertEquals(Integer.valueOf(0), declared.getMeasureOnEmpty());
        Assert.assertEquals(0, (int) declared.measure(Coordinate.of("firstname", "Nobody")));
    }

}
