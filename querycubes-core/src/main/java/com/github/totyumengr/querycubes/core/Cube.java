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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.ObjectUtils;

import com.github.totyumengr.querycubes.core.CubeSchema.CubeSchemaBuilder;

/**
 * Multi-dimensional view of a {@link QuerySet}. Every {@link Dimension} is an axis, the measure of a point is the
 * {@link Aggregation} of the query set filtered by the constraints of all dimensions.
 *
 * <p>A cube is a value object. {@link #constrain(Map)}, {@link #subcube(Collection, Map)},
 * {@link #resample(String, Collection, Object, Object)} and {@link #filter(QuerySet)} return new cubes, so one
 * parent can branch into many sub-cubes without interference.
 *
 * <p>Nothing is cached. A full breakdown on free dimensions of sizes <code>n1 ... nk</code> runs
 * <code>n1 * ... * nk</code> aggregations against the query set, use {@link #resample(String, Object, Object)} to
 * bound large dimensions. {@link #subcubes(String...)} is lazy, a consumer stopping early does not pay for the
 * remaining combinations.
 *
 * @param <M> measure type
 * @author mengran
 *
 */
public class Cube<M> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Cube.class);

    /**
     * Key of the measure in {@link #measureDict(boolean, String...)} results.
     */
    public static final String MEASURE = "measure";

    /**
     * Key of the nested sub-cube measures in {@link #measureDict(boolean, String...)} results.
     */
    public static final String SUBCUBES = "subcubes";

    private final Map<String, Dimension> dimensions;
    private final QuerySet querySet;
    private final Aggregation<M> aggregation;
    private final M measureOnEmpty;
    /**
     * Custom enumeration order of {@link #subcubes(String...)}, <code>null</code> means sample space order.
     */
    private final Comparator<Coordinate> ordering;

    private Cube(Map<String, Dimension> dimensions, QuerySet querySet, Aggregation<M> aggregation,
            M measureOnEmpty, Comparator<Coordinate> ordering) {
        super();
        this.dimensions = Collections.unmodifiableMap(dimensions);
        this.querySet = querySet;
        this.aggregation = aggregation;
        this.measureOnEmpty = measureOnEmpty;
        this.ordering = ordering;
    }

    /**
     * @param schema cube shape, every dimension spec is bound to a fresh dimension
     * @param querySet query set to aggregate over
     * @param aggregation measure function
     * @param <M> measure type
     * @return cube with all dimensions free, its measure on empty is {@link Aggregation#onEmpty()}
     */
    public static <M> Cube<M> fromSchema(CubeSchema schema, QuerySet querySet, Aggregation<M> aggregation) {

        Assert.notNull(schema, "Cube schema can not null.");
        Assert.notNull(querySet, "Query set can not null.");
        Assert.notNull(aggregation, "Aggregation can not null.");

        LinkedHashMap<String, Dimension> dimensions = new LinkedHashMap<String, Dimension>();
        for (Entry<String, DimensionSpec> e : schema.getDimensions().entrySet()) {
            dimensions.put(e.getKey(), Dimension.bind(e.getKey(), e.getValue(), querySet));
        }
        Cube<M> cube = new Cube<M>(dimensions, querySet, aggregation, aggregation.onEmpty(), null);
        LOGGER.info("Create cube {} on {}", cube, querySet);
        return cube;
    }

    public static <M> CubeBuilder<M> builder(QuerySet querySet, Aggregation<M> aggregation) {
        return new CubeBuilder<M>(querySet, aggregation);
    }

    // ---------------------------- Structure ----------------------------

    /**
     * @return dimensions by name, in declaration order
     */
    public Map<String, Dimension> getDimensions() {
        return dimensions;
    }

    /**
     * @param name dimension name
     * @return dimension
     * @throws InvalidDimensionException if not declared
     */
    public Dimension getDimension(String name) {

        Dimension dimension = name == null ? null : dimensions.get(name);
        if (dimension == null) {
            throw new InvalidDimensionException(name, dimensions.keySet());
        }
        return dimension;
    }

    public QuerySet getQuerySet() {
        return querySet;
    }

    public Aggregation<M> getAggregation() {
        return aggregation;
    }

    public M getMeasureOnEmpty() {
        return measureOnEmpty;
    }

    public Comparator<Coordinate> getOrdering() {
        return ordering;
    }

    /**
     * @return name to value of the constrained dimensions
     */
    public Map<String, Object> getConstraint() {

        Map<String, Object> constraint = new LinkedHashMap<String, Object>();
        for (Dimension dimension : dimensions.values()) {
            if (dimension.isConstrained()) {
                constraint.put(dimension.getName(), dimension.getConstraint());
            }
        }
        return constraint;
    }

    /**
     * @return names of the dimensions without constraint, in declaration order
     */
    public List<String> getFreeDimensions() {

        return dimensions.values().stream().filter(d -> !d.isConstrained()).map(Dimension::getName)
                .collect(Collectors.toList());
    }

    // ---------------------------- Measure API ----------------------------

    /**
     * Aggregate the query set filtered by the constraints of all dimensions.
     * @return measure, or {@link #getMeasureOnEmpty()} when the aggregation gives <code>null</code>
     */
    public M measure() {

        Map<String, Object> lookups = new LinkedHashMap<String, Object>();
        for (Dimension dimension : dimensions.values()) {
            lookups.putAll(dimension.toFilterPredicate());
        }
        QuerySet filtered = lookups.isEmpty() ? querySet : querySet.filter(lookups);
        M measure = aggregation.aggregate(filtered);
        LOGGER.debug("Measure of {} filter {} result {}", this, lookups, measure);

        return measure == null ? measureOnEmpty : measure;
    }

    /**
     * Measure at <code>coordinates</code>, e.g. <code>measure(Coordinate.of("firstname", "Miles"))</code>.
     * @param coordinates extra constraint
     * @return measure of the constrained cube
     * @throws InvalidDimensionException if a name is not declared
     * @throws ConflictingConstraintException if a dimension is already constrained to another value
     */
    public M measure(Map<String, ?> coordinates) {

        Assert.notNull(coordinates, "Coordinates can not null.");
        for (Entry<String, ?> e : coordinates.entrySet()) {
            Dimension dimension = getDimension(e.getKey());
            if (dimension.isConstrained() && !ObjectUtils.nullSafeEquals(dimension.getConstraint(), e.getValue())) {
                throw new ConflictingConstraintException(e.getKey(), dimension.getConstraint(), e.getValue());
            }
        }
        return constrain(coordinates).measure();
    }

    /**
     * Flat measures over the cross product of <code>dimNames</code>, in {@link #subcubes(String...)} order.
     * @param dimNames dimension names, all free dimensions when empty
     * @return coordinate to measure
     */
    public Map<Coordinate, M> measures(String... dimNames) {

        List<String> names = dimNames.length == 0 ? getFreeDimensions() : Arrays.asList(dimNames);
        Map<Coordinate, M> measures = new LinkedHashMap<Coordinate, M>();
        subcubes(names).forEach(subcube -> {
            measures.put(subcube.coordinateOf(names), subcube.measure());
        });
        return measures;
    }

    /**
     * Nested dictionary of measures, following <code>dimNames</code>:
     * <pre>
     * {measure: m, subcubes: {v1: {measure: m1, subcubes: {...}}, v2: ...}}
     * </pre>
     * Without <code>full</code>, intermediate levels drop their measure:
     * <pre>
     * {v1: {w1: {measure: m11}, w2: {measure: m12}}, v2: ...}
     * </pre>
     * @param full attach measure at every level
     * @param dimNames dimensions, outermost first
     * @return ordered nested dictionary
     */
    public Map<Object, Object> measureDict(boolean full, String... dimNames) {
        return measureDict(full, Arrays.asList(dimNames));
    }

    public Map<Object, Object> measureDict(String... dimNames) {
        return measureDict(true, dimNames);
    }

    private Map<Object, Object> measureDict(boolean full, List<String> dimNames) {

        Map<Object, Object> result = new LinkedHashMap<Object, Object>();
        List<String> remaining = new ArrayList<String>(dimNames);
        String next = popFirstDimension(remaining, false);
        if (next == null) {
            result.put(MEASURE, measure());
            return result;
        }

        Map<Object, Object> subcubesDict = new LinkedHashMap<Object, Object>();
        subcubes(next).forEach(subcube -> {
            subcubesDict.put(subcube.getDimension(next).getConstraint(), subcube.measureDict(full, remaining));
        });
        if (!full) {
            return subcubesDict;
        }
        result.put(MEASURE, measure());
        result.put(SUBCUBES, subcubesDict);
        return result;
    }

    /**
     * Nested lists of measures following <code>dimNames</code>: element <code>[i][j]</code> is the measure at the
     * i-th value of the first dimension and the j-th value of the second one.
     * @param dimNames dimensions, outermost first
     * @return nested lists, <code>[measure()]</code> when no dimension given
     */
    public List<Object> measureList(String... dimNames) {

        if (dimNames.length == 0) {
            return Collections.singletonList(measure());
        }
        return measureList(Arrays.asList(dimNames));
    }

    private List<Object> measureList(List<String> dimNames) {

        List<String> remaining = new ArrayList<String>(dimNames);
        String next = popFirstDimension(remaining, false);
        if (remaining.isEmpty()) {
            return subcubes(next).map(subcube -> (Object) subcube.measure()).collect(Collectors.toList());
        }
        return subcubes(next).map(subcube -> (Object) subcube.measureList(remaining)).collect(Collectors.toList());
    }

    // ---------------------------- Decomposition API ----------------------------

    /**
     * Sub-cubes with every dimension of <code>dimNames</code> constrained, one per point of their cross product.
     * Values of earlier names vary slowest, each dimension in its sorted sample space order, unless an
     * {@link #withOrdering(Comparator) ordering} is set. Dimensions already constrained contribute their constraint
     * only.
     * @param dimNames dimension names
     * @return lazy stream of sub-cubes, a single copy of this cube when all names are constrained
     * @throws InvalidDimensionException if a name is not declared
     */
    public Stream<Cube<M>> subcubes(String... dimNames) {
        return subcubes(Arrays.asList(dimNames));
    }

    public Stream<Cube<M>> subcubes(List<String> dimNames) {

        List<String> remaining = normalize(dimNames);
        if (ordering != null) {
            return orderedSubcubes(remaining);
        }

        String free = popFirstDimension(remaining, true);
        if (free == null) {
            return Stream.of(copy());
        }
        Dimension dimension = dimensions.get(free);
        return dimension.getSampleSpace().stream()
                .flatMap(value -> constrain(Collections.singletonMap(free, value)).subcubes(remaining));
    }

    private Stream<Cube<M>> orderedSubcubes(List<String> dimNames) {

        List<String> free = dimNames.stream().filter(name -> !dimensions.get(name).isConstrained())
                .collect(Collectors.toList());
        if (free.isEmpty()) {
            return Stream.of(copy());
        }
        List<Coordinate> points = crossProduct(free);
        points.sort(ordering);
        return points.stream().map(point -> constrain(point));
    }

    /**
     * @param extraConstraint dimension name to value
     * @return copy of this cube with the extra constraint applied
     * @throws InvalidDimensionException if a name is not declared
     * @throws ConflictingConstraintException if a dimension is already constrained to another value
     */
    public Cube<M> constrain(Map<String, ?> extraConstraint) {

        Assert.notNull(extraConstraint, "Constraint can not null.");
        LinkedHashMap<String, Dimension> copy = new LinkedHashMap<String, Dimension>(dimensions);
        for (Entry<String, ?> e : extraConstraint.entrySet()) {
            copy.put(e.getKey(), getDimension(e.getKey()).constrain(e.getValue()));
        }
        return new Cube<M>(copy, querySet, aggregation, measureOnEmpty, ordering);
    }

    public Cube<M> constrain(String dimName, Object value) {
        return constrain(Collections.singletonMap(dimName, value));
    }

    /**
     * @param dimensionSubset dimensions kept, <code>null</code> keeps all. Constraints of dropped dimensions are
     *  discarded, and so is the {@link #withOrdering(Comparator) ordering} since it may read them.
     * @param extraConstraint constraint on kept dimensions, may be <code>null</code>
     * @return cube over the subset
     * @throws InvalidDimensionException if a name of the subset is not declared, or the extra constraint targets
     *  a dimension out of the subset
     */
    public Cube<M> subcube(Collection<String> dimensionSubset, Map<String, ?> extraConstraint) {

        LinkedHashMap<String, Dimension> kept = new LinkedHashMap<String, Dimension>();
        if (dimensionSubset == null) {
            kept.putAll(dimensions);
        } else {
            for (String name : dimensionSubset) {
                getDimension(name);
            }
            for (Dimension dimension : dimensions.values()) {
                if (dimensionSubset.contains(dimension.getName())) {
                    kept.put(dimension.getName(), dimension);
                }
            }
            LOGGER.debug("Subcube of {} keeps {}", this, kept.keySet());
        }

        Comparator<Coordinate> keptOrdering = kept.size() == dimensions.size() ? ordering : null;
        Cube<M> subcube = new Cube<M>(kept, querySet, aggregation, measureOnEmpty, keptOrdering);
        return extraConstraint == null ? subcube : subcube.constrain(extraConstraint);
    }

    public Cube<M> subcube(String... dimNames) {
        return subcube(Arrays.asList(dimNames), null);
    }

    /**
     * Override the sample space of a dimension with <code>explicitSpace</code> restricted to
     * <code>[lowerBound, upperBound]</code>.
     * @param dimName dimension name
     * @param explicitSpace new values, <code>null</code> for the current sample space of the dimension
     * @param lowerBound inclusive, <code>null</code> for no lower bound
     * @param upperBound inclusive, <code>null</code> for no upper bound
     * @return resampled cube
     */
    public Cube<M> resample(String dimName, Collection<?> explicitSpace, Object lowerBound, Object upperBound) {

        Dimension dimension = getDimension(dimName);
        List<Object> space = explicitSpace == null ? dimension.getUnconstrainedSampleSpace()
                : ValueOrdering.sorted(explicitSpace);
        List<Object> bounded = space.stream()
                .filter(v -> lowerBound == null || ValueOrdering.INSTANCE.compare(v, lowerBound) >= 0)
                .filter(v -> upperBound == null || ValueOrdering.INSTANCE.compare(v, upperBound) <= 0)
                .collect(Collectors.toList());
        LOGGER.debug("Resample {} to {} values between {} and {}", dimName, bounded.size(), lowerBound, upperBound);

        LinkedHashMap<String, Dimension> copy = new LinkedHashMap<String, Dimension>(dimensions);
        copy.put(dimName, dimension.resample(SampleSpace.of(bounded)));
        return new Cube<M>(copy, querySet, aggregation, measureOnEmpty, ordering);
    }

    public Cube<M> resample(String dimName, Collection<?> explicitSpace) {
        return resample(dimName, explicitSpace, null, null);
    }

    public Cube<M> resample(String dimName, Object lowerBound, Object upperBound) {
        return resample(dimName, null, lowerBound, upperBound);
    }

    /**
     * @param newQuerySet query set to aggregate over
     * @return copy of this cube on <code>newQuerySet</code>, dimensions without their own query set follow it
     */
    public Cube<M> filter(QuerySet newQuerySet) {

        Assert.notNull(newQuerySet, "Query set can not null.");
        LinkedHashMap<String, Dimension> copy = new LinkedHashMap<String, Dimension>();
        for (Dimension dimension : dimensions.values()) {
            copy.put(dimension.getName(), dimension.rebind(newQuerySet));
        }
        return new Cube<M>(copy, newQuerySet, aggregation, measureOnEmpty, ordering);
    }

    public Cube<M> withMeasureOnEmpty(M newMeasureOnEmpty) {
        return new Cube<M>(dimensions, querySet, aggregation, newMeasureOnEmpty, ordering);
    }

    /**
     * @param newOrdering order of points for {@link #subcubes(String...)}, <code>null</code> restores sample space
     *  order. Points are sorted in sample space order first, so equal keys keep it.
     * @return copy with the ordering
     */
    public Cube<M> withOrdering(Comparator<Coordinate> newOrdering) {
        return new Cube<M>(dimensions, querySet, aggregation, measureOnEmpty, newOrdering);
    }

    // ---------------------------- Sample space API ----------------------------

    /**
     * @param dimName dimension name
     * @return sorted sample space of the dimension, <code>[constraint]</code> if constrained
     */
    public List<Object> getSampleSpace(String dimName) {
        return getDimension(dimName).getSampleSpace();
    }

    /**
     * Cross product of the sample spaces of <code>dimNames</code>.
     * @param format element shape
     * @param dimNames dimension names
     * @return {@link Coordinate coordinates}, value lists or raw values depending on <code>format</code>
     * @throws UnsupportedFormatException if {@link SampleSpaceFormat#FLAT} is asked for other than one dimension
     */
    public List<?> getSampleSpace(SampleSpaceFormat format, String... dimNames) {

        Assert.notNull(format, "Sample space format can not null.");
        List<String> names = normalize(Arrays.asList(dimNames));
        switch (format) {
        case FLAT:
            if (names.size() != 1) {
                throw new UnsupportedFormatException(format, names.size());
            }
            return getSampleSpace(names.get(0));
        case TUPLE:
            return crossProduct(names).stream().map(point -> {
                List<Object> tuple = new ArrayList<Object>(names.size());
                for (String name : names) {
                    tuple.add(point.valueOf(name));
                }
                return tuple;
            }).collect(Collectors.toList());
        default:
            return crossProduct(names);
        }
    }

    /**
     * @param dimNames dimension names
     * @return cross product of the sample spaces as coordinates, in {@link #subcubes(String...)} order
     */
    public List<Coordinate> coordinates(String... dimNames) {

        List<String> names = dimNames.length == 0 ? getFreeDimensions() : Arrays.asList(dimNames);
        return subcubes(names).map(subcube -> subcube.coordinateOf(names)).collect(Collectors.toList());
    }

    // ---------------------------- Internal ----------------------------

    private Coordinate coordinateOf(List<String> dimNames) {

        Map<String, Object> pairs = new LinkedHashMap<String, Object>();
        for (String name : dimNames) {
            pairs.put(name, dimensions.get(name).getConstraint());
        }
        return Coordinate.of(pairs);
    }

    private List<String> normalize(List<String> dimNames) {

        List<String> names = new ArrayList<String>(new LinkedHashSet<String>(dimNames));
        for (String name : names) {
            getDimension(name);
        }
        return names;
    }

    /**
     * Pops the first dimension name from <code>dimNames</code>.
     * @param freeOnly skip names of constrained dimensions
     * @return popped name, <code>null</code> if none left
     */
    private String popFirstDimension(List<String> dimNames, boolean freeOnly) {

        for (int i = 0; i < dimNames.size(); i++) {
            if (freeOnly && getDimension(dimNames.get(i)).isConstrained()) {
                continue;
            }
            getDimension(dimNames.get(i));
            return dimNames.remove(i);
        }
        return null;
    }

    private List<Coordinate> crossProduct(List<String> dimNames) {

        List<Coordinate> product = new ArrayList<Coordinate>(Collections.singletonList(Coordinate.empty()));
        for (String name : dimNames) {
            List<Object> space = getDimension(name).getSampleSpace();
            List<Coordinate> next = new ArrayList<Coordinate>(product.size() * space.size());
            for (Coordinate point : product) {
                for (Object value : space) {
                    next.add(point.with(name, value));
                }
            }
            product = next;
        }
        return product;
    }

    private Cube<M> copy() {
        return new Cube<M>(dimensions, querySet, aggregation, measureOnEmpty, ordering);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimensions, querySet);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Cube)) {
            return false;
        }
        Cube<?> other = (Cube<?>) obj;
        return dimensions.equals(other.dimensions) && ObjectUtils.nullSafeEquals(querySet, other.querySet)
                && aggregation == other.aggregation && ObjectUtils.nullSafeEquals(measureOnEmpty, other.measureOnEmpty)
                && ordering == other.ordering;
    }

    /**
     * @return e.g. <code>Cube(age, instrument=Trumpet, name=Jack)</code>, free dimensions then constraints, each
     *  sorted by name
     */
    @Override
    public String toString() {

        List<String> parts = new ArrayList<String>();
        getFreeDimensions().stream().sorted().forEach(parts::add);
        getConstraint().entrySet().stream().sorted(Entry.comparingByKey())
                .forEach(e -> parts.add(e.getKey() + "=" + e.getValue()));
        return "Cube(" + String.join(", ", parts) + ")";
    }

    /**
     * Builder pattern class for {@link Cube}, chain model begin with {@link Cube#builder(QuerySet, Aggregation)}
     * and end with {@link #build()}.
     * @param <M> measure type
     * @author mengran
     *
     */
    public static class CubeBuilder<M> {

        private final QuerySet querySet;
        private final Aggregation<M> aggregation;
        private final CubeSchemaBuilder schema = CubeSchema.builder();
        private M measureOnEmpty;
        private boolean measureOnEmptySet = false;
        private Comparator<Coordinate> ordering;

        private CubeBuilder(QuerySet querySet, Aggregation<M> aggregation) {
            super();
            this.querySet = querySet;
            this.aggregation = aggregation;
        }

        /**
         * @param fields field paths, each one is both name and field of a dimension
         * @return this builder
         */
        public CubeBuilder<M> dimensions(String... fields) {
            schema.dimensions(Arrays.asList(fields));
            return this;
        }

        public CubeBuilder<M> dimension(String name, DimensionSpec spec) {
            schema.dimension(name, spec);
            return this;
        }

        public CubeBuilder<M> measureOnEmpty(M value) {
            this.measureOnEmpty = value;
            this.measureOnEmptySet = true;
            return this;
        }

        public CubeBuilder<M> ordering(Comparator<Coordinate> value) {
            this.ordering = value;
            return this;
        }

        public Cube<M> build() {

            Cube<M> cube = fromSchema(schema.build(), querySet, aggregation);
            if (measureOnEmptySet) {
                cube = cube.withMeasureOnEmpty(measureOnEmpty);
            }
            return ordering == null ? cube : cube.withOrdering(ordering);
        }
    }

}
