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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.ObjectUtils;

/**
 * A named axis of a {@link Cube}. It is free, or constrained to a single value.
 *
 * <p>Instances are immutable and owned by one cube: {@link #constrain(Object)}, {@link #resample(SampleSpace)} and
 * {@link #rebind(QuerySet)} return new dimensions, so sibling cubes never share a mutable constraint.
 *
 * @author mengran
 *
 */
public final class Dimension {

    private static final Logger LOGGER = LoggerFactory.getLogger(Dimension.class);

    private final String name;
    private final FieldPath fieldPath;
    private final SampleSpace sampleSpace;
    /**
     * Query set the sample space is discovered from. <code>null</code> means not bound yet.
     */
    private final QuerySet querySet;
    private final boolean ownQuerySet;
    private final Function<Object, String> prettyPrinter;
    private final Object constraint;

    private Dimension(String name, FieldPath fieldPath, SampleSpace sampleSpace, QuerySet querySet,
            boolean ownQuerySet, Function<Object, String> prettyPrinter, Object constraint) {
        super();
        this.name = name;
        this.fieldPath = fieldPath;
        this.sampleSpace = sampleSpace;
        this.querySet = querySet;
        this.ownQuerySet = ownQuerySet;
        this.prettyPrinter = prettyPrinter;
        this.constraint = constraint;
    }

    /**
     * @param name dimension name, field path too when spec has no field
     * @param spec template
     * @param cubeQuerySet query set of the cube, used when spec has none
     * @return free dimension
     */
    static Dimension bind(String name, DimensionSpec spec, QuerySet cubeQuerySet) {

        Assert.hasText(name, "Dimension name can not empty.");
        FieldPath fieldPath = FieldPath.parse(spec.getField() == null ? name : spec.getField());
        boolean own = spec.getQuerySet() != null;
        return new Dimension(name, fieldPath, spec.getSampleSpace(), own ? spec.getQuerySet() : cubeQuerySet, own,
                spec.getPrettyPrinter(), null);
    }

    public String getName() {
        return name;
    }

    public FieldPath getFieldPath() {
        return fieldPath;
    }

    public QuerySet getQuerySet() {
        return querySet;
    }

    /**
     * @return constraint value, <code>null</code> when the dimension is free
     */
    public Object getConstraint() {
        return constraint;
    }

    public boolean isConstrained() {
        return constraint != null;
    }

    /**
     * @return {@link #getConstraint()} rendered by the pretty printer of the dimension, <code>null</code> when free
     */
    public String getPrettyConstraint() {
        return constraint == null ? null : pretty(constraint);
    }

    public String pretty(Object value) {
        return prettyPrinter.apply(value);
    }

    /**
     * @return <code>[constraint]</code> when constrained, otherwise the sorted values of the configured sample space
     * @throws InvalidFieldException when the sample space is discovered from a field that does not exist
     */
    public List<Object> getSampleSpace() {

        if (constraint != null) {
            return Collections.singletonList(constraint);
        }
        return getUnconstrainedSampleSpace();
    }

    /**
     * @return sorted values of the configured sample space, whatever the constraint is
     */
    public List<Object> getUnconstrainedSampleSpace() {

        List<Object> values = ValueOrdering.sorted(sampleSpace.resolve(fieldPath, querySet));
        LOGGER.debug("Sample space of {} has {} values.", name, values.size());
        return values;
    }

    /**
     * @return lookups restricting a query set to the constraint, empty when free
     */
    public Map<String, Object> toFilterPredicate() {

        if (constraint == null) {
            return Collections.emptyMap();
        }
        return fieldPath.toLookups(constraint);
    }

    /**
     * @param value new constraint
     * @return dimension constrained to <code>value</code>
     * @throws ConflictingConstraintException if already constrained to another value
     */
    Dimension constrain(Object value) {

        Assert.notNull(value, "Constraint of dimension " + name + " can not null.");
        if (constraint != null) {
            if (ObjectUtils.nullSafeEquals(constraint, value)) {
                return this;
            }
            throw new ConflictingConstraintException(name, constraint, value);
        }
        return new Dimension(name, fieldPath, sampleSpace, querySet, ownQuerySet, prettyPrinter, value);
    }

    Dimension resample(SampleSpace newSampleSpace) {
        return new Dimension(name, fieldPath, newSampleSpace, querySet, ownQuerySet, prettyPrinter, constraint);
    }

    /**
     * @param cubeQuerySet new query set of the owning cube
     * @return dimension discovering from <code>cubeQuerySet</code>, unless it has its own query set
     */
    Dimension rebind(QuerySet cubeQuerySet) {

        if (ownQuerySet) {
            return this;
        }
        return new Dimension(name, fieldPath, sampleSpace, cubeQuerySet, false, prettyPrinter, constraint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fieldPath, constraint);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Dimension)) {
            return false;
        }
        Dimension other = (Dimension) obj;
        return name.equals(other.name) && fieldPath.equals(other.fieldPath)
                && ObjectUtils.nullSafeEquals(sampleSpace, other.sampleSpace)
                && ObjectUtils.nullSafeEquals(querySet, other.querySet)
                && ObjectUtils.nullSafeEquals(constraint, other.constraint);
    }

    @Override
    public String toString() {
        return constraint == null ? name : name + "=" + constraint;
    }

}
