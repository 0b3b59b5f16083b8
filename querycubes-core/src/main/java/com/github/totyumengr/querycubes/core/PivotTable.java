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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StopWatch;

/**
 * Two-axis table of a cube: one column per value of the column dimension, one row per value of the row dimension,
 * subtotals of every column and row, and the overall measure.
 *
 * @param <M> measure type
 * @author mengran
 *
 */
public final class PivotTable<M> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotTable.class);

    private final String colDimName;
    private final String rowDimName;
    private final List<Line<M>> cols;
    private final List<Line<M>> rows;
    private final M overall;

    private PivotTable(String colDimName, String rowDimName, List<Line<M>> cols, List<Line<M>> rows, M overall) {
        super();
        this.colDimName = colDimName;
        this.rowDimName = rowDimName;
        this.cols = Collections.unmodifiableList(cols);
        this.rows = Collections.unmodifiableList(rows);
        this.overall = overall;
    }

    /**
     * @param cube cube to lay out
     * @param colDimName dimension of the columns
     * @param rowDimName dimension of the rows
     * @param <M> measure type
     * @return table of <code>cube</code>
     * @throws InvalidDimensionException if a dimension is not declared on the cube
     */
    public static <M> PivotTable<M> of(Cube<M> cube, String colDimName, String rowDimName) {

        cube.getDimension(colDimName);
        cube.getDimension(rowDimName);

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        List<Line<M>> cols = lines(cube, colDimName, rowDimName);
        List<Line<M>> rows = lines(cube, rowDimName, colDimName);
        M overall = cube.measure();
        stopWatch.stop();
        LOGGER.info("Build table {} by {} of {} with {} columns and {} rows use {} ms.", colDimName, rowDimName,
                cube, cols.size(), rows.size(), stopWatch.getTotalTimeMillis());

        return new PivotTable<M>(colDimName, rowDimName, cols, rows, overall);
    }

    private static <M> List<Line<M>> lines(Cube<M> cube, String lineDimName, String cellDimName) {

        return cube.subcubes(lineDimName).map(subcube -> {
            Dimension dimension = subcube.getDimension(lineDimName);
            List<M> values = subcube.subcubes(cellDimName).map(Cube::measure).collect(Collectors.toList());
            return new Line<M>(dimension.getConstraint(), dimension.getPrettyConstraint(), values, subcube.measure());
        }).collect(Collectors.toList());
    }

    public String getColDimName() {
        return colDimName;
    }

    public String getRowDimName() {
        return rowDimName;
    }

    public List<Line<M>> getCols() {
        return cols;
    }

    public List<Line<M>> getRows() {
        return rows;
    }

    public List<Header> getColNames() {
        return cols.stream().map(Line::getHeader).collect(Collectors.toList());
    }

    public List<Header> getRowNames() {
        return rows.stream().map(Line::getHeader).collect(Collectors.toList());
    }

    public List<M> getColOveralls() {
        return cols.stream().map(Line::getOverall).collect(Collectors.toList());
    }

    public List<M> getRowOveralls() {
        return rows.stream().map(Line::getOverall).collect(Collectors.toList());
    }

    public M getOverall() {
        return overall;
    }

    /**
     * @return dictionary with keys <code>col_names, row_names, cols, rows, col_overalls, row_overalls,
     *  col_dim_name, row_dim_name, overall</code>. Names are <code>[value, pretty name]</code> pairs, lines are
     *  <code>{name, pretty_name, values, overall}</code>.
     */
    public Map<String, Object> toMap() {

        Map<String, Object> map = new LinkedHashMap<String, Object>();
        map.put("col_names", getColNames().stream().map(Header::toPair).collect(Collectors.toList()));
        map.put("row_names", getRowNames().stream().map(Header::toPair).collect(Collectors.toList()));
        map.put("cols", cols.stream().map(Line::toMap).collect(Collectors.toList()));
        map.put("rows", rows.stream().map(Line::toMap).collect(Collectors.toList()));
        map.put("col_overalls", getColOveralls());
        map.put("row_overalls", getRowOveralls());
        map.put("col_dim_name", colDimName);
        map.put("row_dim_name", rowDimName);
        map.put("overall", overall);
        return map;
    }

    @Override
    public String toString() {
        return "PivotTable [" + colDimName + " x " + rowDimName + ", overall=" + overall + "]";
    }

    /**
     * Value of a column or row and its pretty form.
     */
    public static final class Header {

        private final Object name;
        private final String prettyName;

        Header(Object name, String prettyName) {
            this.name = name;
            this.prettyName = prettyName;
        }

        public Object getName() {
            return name;
        }

        public String getPrettyName() {
            return prettyName;
        }

        List<Object> toPair() {
            return Arrays.asList(name, prettyName);
        }

        @Override
        public String toString() {
            return "(" + name + ", " + prettyName + ")";
        }
    }

    /**
     * A column or a row: cell measures along the other dimension and the subtotal.
     * @param <M> measure type
     */
    public static final class Line<M> {

        private final Header header;
        private final List<M> values;
        private final M overall;

        Line(Object name, String prettyName, List<M> values, M overall) {
            this.header = new Header(name, prettyName);
            this.values = Collections.unmodifiableList(new ArrayList<M>(values));
            this.overall = overall;
        }

        public Header getHeader() {
            return header;
        }

        public Object getName() {
            return header.getName();
        }

        public String getPrettyName() {
            return header.getPrettyName();
        }

        public List<M> getValues() {
            return values;
        }

        public M getOverall() {
            return overall;
        }

        Map<String, Object> toMap() {

            Map<String, Object> map = new LinkedHashMap<String, Object>();
            map.put("name", header.getName());
            map.put("pretty_name", header.getPrettyName());
            map.put("values", values);
            map.put("overall", overall);
            return map;
        }
    }

}
