/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.scoreworks.scoresimilarity.comparison.ErrorKind;
import net.scoreworks.scoresimilarity.comparison.ErrorVector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;


/**
 * One row of numbers per evaluated score pair. Error columns hold normalized or raw counts, the three trailing
 * columns the ground truth symbol counts. Rows of failed pairs hold the sentinel in every column
 */
@JsonPropertyOrder({"columns", "rows", "summary"})
public class EvaluationTable {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> columns;
    private final List<Row> rows = new ArrayList<>();
    private final double sentinel;

    public EvaluationTable(double sentinel) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(ErrorVector.ZERO.toMap().keySet()));
        this.sentinel = sentinel;
    }

    public void add(String name, ErrorVector errors, boolean normalize) {
        Map<String, Integer> raw = errors.toMap();
        double[] values = new double[columns.size()];
        int i = 0;
        for (ErrorKind kind : ErrorKind.values())
            values[i++] = normalize ? errors.normalized(kind) : errors.get(kind);
        for (; i < values.length; i++)
            values[i] = raw.get(columns.get(i));
        rows.add(new Row(name, values, false));
    }

    public void addFailure(String name) {
        double[] values = new double[columns.size()];
        Arrays.fill(values, sentinel);
        rows.add(new Row(name, values, true));
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return Collections.unmodifiableList(rows);
    }

    @JsonIgnore
    public Row getRow(String name) {
        for (Row row : rows) {
            if (row.name.equals(name))
                return row;
        }
        throw new IllegalArgumentException("no row named " + name);
    }

    /**
     * @return column means over all successful rows, zeros if there are none
     */
    public Row getSummary() {
        double[] means = new double[columns.size()];
        int count = 0;
        for (Row row : rows) {
            if (row.failed)
                continue;
            count++;
            for (int i = 0; i < means.length; i++)
                means[i] += row.values[i];
        }
        if (count > 0) {
            for (int i = 0; i < means.length; i++)
                means[i] /= count;
        }
        return new Row("mean", means, false);
    }

    public void write(Path file) throws IOException {
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), this);
    }


    @JsonPropertyOrder({"name", "values"})
    public static final class Row {
        private final String name;
        private final double[] values;
        private final boolean failed;

        Row(String name, double[] values, boolean failed) {
            this.name = name;
            this.values = values;
            this.failed = failed;
        }

        public String getName() {
            return name;
        }

        public double[] getValues() {
            return values.clone();
        }

        @JsonIgnore
        public boolean isFailed() {
            return failed;
        }

        public double get(int column) {
            return values[column];
        }
    }
}
