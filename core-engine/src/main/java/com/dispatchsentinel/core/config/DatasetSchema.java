package com.dispatchsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Column names of the input dataset, nested under {@code schema:} in the
 * pipeline YAML.
 *
 * <p>
 * The schema is resolved once at ingestion. When the delay column is absent
 * from a row, the delay is derived from the expected and actual arrival
 * columns. The label is read from the first label column present in the
 * dataset header.
 * </p>
 *
 * @since 1.0.0
 */
public class DatasetSchema {

    private String idColumn = "dispatch_id";
    private String timestampColumn = "timestamp";
    private String delayColumn = "dispatch_delay_minutes";
    private String expectedArrivalColumn = "expected_arrival";
    private String actualArrivalColumn = "actual_arrival";
    private List<String> labelColumns = new ArrayList<>(List.of("anomaly", "label", "is_anomaly"));
    private List<String> numericColumns = new ArrayList<>();

    void collectErrors(List<String> errors) {
        if (isBlank(timestampColumn)) {
            errors.add("schema.timestampColumn is required");
        }
        if (isBlank(delayColumn) && (isBlank(expectedArrivalColumn) || isBlank(actualArrivalColumn))) {
            errors.add("schema requires 'delayColumn' or both arrival columns");
        }
        for (String column : numericColumns) {
            if (isBlank(column)) {
                errors.add("schema.numericColumns must not contain blank names");
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getIdColumn() {
        return idColumn;
    }

    public void setIdColumn(String idColumn) {
        this.idColumn = idColumn;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public void setTimestampColumn(String timestampColumn) {
        this.timestampColumn = timestampColumn;
    }

    public String getDelayColumn() {
        return delayColumn;
    }

    public void setDelayColumn(String delayColumn) {
        this.delayColumn = delayColumn;
    }

    public String getExpectedArrivalColumn() {
        return expectedArrivalColumn;
    }

    public void setExpectedArrivalColumn(String expectedArrivalColumn) {
        this.expectedArrivalColumn = expectedArrivalColumn;
    }

    public String getActualArrivalColumn() {
        return actualArrivalColumn;
    }

    public void setActualArrivalColumn(String actualArrivalColumn) {
        this.actualArrivalColumn = actualArrivalColumn;
    }

    public List<String> getLabelColumns() {
        return Collections.unmodifiableList(labelColumns);
    }

    public void setLabelColumns(List<String> labelColumns) {
        this.labelColumns = labelColumns != null ? new ArrayList<>(labelColumns) : new ArrayList<>();
    }

    /**
     * @return extra numeric input columns fed to the isolation scorer
     */
    public List<String> getNumericColumns() {
        return Collections.unmodifiableList(numericColumns);
    }

    public void setNumericColumns(List<String> numericColumns) {
        this.numericColumns = numericColumns != null ? new ArrayList<>(numericColumns) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "DatasetSchema{" +
                "idColumn='" + idColumn + '\'' +
                ", timestampColumn='" + timestampColumn + '\'' +
                ", delayColumn='" + delayColumn + '\'' +
                ", labelColumns=" + labelColumns +
                ", numericColumns=" + numericColumns +
                '}';
    }
}
