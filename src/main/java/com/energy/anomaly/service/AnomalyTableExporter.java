package com.energy.anomaly.service;

import com.energy.anomaly.model.AnomalyRecord;
import com.energy.anomaly.model.DetectionRun;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat anomaly table for reporting and download:
 * index, timestamp (only when the dataset has one), normalized_score, then the feature columns.
 * Rows keep the run's order (score descending).
 */
@Service
public class AnomalyTableExporter {

    public static final String INDEX = "index";
    public static final String TIMESTAMP = "timestamp";
    public static final String NORMALIZED_SCORE = "normalized_score";

    private final CsvMapper csvMapper = new CsvMapper();

    public List<String> columns(DetectionRun run) {
        List<String> columns = new ArrayList<>();
        columns.add(INDEX);
        if (run.getTimestampColumn() != null) {
            columns.add(TIMESTAMP);
        }
        columns.add(NORMALIZED_SCORE);
        for (String feature : run.getSnapshotColumns()) {
            if (!columns.contains(feature)) {
                columns.add(feature);
            }
        }
        return columns;
    }

    public List<Map<String, Object>> rows(DetectionRun run) {
        boolean withTimestamp = run.getTimestampColumn() != null;
        List<Map<String, Object>> rows = new ArrayList<>(run.getAnomalies().size());
        for (AnomalyRecord record : run.getAnomalies()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(INDEX, record.getRowIndex());
            if (withTimestamp) {
                row.put(TIMESTAMP, record.getTimestamp() == null ? null : record.getTimestamp().toString());
            }
            row.put(NORMALIZED_SCORE, record.getScore());
            for (String feature : run.getSnapshotColumns()) {
                row.putIfAbsent(feature, record.getFeatures().get(feature));
            }
            rows.add(row);
        }
        return rows;
    }

    public String toCsv(DetectionRun run) {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        for (String column : columns(run)) {
            schema.addColumn(column);
        }
        try {
            return csvMapper.writer(schema.build()).writeValueAsString(rows(run));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render anomaly table as CSV", e);
        }
    }
}
