package com.energy.anomaly.controller;

import com.energy.anomaly.engine.AlgorithmParameterParser;
import com.energy.anomaly.exception.DetectionException;
import com.energy.anomaly.exception.ErrorType;
import com.energy.anomaly.model.AlgorithmType;
import com.energy.anomaly.model.Dataset;
import com.energy.anomaly.model.DetectionConfig;
import com.energy.anomaly.model.DetectionRequest;
import com.energy.anomaly.model.DetectionRun;
import com.energy.anomaly.service.AnomalyDetectionService;
import com.energy.anomaly.service.AnomalyTableExporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Run anomaly detection over energy-consumption datasets")
public class DetectionController {

    private final AnomalyDetectionService detectionService;
    private final AnomalyTableExporter tableExporter;
    private final AlgorithmParameterParser parameterParser;

    public DetectionController(AnomalyDetectionService detectionService,
                               AnomalyTableExporter tableExporter,
                               AlgorithmParameterParser parameterParser) {
        this.detectionService = detectionService;
        this.tableExporter = tableExporter;
        this.parameterParser = parameterParser;
    }

    @Operation(summary = "Run anomaly detection",
            description = "Scores every row of the submitted dataset with the selected algorithm and flags rows " +
                    "scoring strictly above the percentile threshold. Returns flagged rows ordered by score, " +
                    "summary statistics, the full score vector and model details.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Detection run",
                    content = @Content(schema = @Schema(implementation = DetectionRun.class))),
            @ApiResponse(responseCode = "400", description = "Invalid configuration or dataset"),
            @ApiResponse(responseCode = "422", description = "Numerical failure inside the algorithm")
    })
    @PostMapping
    public ResponseEntity<?> detect(@RequestBody DetectionRequest request) {
        if (request.getColumns() == null || request.getRows() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "columns and rows are required",
                    "type", ErrorType.DATA.name()));
        }
        try {
            DetectionRun run = detectionService.detect(toDataset(request), toConfig(request));
            return ResponseEntity.ok(run);
        } catch (DetectionException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "Run detection and download the anomaly table as CSV",
            description = "Same run as POST /api/v1/detections. The CSV has columns index, timestamp (when the " +
                    "dataset has one), normalized_score and the original feature columns.")
    @PostMapping(value = "/export", produces = {"text/csv", MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<?> export(@RequestBody DetectionRequest request) {
        if (request.getColumns() == null || request.getRows() == null) {
            return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("error", "columns and rows are required", "type", ErrorType.DATA.name()));
        }
        try {
            DetectionRun run = detectionService.detect(toDataset(request), toConfig(request));
            return ResponseEntity.ok()
                    .contentType(new MediaType("text", "csv"))
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename=\"anomalies-" + run.getRunId() + ".csv\"")
                    .body(tableExporter.toCsv(run));
        } catch (DetectionException e) {
            return errorResponse(e);
        }
    }

    @Operation(summary = "List supported algorithms",
            description = "Returns each algorithm's id, display name and default parameters.")
    @GetMapping("/algorithms")
    public ResponseEntity<List<Map<String, Object>>> algorithms() {
        List<Map<String, Object>> algorithms = new ArrayList<>();
        for (AlgorithmType type : AlgorithmType.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", type.getId());
            entry.put("name", type.getDisplayName());
            entry.put("defaults", parameterParser.defaults(type));
            algorithms.add(entry);
        }
        return ResponseEntity.ok(algorithms);
    }

    private DetectionConfig toConfig(DetectionRequest request) {
        AlgorithmType algorithm = AlgorithmType.fromId(request.getAlgorithm());
        return DetectionConfig.builder()
                .algorithm(algorithm)
                .params(parameterParser.parse(algorithm, request.getParams()))
                .thresholdPercentile(request.getThresholdPercentile())
                .featureColumns(request.getFeatureColumns() == null
                        ? DetectionConfig.ALL_NUMERIC_COLUMNS
                        : request.getFeatureColumns())
                .includeTimeFeatures(request.isIncludeTimeFeatures())
                .timestampColumn(request.getTimestampColumn())
                .seed(request.getSeed())
                .build();
    }

    private static Dataset toDataset(DetectionRequest request) {
        return Dataset.of(request.getColumns(), request.getRows());
    }

    private ResponseEntity<Map<String, String>> errorResponse(DetectionException e) {
        HttpStatus status = e.getErrorType() == ErrorType.ALGORITHM
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", e.getMessage(), "type", e.getErrorType().name()));
    }
}
