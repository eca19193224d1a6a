package com.energy.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so that consumers of the detection
 * endpoints notice schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKey("/api/v1/detections");
        assertThat(paths).containsKey("/api/v1/detections/export");
        assertThat(paths).containsKey("/api/v1/detections/algorithms");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("DetectionRequest");
        assertThat(schemas).containsKey("DetectionRun");
        assertThat(schemas).containsKey("AnomalyRecord");
        assertThat(schemas).containsKey("DetectionSummary");
    }

    @Test
    void openApiSpec_runAndRecordSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> runProps = json.read("$.components.schemas.DetectionRun.properties");
        assertThat(runProps).containsKey("threshold");
        assertThat(runProps).containsKey("anomalies");
        assertThat(runProps).containsKey("summary");
        assertThat(runProps).containsKey("executionPath");
        assertThat(runProps).containsKey("scores");

        Map<String, Object> recordProps = json.read("$.components.schemas.AnomalyRecord.properties");
        assertThat(recordProps).containsKey("rowIndex");
        assertThat(recordProps).containsKey("timestamp");
        assertThat(recordProps).containsKey("score");
        assertThat(recordProps).containsKey("features");
    }
}
