package com.metrics.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI spec structure.
 * Ensures all endpoints and critical schemas are present,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
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

        // Metric endpoints
        assertThat(paths).containsKey("/api/v1/metrics");
        assertThat(paths).containsKey("/api/v1/metrics/batch");
        assertThat(paths).containsKey("/api/v1/metrics/{metricName}/aggregate");
        assertThat(paths).containsKey("/api/v1/metrics/{metricName}/recent");
        assertThat(paths).containsKey("/api/v1/metrics/{metricName}/verdict");

        // Rule endpoints
        assertThat(paths).containsKey("/api/v1/rules");
        assertThat(paths).containsKey("/api/v1/rules/{ruleId}");

        // Alert endpoints
        assertThat(paths).containsKey("/api/v1/alerts");
        assertThat(paths).containsKey("/api/v1/alerts/evaluate");
        assertThat(paths).containsKey("/api/v1/alerts/throttle/{ruleId}");
        assertThat(paths).containsKey("/api/v1/alerts/escalations");
        assertThat(paths).containsKey("/api/v1/alerts/escalations/{alertId}");

        // Model endpoints
        assertThat(paths).containsKey("/api/v1/models/{metricName}/train");
        assertThat(paths).containsKey("/api/v1/models/{metricName}");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("MetricSampleRequest");
        assertThat(schemas).containsKey("IngestionResult");
        assertThat(schemas).containsKey("AnomalyVerdict");
        assertThat(schemas).containsKey("AlertRule");
        assertThat(schemas).containsKey("Alert");
    }

    @Test
    void openApiSpec_ruleAndAlertSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> ruleProps = json.read("$.components.schemas.AlertRule.properties");
        assertThat(ruleProps).containsKey("id");
        assertThat(ruleProps).containsKey("condition");
        assertThat(ruleProps).containsKey("severity");
        assertThat(ruleProps).containsKey("channels");
        assertThat(ruleProps).containsKey("throttle");
        assertThat(ruleProps).containsKey("escalation");

        Map<String, Object> alertProps = json.read("$.components.schemas.Alert.properties");
        assertThat(alertProps).containsKey("id");
        assertThat(alertProps).containsKey("ruleId");
        assertThat(alertProps).containsKey("severity");
        assertThat(alertProps).containsKey("message");
        assertThat(alertProps).containsKey("timestamp");
        assertThat(alertProps).containsKey("values");
        assertThat(alertProps).containsKey("correlationId");
    }
}
