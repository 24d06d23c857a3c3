package com.health.anomaly.contract;

import com.aerospike.client.AerospikeClient;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so consumers notice path or schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    // Replaces the real client so the context starts without an Aerospike node.
    @MockBean
    private AerospikeClient aerospikeClient;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Model endpoints
        assertThat(paths).containsKey("/api/v1/models/train");
        assertThat(paths).containsKey("/api/v1/models/{indicatorCode}");

        // Analysis endpoints
        assertThat(paths).containsKey("/api/v1/analysis/run");
        assertThat(paths).containsKey("/api/v1/analysis/results/subject/{subjectId}");
        assertThat(paths).containsKey("/api/v1/analysis/results/indicator/{indicatorCode}");
    }

    @Test
    void openApiSpec_analysisResultSchema_hasRequiredFields() {
        Map<String, Object> props = apiDocs().read("$.components.schemas.AnalysisResult.properties");

        assertThat(props).containsKey("timestamp");
        assertThat(props).containsKey("subjectType");
        assertThat(props).containsKey("subjectId");
        assertThat(props).containsKey("indicatorCode");
        assertThat(props).containsKey("severity");
        assertThat(props).containsKey("trend");
        assertThat(props).containsKey("slope");
        assertThat(props).containsKey("explanation");
        assertThat(props).containsKey("report");
    }
}
