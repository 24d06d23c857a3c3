package com.health.anomaly.report;

import com.health.anomaly.model.ClinicalReport;
import com.health.anomaly.model.Severity;
import com.health.anomaly.model.Trend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FhirReportGeneratorTest {

    private ClinicalReport report;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);
        FhirReportGenerator generator = new FhirReportGenerator(clock);
        report = generator.generate("KEN", "Country", "WHOSIS_000001", "Life expectancy",
                Severity.HIGH, Trend.DECLINING, "Latest z-score: -3.20. Trend: declining. Reconstruction error: 0.0100.");
    }

    @Test
    void observation_carriesCodedIndicatorSubjectAndInterpretation() {
        Map<String, Object> observation = report.getObservation();

        assertThat(observation.get("resourceType")).isEqualTo("Observation");
        assertThat(observation.get("status")).isEqualTo("final");
        assertThat(observation.get("code")).isEqualTo(Map.of(
                "text", "Life expectancy",
                "coding", List.of(Map.of(
                        "system", "https://who.int/gho/indicator",
                        "code", "WHOSIS_000001",
                        "display", "Life expectancy"))));
        assertThat(observation.get("subject")).isEqualTo(Map.of("reference", "Country/KEN"));
        assertThat(observation.get("effectiveDateTime")).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(observation.get("interpretation")).isEqualTo(List.of(Map.of("text", "high risk")));
        assertThat(observation.get("note")).isEqualTo(List.of(Map.of("text",
                "Latest z-score: -3.20. Trend: declining. Reconstruction error: 0.0100.")));
    }

    @Test
    void diagnosticReport_carriesConclusionAndPlaceholderResult() {
        Map<String, Object> diagnostic = report.getDiagnosticReport();

        assertThat(diagnostic.get("resourceType")).isEqualTo("DiagnosticReport");
        assertThat(diagnostic.get("status")).isEqualTo("final");
        assertThat(diagnostic.get("code")).isEqualTo(Map.of("text", "Anomaly detection report for Life expectancy"));
        assertThat(diagnostic.get("subject")).isEqualTo(Map.of("reference", "Country/KEN"));
        assertThat(diagnostic.get("effectiveDateTime")).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(diagnostic.get("result")).isEqualTo(List.of(Map.of("reference", "Observation/auto-generated")));
        assertThat(diagnostic.get("conclusion")).isEqualTo("high anomaly detected. Trend: declining");
    }

    @Test
    void timestamp_keepsSubSecondPrecision() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30.123456Z"), ZoneOffset.UTC);
        ClinicalReport withMicros = new FhirReportGenerator(clock).generate("FRA", "Country", "X", "X",
                Severity.MEDIUM, Trend.STABLE, "e");

        assertThat(withMicros.getObservation().get("effectiveDateTime")).isEqualTo("2024-03-01T10:15:30.123456Z");
    }

    @Test
    void timestamp_wholeSecond_omitsFraction() {
        assertThat(FhirReportGenerator.formatTimestamp(Instant.parse("2024-03-01T10:15:30Z")))
                .isEqualTo("2024-03-01T10:15:30Z");
    }

    @Test
    void timestamp_milliseconds_padToSixDigits() {
        assertThat(FhirReportGenerator.formatTimestamp(Instant.parse("2024-03-01T10:15:30.500Z")))
                .isEqualTo("2024-03-01T10:15:30.500000Z");
    }

    @Test
    void timestamp_nanoseconds_truncatedToMicros() {
        assertThat(FhirReportGenerator.formatTimestamp(Instant.parse("2024-03-01T10:15:30.000000900Z")))
                .isEqualTo("2024-03-01T10:15:30Z");
        assertThat(FhirReportGenerator.formatTimestamp(Instant.parse("2024-03-01T10:15:30.123456789Z")))
                .isEqualTo("2024-03-01T10:15:30.123456Z");
    }

    @SuppressWarnings("unchecked")
    @Test
    void nestedResources_keepDocumentKeyOrder() {
        Map<String, Object> code = (Map<String, Object>) report.getObservation().get("code");
        assertThat(code.keySet()).containsExactly("text", "coding");

        Map<String, Object> coding = ((List<Map<String, Object>>) code.get("coding")).get(0);
        assertThat(coding.keySet()).containsExactly("system", "code", "display");

        assertThat(report.getObservation().keySet()).containsExactly("resourceType", "status", "code", "subject",
                "effectiveDateTime", "interpretation", "note");
        assertThat(report.getDiagnosticReport().keySet()).containsExactly("resourceType", "status", "code",
                "subject", "effectiveDateTime", "result", "conclusion");
    }
}
