package com.health.anomaly.report;

import com.health.anomaly.model.ClinicalReport;
import com.health.anomaly.model.Severity;
import com.health.anomaly.model.Trend;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a FHIR Observation and DiagnosticReport pair for an indicator anomaly.
 */
@Component
public class FhirReportGenerator implements ReportGenerator {

    static final String INDICATOR_CODE_SYSTEM = "https://who.int/gho/indicator";
    static final String OBSERVATION_PLACEHOLDER_REFERENCE = "Observation/auto-generated";

    private static final DateTimeFormatter SECONDS_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter MICROS_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");

    private final Clock clock;

    public FhirReportGenerator() {
        this(Clock.systemUTC());
    }

    FhirReportGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ClinicalReport generate(String subjectId, String subjectType, String indicatorCode, String indicatorName,
                                   Severity severity, Trend trend, String explanation) {
        String timestamp = formatTimestamp(clock.instant());
        String subjectReference = subjectType + "/" + subjectId;

        Map<String, Object> coding = new LinkedHashMap<>();
        coding.put("system", INDICATOR_CODE_SYSTEM);
        coding.put("code", indicatorCode);
        coding.put("display", indicatorName);

        Map<String, Object> code = new LinkedHashMap<>();
        code.put("text", indicatorName);
        code.put("coding", List.of(coding));

        Map<String, Object> observation = new LinkedHashMap<>();
        observation.put("resourceType", "Observation");
        observation.put("status", "final");
        observation.put("code", code);
        observation.put("subject", Map.of("reference", subjectReference));
        observation.put("effectiveDateTime", timestamp);
        observation.put("interpretation", List.of(Map.of("text", severity.label() + " risk")));
        observation.put("note", List.of(Map.of("text", explanation)));

        Map<String, Object> diagnosticReport = new LinkedHashMap<>();
        diagnosticReport.put("resourceType", "DiagnosticReport");
        diagnosticReport.put("status", "final");
        diagnosticReport.put("code", Map.of("text", "Anomaly detection report for " + indicatorName));
        diagnosticReport.put("subject", Map.of("reference", subjectReference));
        diagnosticReport.put("effectiveDateTime", timestamp);
        diagnosticReport.put("result", List.of(Map.of("reference", OBSERVATION_PLACEHOLDER_REFERENCE)));
        diagnosticReport.put("conclusion", severity.label() + " anomaly detected. Trend: " + trend.label());

        return new ClinicalReport(observation, diagnosticReport);
    }

    /**
     * UTC date-time with a trailing Z. Microseconds are printed only when non-zero.
     */
    static String formatTimestamp(Instant instant) {
        LocalDateTime time = LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
        DateTimeFormatter format = time.getNano() == 0 ? SECONDS_FORMAT : MICROS_FORMAT;
        return time.format(format) + "Z";
    }
}
