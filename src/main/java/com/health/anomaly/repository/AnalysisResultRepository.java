package com.health.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.QueryPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.aerospike.client.query.Filter;
import com.aerospike.client.query.IndexType;
import com.aerospike.client.query.RecordSet;
import com.aerospike.client.query.Statement;
import com.aerospike.client.task.IndexTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.health.anomaly.config.AerospikeConfig;
import com.health.anomaly.model.AnalysisResult;
import com.health.anomaly.model.ClinicalReport;
import com.health.anomaly.model.Severity;
import com.health.anomaly.model.Trend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only store of analysis results. Every save writes a new record; nothing is updated.
 */
@Repository
public class AnalysisResultRepository {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultRepository.class);

    static final String SUBJECT_INDEX = "ai_logs_subject_idx";
    static final String INDICATOR_INDEX = "ai_logs_indicator_idx";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnalysisResultRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Create the subject and indicator lookup indexes. Indexes that already exist are left alone.
     */
    public void ensureIndexes() {
        createIndex(SUBJECT_INDEX, "subjectId");
        createIndex(INDICATOR_INDEX, "indicatorCode");
    }

    private void createIndex(String indexName, String binName) {
        try {
            IndexTask task = client.createIndex(readPolicy, namespace, AerospikeConfig.SET_ANALYSIS_LOGS,
                    indexName, binName, IndexType.STRING);
            task.waitTillComplete();
            log.info("Created index {} on {}.{}", indexName, AerospikeConfig.SET_ANALYSIS_LOGS, binName);
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.INDEX_ALREADY_EXISTS) {
                throw e;
            }
            log.debug("Index {} already exists", indexName);
        }
    }

    public void save(AnalysisResult result) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSIS_LOGS, UUID.randomUUID().toString());

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("timestamp", result.getTimestamp().toEpochMilli()),
                new Bin("subjectType", result.getSubjectType()),
                new Bin("subjectId", result.getSubjectId()),
                new Bin("indicatorCode", result.getIndicatorCode()),
                new Bin("severity", result.getSeverity().label()),
                new Bin("trend", result.getTrend().label()),
                new Bin("slope", result.getSlope()),
                new Bin("latestValue", result.getLatestValue()),
                new Bin("zscore", result.getStandardizedLatest()),
                new Bin("reconError", result.getReconstructionError()),
                new Bin("explanation", result.getExplanation())));

        if (result.getReport() != null) {
            bins.add(new Bin("report", serializeReport(result.getReport())));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public List<AnalysisResult> findBySubjectId(String subjectId, int limit) {
        return query(Filter.equal("subjectId", subjectId), limit);
    }

    public List<AnalysisResult> findByIndicatorCode(String indicatorCode, int limit) {
        return query(Filter.equal("indicatorCode", indicatorCode), limit);
    }

    private List<AnalysisResult> query(Filter filter, int limit) {
        Statement statement = new Statement();
        statement.setNamespace(namespace);
        statement.setSetName(AerospikeConfig.SET_ANALYSIS_LOGS);
        statement.setFilter(filter);

        List<AnalysisResult> results = new ArrayList<>();
        try (RecordSet recordSet = client.query(new QueryPolicy(), statement)) {
            while (recordSet.next()) {
                results.add(mapRecord(recordSet.getRecord()));
            }
        }

        results.sort(Comparator.comparing(AnalysisResult::getTimestamp).reversed());
        if (results.size() > limit) {
            return results.subList(0, limit);
        }
        return results;
    }

    private AnalysisResult mapRecord(Record record) {
        return AnalysisResult.builder()
                .timestamp(Instant.ofEpochMilli(record.getLong("timestamp")))
                .subjectType(record.getString("subjectType"))
                .subjectId(record.getString("subjectId"))
                .indicatorCode(record.getString("indicatorCode"))
                .severity(Severity.fromLabel(record.getString("severity")))
                .trend(Trend.fromLabel(record.getString("trend")))
                .slope(record.getDouble("slope"))
                .latestValue(record.getDouble("latestValue"))
                .standardizedLatest(record.getDouble("zscore"))
                .reconstructionError(record.getDouble("reconError"))
                .explanation(record.getString("explanation"))
                .report(deserializeReport(record.getString("report")))
                .build();
    }

    private String serializeReport(ClinicalReport report) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("observation", report.getObservation());
        document.put("diagnosticReport", report.getDiagnosticReport());
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize clinical report", e);
        }
    }

    @SuppressWarnings("unchecked")
    private ClinicalReport deserializeReport(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            Map<String, Object> document = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            return new ClinicalReport(
                    (Map<String, Object>) document.get("observation"),
                    (Map<String, Object>) document.get("diagnosticReport"));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize clinical report", e);
            return null;
        }
    }
}
