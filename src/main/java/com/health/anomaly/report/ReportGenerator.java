package com.health.anomaly.report;

import com.health.anomaly.model.ClinicalReport;
import com.health.anomaly.model.Severity;
import com.health.anomaly.model.Trend;

/**
 * Maps a scored anomaly onto clinical interoperability resources.
 */
public interface ReportGenerator {

    ClinicalReport generate(String subjectId, String subjectType, String indicatorCode, String indicatorName,
                            Severity severity, Trend trend, String explanation);
}
