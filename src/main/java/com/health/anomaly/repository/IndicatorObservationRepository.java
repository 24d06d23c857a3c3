package com.health.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.health.anomaly.config.AerospikeConfig;
import com.health.anomaly.model.IndicatorObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Read access to stored health-indicator observations. Rows without a usable numeric value
 * never leave this class.
 */
@Repository
public class IndicatorObservationRepository {

    private static final Logger log = LoggerFactory.getLogger(IndicatorObservationRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public IndicatorObservationRepository(AerospikeClient client,
                                          @Qualifier("aerospikeNamespace") String namespace,
                                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(IndicatorObservation observation) {
        String id = observation.getIndicatorCode() + "|" + observation.getCountry() + "|" + observation.getYear();
        Key key = new Key(namespace, AerospikeConfig.SET_HEALTH_INDICATORS, id);

        client.put(writePolicy, key,
                new Bin("indicatorCode", observation.getIndicatorCode()),
                new Bin("country", observation.getCountry()),
                new Bin("year", observation.getYear()),
                new Bin("value", observation.getValue()));
    }

    public List<IndicatorObservation> findAll() {
        List<IndicatorObservation> results = new ArrayList<>();
        int[] discarded = {0};
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_HEALTH_INDICATORS,
                (key, record) -> {
                    IndicatorObservation observation = mapRecord(record);
                    synchronized (results) {
                        if (observation == null) {
                            discarded[0]++;
                        } else {
                            results.add(observation);
                        }
                    }
                });

        if (discarded[0] > 0) {
            log.debug("Discarded {} observations without a numeric value", discarded[0]);
        }
        return results;
    }

    private IndicatorObservation mapRecord(Record record) {
        Object code = record.getValue("indicatorCode");
        Object country = record.getValue("country");
        Integer year = parseYear(record.getValue("year"));
        Double value = parseValue(record.getValue("value"));
        if (!(code instanceof String) || !(country instanceof String) || year == null || value == null) {
            return null;
        }
        return IndicatorObservation.builder()
                .indicatorCode((String) code)
                .country((String) country)
                .year(year)
                .value(value)
                .build();
    }

    /**
     * Numeric value of a stored bin, or null when it is missing, non-numeric or not finite.
     */
    static Double parseValue(Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                value = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    static Integer parseYear(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).intValue();
        }
        if (raw instanceof String) {
            try {
                return Integer.parseInt(((String) raw).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
