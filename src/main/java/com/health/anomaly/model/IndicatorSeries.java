package com.health.anomaly.model;

import lombok.Value;

import java.util.Comparator;
import java.util.List;

/**
 * Chronologically ordered values of one indicator for one country.
 */
@Value
public class IndicatorSeries {

    String indicatorCode;
    String country;
    List<IndicatorObservation> points;

    public static IndicatorSeries of(String indicatorCode, String country, List<IndicatorObservation> observations) {
        List<IndicatorObservation> sorted = observations.stream()
                .sorted(Comparator.comparingInt(IndicatorObservation::getYear))
                .toList();
        return new IndicatorSeries(indicatorCode, country, sorted);
    }

    public int size() {
        return points.size();
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }
}
