package smartaqms.compute.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.domain.alert.AlertSeverity;
import smartaqms.domain.alert.DetectionMethod;

import java.util.ArrayList;
import java.util.List;

/**
 * Límites fijos de concentración, evaluados junto al ensemble en cada ciclo del detector.
 * Sus alertas pasan por el mismo cooldown que las estadísticas.
 */
@Component
@RequiredArgsConstructor
public class HardLimitRules {

    public static final String PM25_LIMIT = "PM25_LIMIT";
    public static final String CO2_LIMIT = "CO2_LIMIT";

    private final AqmsProperties properties;

    public List<AlertCandidate> evaluate(ReadingEntity reading, String zone) {
        AqmsProperties.Alert limits = properties.getAlert();
        List<AlertCandidate> out = new ArrayList<>(2);

        double pm25 = reading.getPm25();
        if (pm25 > limits.getPm25Critical()) {
            out.add(candidate(reading, zone, PM25_LIMIT, AlertSeverity.CRITICAL, pm25, limits.getPm25Critical()));
        } else if (pm25 > limits.getPm25High()) {
            out.add(candidate(reading, zone, PM25_LIMIT, AlertSeverity.HIGH, pm25, limits.getPm25High()));
        }

        double co2 = reading.getCo2();
        if (co2 > limits.getCo2Moderate()) {
            out.add(candidate(reading, zone, CO2_LIMIT, AlertSeverity.MODERATE, co2, limits.getCo2Moderate()));
        }
        return out;
    }

    private static AlertCandidate candidate(ReadingEntity reading, String zone, String type,
                                            AlertSeverity severity, double value, double limit) {
        return AlertCandidate.builder()
                .readingId(reading.getId())
                .stationId(reading.getStationId())
                .zone(zone)
                .alertType(type)
                .severity(severity)
                .method(DetectionMethod.RULE)
                .score(value / limit)
                .message(String.format("Valor por encima del límite (%s): %.2f > %.2f",
                        type.replace("_LIMIT", ""), value, limit))
                .build();
    }
}
