package smartaqms.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import smartaqms.domain.alert.AlertSeverity;
import smartaqms.domain.alert.AlertStatus;
import smartaqms.domain.prediction.AqiCategory;
import smartaqms.domain.reading.Quantity;

import static org.junit.jupiter.api.Assertions.*;

class DomainEnumsTest {

    @Test
    @DisplayName("AQI: los cortes 12 / 35 / 55 de PM2.5 separan las cuatro categorías")
    void aqiCategory_fromPm25_usesBreakpoints() {
        assertEquals(AqiCategory.GOOD, AqiCategory.fromPm25(12.0));
        assertEquals(AqiCategory.MODERATE, AqiCategory.fromPm25(12.1));
        assertEquals(AqiCategory.MODERATE, AqiCategory.fromPm25(35.0));
        assertEquals(AqiCategory.UNHEALTHY, AqiCategory.fromPm25(55.0));
        assertEquals(AqiCategory.HAZARDOUS, AqiCategory.fromPm25(55.1));
        assertEquals(4, AqiCategory.count());
        assertEquals(AqiCategory.UNHEALTHY, AqiCategory.ofIndex(2));
    }

    @Test
    @DisplayName("Severidad: monótona no decreciente en la puntuación normalizada")
    void severity_isMonotonicInScore() {
        AlertSeverity previous = AlertSeverity.LOW;
        for (double score = 0.0; score <= 6.0; score += 0.05) {
            AlertSeverity current = AlertSeverity.fromNormalizedScore(score);
            assertTrue(current.isAtLeast(previous), "Severity decreased at score " + score);
            previous = current;
        }
        assertEquals(AlertSeverity.CRITICAL, previous);
        assertEquals(AlertSeverity.LOW, AlertSeverity.fromNormalizedScore(Double.NaN));
    }

    @Test
    @DisplayName("Ciclo de vida: RESOLVED es terminal y no se puede volver a OPEN")
    void alertStatus_transitions() {
        assertTrue(AlertStatus.OPEN.canTransitionTo(AlertStatus.ACKNOWLEDGED));
        assertTrue(AlertStatus.OPEN.canTransitionTo(AlertStatus.RESOLVED));
        assertTrue(AlertStatus.ACKNOWLEDGED.canTransitionTo(AlertStatus.RESOLVED));

        assertFalse(AlertStatus.ACKNOWLEDGED.canTransitionTo(AlertStatus.OPEN));
        for (AlertStatus target : AlertStatus.values()) {
            assertFalse(AlertStatus.RESOLVED.canTransitionTo(target));
        }
    }

    @Test
    @DisplayName("Magnitudes: rangos físicos y orden fijo del vector core")
    void quantity_rangesAndCoreOrder() {
        assertFalse(Quantity.HUMIDITY.isWithinRange(150.0));
        assertTrue(Quantity.HUMIDITY.isWithinRange(100.0));
        assertFalse(Quantity.PM25.isWithinRange(-0.1));
        assertFalse(Quantity.TEMPERATURE.isWithinRange(Double.NaN));
        assertTrue(Quantity.TEMPERATURE.isWithinRange(-20.0));

        assertEquals(5, Quantity.core().size());
        assertEquals(0, Quantity.PM25.coreIndex());
        assertEquals(-1, Quantity.PM10.coreIndex());
        assertEquals(Quantity.WIND_SPEED, Quantity.fromString(" wind_speed "));
        assertNull(Quantity.fromString("benzene"));
        assertEquals(Quantity.PM25, Quantity.fromString("pm2.5"));
        assertEquals(Quantity.WIND_SPEED, Quantity.fromString("Wind-Speed"));
        assertEquals(5, Quantity.coreResolution().length);
        assertEquals(Quantity.PM25.getResolution(), Quantity.coreResolution()[0]);
    }
}
