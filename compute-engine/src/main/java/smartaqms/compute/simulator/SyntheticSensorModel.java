package smartaqms.compute.simulator;

import smartaqms.domain.reading.Quantity;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Modelo sintético por estación: paseo aleatorio de PM2.5 con patrón diurno y picos
 * ocasionales de contaminación, CO2 con deriva lenta, temperatura diurna y humedad inversa.
 */
class SyntheticSensorModel {

    private static final double SPIKE_PROBABILITY = 0.02;

    private final Random random;
    private final Map<String, double[]> state = new HashMap<>();

    SyntheticSensorModel(long seed) {
        this.random = new Random(seed);
    }

    synchronized Map<Quantity, Double> step(String stationId, LocalDateTime at) {
        // {pm25, co2, wind}
        double[] s = state.computeIfAbsent(stationId, id -> new double[]{
                uniform(5, 25), uniform(400, 700), uniform(0, 5)});
        double dayFraction = (at.getHour() * 60 + at.getMinute()) / 1440.0;
        double diurnal = 10 + 10 * Math.sin(2 * Math.PI * dayFraction);

        s[0] = Math.max(0, s[0] + random.nextGaussian());
        if (random.nextDouble() < SPIKE_PROBABILITY) {
            s[0] += uniform(20, 60);
        } else {
            // Relajación hacia el nivel de fondo tras un pico
            s[0] = s[0] > 40 ? s[0] * 0.9 : s[0];
        }
        s[1] = clamp(s[1] + random.nextGaussian() * 5, 350, 2000);
        s[2] = clamp(s[2] + random.nextGaussian() * 0.2, 0, 12);

        double temp = 18 + 7 * Math.sin(2 * Math.PI * dayFraction) + random.nextGaussian() * 0.5;
        double hum = clamp(60 - (temp - 18) * 1.2 + random.nextGaussian() * 2, 15, 95);
        double pm25 = clamp(s[0] + diurnal, 0, 1000);

        Map<Quantity, Double> values = new EnumMap<>(Quantity.class);
        values.put(Quantity.PM25, pm25);
        values.put(Quantity.CO2, s[1]);
        values.put(Quantity.TEMPERATURE, temp);
        values.put(Quantity.HUMIDITY, hum);
        values.put(Quantity.WIND_SPEED, s[2]);
        values.put(Quantity.PM10, clamp(pm25 * uniform(1.2, 1.8), 0, 1000));
        values.put(Quantity.PRESSURE, uniform(1005, 1020));
        if (random.nextDouble() < 0.5) {
            values.put(Quantity.NO2, uniform(0.005, 0.08));
            values.put(Quantity.O3, uniform(0.01, 0.07));
        }
        return values;
    }

    synchronized double confidence() {
        return uniform(0.75, 1.0);
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
