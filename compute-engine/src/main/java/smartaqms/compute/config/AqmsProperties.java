package smartaqms.compute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Superficie de configuración del motor (prefijo {@code aqms}).
 * Todas las claves admiten variables de entorno por binding relajado, ej: {@code AQMS_DETECTOR_INTERVAL=PT15S}.
 */
@Component
@ConfigurationProperties(prefix = "aqms")
@Data
public class AqmsProperties {

    private Ingest ingest = new Ingest();
    private Store store = new Store();
    private Detector detector = new Detector();
    private Classifier classifier = new Classifier();
    private Window window = new Window();
    private Alert alert = new Alert();
    private Metrics metrics = new Metrics();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Ingest {
        /**
         * Lecturas por minuto que produce el alimentador sintético.
         */
        private int targetRate = 1800;
        private int batchSize = 600;
        private Duration maxFutureSkew = Duration.ofMinutes(5);
        private Duration maxLateness = Duration.ofDays(7);
    }

    @Data
    public static class Store {
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            private int maxAttempts = 3;
            private Duration baseDelay = Duration.ofMillis(200);
            private Duration maxDelay = Duration.ofSeconds(5);
        }
    }

    @Data
    public static class Detector {
        private Duration interval = Duration.ofSeconds(30);
        private Duration window = Duration.ofMinutes(60);
        private double contamination = 0.05;
        private double zThreshold = 3.0;
        private int minSamples = 20;
        private int treeCount = 100;
        private int subsampleSize = 256;
        private Duration baselinePeriod = Duration.ofHours(24);
        /**
         * Máximo de lecturas históricas usadas para la línea base de una zona.
         */
        private int baselineMaxSamples = 5000;
        private double minQuality = 0.7;
        private long seed = 42L;
        private Duration cycleTimeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Classifier {
        private Duration interval = Duration.ofSeconds(45);
        private Duration window = Duration.ofMinutes(120);
        private double learningRate = 0.05;
        private double l2 = 1.0e-4;
        private int miniBatchSize = 32;
        private int epochs = 1;
        private long seed = 42L;
        /**
         * Solo las lecturas con calidad igual o superior entrenan; todas reciben predicción.
         */
        private double minTrainingQuality = 0.8;
        private Duration cycleTimeout = Duration.ofSeconds(40);
    }

    @Data
    public static class Window {
        private int maxReadings = 5000;
    }

    @Data
    public static class Alert {
        private Duration cooldown = Duration.ofMinutes(15);
        private CooldownScope cooldownScope = CooldownScope.ZONE;
        private double pm25High = 55.0;
        private double pm25Critical = 100.0;
        private double co2Moderate = 800.0;

        public enum CooldownScope {
            ZONE, STATION
        }
    }

    @Data
    public static class Metrics {
        private Duration interval = Duration.ofSeconds(30);
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
    }
}
