package smartaqms.compute.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import smartaqms.analytics.classifier.SoftmaxClassifier;
import smartaqms.analytics.detector.EnsembleScorer;
import smartaqms.config.ClassifierConfig;
import smartaqms.config.DetectorConfig;

import java.time.Clock;

/**
 * Beans de infraestructura: reloj UTC, objetos analíticos del core-domain y el planificador
 * de los ciclos periódicos.
 */
@Configuration
@EnableScheduling
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DetectorConfig detectorConfig(AqmsProperties properties) {
        AqmsProperties.Detector d = properties.getDetector();
        return DetectorConfig.builder()
                .zThreshold(d.getZThreshold())
                .contamination(d.getContamination())
                .minSamples(d.getMinSamples())
                .treeCount(d.getTreeCount())
                .subsampleSize(d.getSubsampleSize())
                .seed(d.getSeed())
                .build();
    }

    @Bean
    public ClassifierConfig classifierConfig(AqmsProperties properties) {
        AqmsProperties.Classifier c = properties.getClassifier();
        return ClassifierConfig.builder()
                .learningRate(c.getLearningRate())
                .l2(c.getL2())
                .miniBatchSize(c.getMiniBatchSize())
                .epochs(c.getEpochs())
                .seed(c.getSeed())
                .build();
    }

    @Bean
    public EnsembleScorer ensembleScorer(DetectorConfig detectorConfig) {
        return new EnsembleScorer(detectorConfig);
    }

    @Bean
    public SoftmaxClassifier softmaxClassifier(ClassifierConfig classifierConfig) {
        return new SoftmaxClassifier(classifierConfig);
    }

    /**
     * Un hilo por ciclo analítico más uno para las tareas {@code @Scheduled} (métricas, simulador).
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("aqms-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
