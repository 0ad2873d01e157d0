package smartaqms.compute.service;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import smartaqms.compute.config.AqmsProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;

/**
 * Lanza los dos ciclos analíticos como tareas periódicas independientes, cada una con su
 * cadencia, su hilo de trabajo y su {@link PeriodicCycleRunner}. No comparten estado mutable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyticsScheduler {

    private final TaskScheduler taskScheduler;
    private final OutlierDetectionService outlierDetectionService;
    private final OnlineClassifierService onlineClassifierService;
    private final MetricsRecorder metrics;
    private final AqmsProperties properties;

    private final List<ExecutorService> workers = new ArrayList<>();
    private final List<ScheduledFuture<?>> schedules = new ArrayList<>();

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.getScheduling().isEnabled()) {
            log.info("Periodic analytical cycles disabled (aqms.scheduling.enabled=false)");
            return;
        }
        AqmsProperties.Detector detector = properties.getDetector();
        AqmsProperties.Classifier classifier = properties.getClassifier();

        schedule(OutlierDetectionService.TASK, outlierDetectionService::runCycle,
                detector.getInterval(), detector.getCycleTimeout());
        schedule(OnlineClassifierService.TASK, onlineClassifierService::runCycle,
                classifier.getInterval(), classifier.getCycleTimeout());
    }

    private synchronized void schedule(String task, Runnable cycle, Duration interval, Duration timeout) {
        ExecutorService worker = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("aqms-" + task + "-"));
        workers.add(worker);
        PeriodicCycleRunner runner = new PeriodicCycleRunner(task, cycle, timeout, worker, metrics);
        schedules.add(taskScheduler.scheduleAtFixedRate(runner::tick, interval));
        log.info("Scheduled {} cycle every {} (timeout {})", task, interval, timeout);
    }

    @PreDestroy
    public synchronized void stop() {
        schedules.forEach(s -> s.cancel(false));
        workers.forEach(ExecutorService::shutdownNow);
    }
}
