package com.drawforecast.service.job;

import com.drawforecast.service.service.ForecastService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background triggers of the forecast cycle.
 *
 * <ul>
 *   <li>Startup: initial fetch and training once the application is ready.</li>
 *   <li>Continuous learning every {@code forecast.training.interval-ms} (default 180 s).</li>
 *   <li>Resolution check every {@code forecast.resolution.interval-ms} (default 15 s).</li>
 * </ul>
 * Each trigger subscribes and returns at once; errors are logged and the next tick runs
 * as scheduled.
 */
@Component
public class ForecastScheduler {

    private static final Logger log = LoggerFactory.getLogger(ForecastScheduler.class);

    private final ForecastService forecastService;

    public ForecastScheduler(ForecastService forecastService) {
        this.forecastService = forecastService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initialize() {
        log.info("Initial draw history load started");
        forecastService.learn().subscribe(
            inserted -> log.info("Initial draw history loaded. newRecords={} ready={}",
                                 inserted, forecastService.isReady()),
            err -> log.error("Initial draw history load failed", err));
    }

    @Scheduled(fixedDelayString = "${forecast.training.interval-ms:180000}",
               initialDelayString = "${forecast.training.interval-ms:180000}")
    public void continuousLearning() {
        forecastService.learn().subscribe(
            inserted -> log.info("Continuous learning pass complete. newRecords={}", inserted),
            err -> log.error("Continuous learning pass failed", err));
    }

    @Scheduled(fixedDelayString = "${forecast.resolution.interval-ms:15000}",
               initialDelayString = "${forecast.resolution.interval-ms:15000}")
    public void resolutionCheck() {
        forecastService.checkResults().subscribe(
            resolved -> {
                if (resolved > 0) log.info("Resolution check complete. resolved={}", resolved);
            },
            err -> log.error("Resolution check failed", err));
    }
}
