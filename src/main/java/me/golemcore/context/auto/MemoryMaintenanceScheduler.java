package me.golemcore.context.auto;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.model.CleanupReport;
import me.golemcore.context.domain.model.PromotionReport;
import me.golemcore.context.domain.service.EngineSettingsService;
import me.golemcore.context.domain.service.MemoryCleanupService;
import me.golemcore.context.domain.service.MemoryPromotionService;
import me.golemcore.context.infrastructure.config.EngineProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs memory promotion and cleanup as two independent periodic tasks.
 *
 * <p>
 * Each task has its own guard: while a run is in progress the next tick of
 * the same task is skipped, and an explicit {@link #runPromotion()} or
 * {@link #runCleanup()} is refused. The two tasks may overlap each other and
 * any in-flight compaction; they only touch whole memory records by id.
 *
 * <p>
 * Configuration is re-read from {@link EngineSettingsService} on every run, so
 * settings changes apply without a restart.
 *
 * @see MemoryPromotionService
 * @see MemoryCleanupService
 */
@Component
@Slf4j
public class MemoryMaintenanceScheduler {

    private final MemoryPromotionService promotionService;
    private final MemoryCleanupService cleanupService;
    private final EngineSettingsService settingsService;
    private final EngineProperties properties;

    private final AtomicBoolean promotionRunning = new AtomicBoolean(false);
    private final AtomicBoolean cleanupRunning = new AtomicBoolean(false);
    private final AtomicReference<PromotionReport> lastPromotion = new AtomicReference<>();
    private final AtomicReference<CleanupReport> lastCleanup = new AtomicReference<>();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> promotionTask;
    private ScheduledFuture<?> cleanupTask;

    public MemoryMaintenanceScheduler(MemoryPromotionService promotionService, MemoryCleanupService cleanupService,
            EngineSettingsService settingsService, EngineProperties properties) {
        this.promotionService = promotionService;
        this.cleanupService = cleanupService;
        this.settingsService = settingsService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        EngineProperties.SchedulerProperties config = properties.getScheduler();
        if (!config.isEnabled()) {
            log.info("[Maintenance] Background memory maintenance disabled");
            return;
        }

        AtomicInteger counter = new AtomicInteger();
        scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "memory-maintenance-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        long initialDelay = config.getInitialDelay().toMillis();
        Duration promotionInterval = config.getPromotionInterval();
        Duration cleanupInterval = config.getCleanupInterval();
        promotionTask = scheduler.scheduleAtFixedRate(this::promotionTick, initialDelay,
                promotionInterval.toMillis(), TimeUnit.MILLISECONDS);
        cleanupTask = scheduler.scheduleAtFixedRate(this::cleanupTick, initialDelay,
                cleanupInterval.toMillis(), TimeUnit.MILLISECONDS);

        log.info("[Maintenance] Started: promotion every {}, cleanup every {}", promotionInterval, cleanupInterval);
    }

    @PreDestroy
    public void shutdown() {
        if (promotionTask != null) {
            promotionTask.cancel(false);
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Maintenance] Shut down");
    }

    /**
     * Run promotion now.
     *
     * @throws IllegalStateException
     *             if a promotion run is already in progress
     */
    public PromotionReport runPromotion() {
        if (!promotionRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("Promotion is already running");
        }
        try {
            return promote();
        } finally {
            promotionRunning.set(false);
        }
    }

    /**
     * Run cleanup now.
     *
     * @throws IllegalStateException
     *             if a cleanup run is already in progress
     */
    public CleanupReport runCleanup() {
        if (!cleanupRunning.compareAndSet(false, true)) {
            throw new IllegalStateException("Cleanup is already running");
        }
        try {
            return cleanup();
        } finally {
            cleanupRunning.set(false);
        }
    }

    public Optional<PromotionReport> getLastPromotionReport() {
        return Optional.ofNullable(lastPromotion.get());
    }

    public Optional<CleanupReport> getLastCleanupReport() {
        return Optional.ofNullable(lastCleanup.get());
    }

    void promotionTick() {
        if (!promotionRunning.compareAndSet(false, true)) {
            log.debug("[Maintenance] Promotion still running, skipping tick");
            return;
        }
        try {
            promote();
        } catch (Exception e) { // NOSONAR - must not kill the scheduler
            log.error("[Maintenance] Promotion run failed", e);
        } finally {
            promotionRunning.set(false);
        }
    }

    void cleanupTick() {
        if (!cleanupRunning.compareAndSet(false, true)) {
            log.debug("[Maintenance] Cleanup still running, skipping tick");
            return;
        }
        try {
            cleanup();
        } catch (Exception e) { // NOSONAR - must not kill the scheduler
            log.error("[Maintenance] Cleanup run failed", e);
        } finally {
            cleanupRunning.set(false);
        }
    }

    private PromotionReport promote() {
        PromotionReport report = promotionService.runPromotion(settingsService.getAutoUpgradeConfig());
        lastPromotion.set(report);
        return report;
    }

    private CleanupReport cleanup() {
        CleanupReport report = cleanupService.runCleanup(settingsService.getCleanupConfig());
        lastCleanup.set(report);
        return report;
    }
}
