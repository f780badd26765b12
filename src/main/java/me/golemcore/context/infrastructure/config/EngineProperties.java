package me.golemcore.context.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Start-up configuration of the context engine, bound from
 * application.properties.
 *
 * <p>
 * Everything lives under the {@code engine.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace directory and SQLite file</li>
 * <li>{@link SummarizerProperties} - chat model used for compaction</li>
 * <li>{@link EmbeddingProperties} - embedding model for long-term memories</li>
 * <li>{@link SessionProperties} - per-session worker pool</li>
 * <li>{@link SchedulerProperties} - promotion and cleanup timers</li>
 * <li>{@link ContextDefaults}, {@link MemoryDefaults} - initial values of the
 * user-editable settings</li>
 * </ul>
 *
 * <p>
 * The user-editable part is only a default: once
 * {@code preferences/engine-settings.json} exists it wins.
 */
@Component
@ConfigurationProperties(prefix = "engine")
@Data
public class EngineProperties {

    private StorageProperties storage = new StorageProperties();
    private SummarizerProperties summarizer = new SummarizerProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private SessionProperties session = new SessionProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private ContextDefaults context = new ContextDefaults();
    private MemoryDefaults memory = new MemoryDefaults();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/context";
        private String databaseFile = "context.db";
    }

    @Data
    public static class SummarizerProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private Double temperature = 0.3;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxCharsPerMessage = 2000;
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String model = "text-embedding-3-small";
    }

    @Data
    public static class SessionProperties {
        private int workerThreads = 4;
        private int maxQueuedTasks = 100;
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private Duration initialDelay = Duration.ofMinutes(1);
        private Duration promotionInterval = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofHours(6);
        private Duration embeddingWait = Duration.ofSeconds(10);
    }

    @Data
    public static class ContextDefaults {
        private boolean enabled = true;
        private int maxTokens = 200_000;
        private int modelContextLimit = 200_000;
        private int modelOutputLimit = 16_000;
        private double pruneThreshold = 0.70;
        private double compactThreshold = 0.85;
        private double truncateThreshold = 0.95;
        private int messagesToKeep = 3;
        private int checkpointInterval = 20;
        private int pruneMinChars = 500;
        private boolean checkpointBeforeCompression = true;
    }

    @Data
    public static class MemoryDefaults {
        private boolean autoUpgradeEnabled = true;
        private int daysThreshold = 30;
        private int minAccessCount = 3;
        private int promotionBatchSize = 10;
        private int retentionDays = 30;
        private int expiryMinAccessCount = 3;
    }
}
