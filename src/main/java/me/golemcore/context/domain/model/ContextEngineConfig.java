package me.golemcore.context.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import me.golemcore.context.domain.exception.ConfigurationException;

/**
 * Token budget and compression settings. Validated on construction, so every
 * instance a service receives is consistent.
 *
 * @param pruneMinChars
 *            tool outputs shorter than this are never pruned
 * @param checkpointBeforeCompression
 *            take a safety checkpoint before compact and truncate
 */
@Builder(toBuilder = true)
public record ContextEngineConfig(boolean enabled, int maxTokens, int modelContextLimit, int modelOutputLimit,
        double pruneThreshold, double compactThreshold, double truncateThreshold, int messagesToKeep,
        int checkpointInterval, int pruneMinChars, boolean checkpointBeforeCompression) {

    public static final int DEFAULT_MAX_TOKENS = 200_000;
    public static final int DEFAULT_MODEL_CONTEXT_LIMIT = 200_000;
    public static final int DEFAULT_MODEL_OUTPUT_LIMIT = 16_000;
    public static final double DEFAULT_PRUNE_THRESHOLD = 0.70;
    public static final double DEFAULT_COMPACT_THRESHOLD = 0.85;
    public static final double DEFAULT_TRUNCATE_THRESHOLD = 0.95;
    public static final int DEFAULT_MESSAGES_TO_KEEP = 3;
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 20;
    public static final int DEFAULT_PRUNE_MIN_CHARS = 500;

    public ContextEngineConfig {
        requirePositive("maxTokens", maxTokens);
        requirePositive("modelContextLimit", modelContextLimit);
        if (modelOutputLimit < 0) {
            throw new ConfigurationException("modelOutputLimit must not be negative: " + modelOutputLimit);
        }
        requireFraction("pruneThreshold", pruneThreshold);
        requireFraction("compactThreshold", compactThreshold);
        requireFraction("truncateThreshold", truncateThreshold);
        if (pruneThreshold > compactThreshold) {
            throw new ConfigurationException("pruneThreshold (" + pruneThreshold
                    + ") must not exceed compactThreshold (" + compactThreshold + ")");
        }
        if (compactThreshold > truncateThreshold) {
            throw new ConfigurationException("compactThreshold (" + compactThreshold
                    + ") must not exceed truncateThreshold (" + truncateThreshold + ")");
        }
        requirePositive("messagesToKeep", messagesToKeep);
        if (checkpointInterval < 0) {
            throw new ConfigurationException("checkpointInterval must not be negative: " + checkpointInterval);
        }
        if (pruneMinChars < 0) {
            throw new ConfigurationException("pruneMinChars must not be negative: " + pruneMinChars);
        }
    }

    public static ContextEngineConfig defaults() {
        return new ContextEngineConfig(true, DEFAULT_MAX_TOKENS, DEFAULT_MODEL_CONTEXT_LIMIT,
                DEFAULT_MODEL_OUTPUT_LIMIT, DEFAULT_PRUNE_THRESHOLD, DEFAULT_COMPACT_THRESHOLD,
                DEFAULT_TRUNCATE_THRESHOLD, DEFAULT_MESSAGES_TO_KEEP, DEFAULT_CHECKPOINT_INTERVAL,
                DEFAULT_PRUNE_MIN_CHARS, true);
    }

    @JsonIgnore
    public boolean isAutoCheckpointEnabled() {
        return checkpointInterval > 0;
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be positive: " + value);
        }
    }

    private static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be within [0, 1]: " + value);
        }
    }
}
