package me.golemcore.context.domain.service;

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

import me.golemcore.context.domain.model.CompressionAction;
import me.golemcore.context.domain.model.ContextEngineConfig;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.TokenUsage;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Measures the active part of a transcript against the effective token limit
 * and picks the compression action for it.
 *
 * <p>
 * Thresholds are tested from the most to the least severe, so a transcript
 * above the truncate threshold is truncated even though it is also above the
 * compact and prune thresholds.
 *
 * <p>
 * Messages without a stored token count are estimated from their character
 * length (one token per {@value #CHARS_PER_TOKEN} characters, rounded up).
 */
@Service
public class TokenBudgetEvaluator {

    static final int CHARS_PER_TOKEN = 4;
    static final long MIN_EFFECTIVE_LIMIT = 1024;

    public CompressionAction evaluate(List<Message> messages, ContextEngineConfig config) {
        if (!config.enabled()) {
            return CompressionAction.NONE;
        }
        return decide(measure(messages, config), config);
    }

    public CompressionAction decide(TokenUsage usage, ContextEngineConfig config) {
        if (!config.enabled()) {
            return CompressionAction.NONE;
        }
        double ratio = usage.usageRatio();
        if (ratio >= config.truncateThreshold()) {
            return CompressionAction.TRUNCATE;
        }
        if (ratio >= config.compactThreshold()) {
            return CompressionAction.COMPACT;
        }
        if (ratio >= config.pruneThreshold()) {
            return CompressionAction.PRUNE;
        }
        return CompressionAction.NONE;
    }

    /**
     * Token usage of the active messages in {@code messages}; condensed and
     * truncated ones are ignored.
     */
    public TokenUsage measure(List<Message> messages, ContextEngineConfig config) {
        long limit = effectiveLimit(config);
        List<Message> active = Message.activeOnly(messages);
        long used = sumTokens(active);
        return new TokenUsage(used, limit, (double) used / limit, active.size());
    }

    public long effectiveLimit(ContextEngineConfig config) {
        long window = Math.min(config.maxTokens(), config.modelContextLimit());
        return Math.max(MIN_EFFECTIVE_LIMIT, window - config.modelOutputLimit());
    }

    public long sumTokens(List<Message> messages) {
        long total = 0;
        for (Message message : messages) {
            total += tokensOf(message);
        }
        return total;
    }

    public int tokensOf(Message message) {
        if (message.isPruned()) {
            return estimateTokens(message.getEffectiveContent());
        }
        Integer stored = message.getTokenCount();
        return stored != null ? stored : estimateTokens(message.getContent());
    }

    public int estimateTokens(String content) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        return (content.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
