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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mid-term memory record written by one compaction event.
 *
 * <p>
 * {@code messageStart}/{@code messageEnd} are the ids of the first and last
 * message of the condensed range. The tier only ever moves
 * {@code mid-term -> long-term}; {@link #promote(Instant)} is the single place
 * that performs the move and records it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CompactedSession {

    private String id;
    private String sessionId;
    private String summary;

    @Builder.Default
    private List<String> keyTopics = new ArrayList<>();

    @Builder.Default
    private List<String> decisions = new ArrayList<>();

    private String messageStart;
    private String messageEnd;
    private int messageCount;

    private Instant createdAt;
    private Instant lastAccessedAt;
    private int accessCount;

    @Builder.Default
    private MemoryTier tier = MemoryTier.MID_TERM;
    private Instant tierUpdatedAt;

    @Builder.Default
    private List<TierTransition> promotionHistory = new ArrayList<>();

    public boolean isMidTerm() {
        return tier == MemoryTier.MID_TERM;
    }

    public boolean isLongTerm() {
        return tier == MemoryTier.LONG_TERM;
    }

    public TierTransition promote(Instant at) {
        if (tier != MemoryTier.MID_TERM) {
            throw new IllegalStateException("Memory " + id + " is already " + tier.getValue());
        }
        TierTransition transition = new TierTransition(MemoryTier.MID_TERM, MemoryTier.LONG_TERM, at);
        List<TierTransition> history = promotionHistory != null ? new ArrayList<>(promotionHistory)
                : new ArrayList<>();
        history.add(transition);
        this.promotionHistory = history;
        this.tier = MemoryTier.LONG_TERM;
        this.tierUpdatedAt = at;
        return transition;
    }
}
