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

import java.util.Locale;

/**
 * Compression action chosen by the token budget evaluator, ordered from least
 * to most severe.
 */
public enum CompressionAction {
    NONE, PRUNE, COMPACT, TRUNCATE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CompressionAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Compression action is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CompressionAction action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown compression action: " + value);
    }
}
