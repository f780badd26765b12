package me.golemcore.context;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Context.
 *
 * <p>
 * A tiered conversational memory engine that keeps long-running chat sessions
 * inside a model's token budget:
 *
 * <ul>
 * <li><b>Token budgeting</b> - picks prune, compact or truncate from usage
 * thresholds</li>
 * <li><b>Compression</b> - flag-based, so no message is ever deleted</li>
 * <li><b>Checkpoints</b> - named snapshots of a full transcript</li>
 * <li><b>Mid-term memory</b> - one record per compaction, with access
 * tracking</li>
 * <li><b>Promotion and cleanup</b> - background jobs that move memories to
 * long-term and expire stale ones</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound        → REST controllers (WebFlux)
 * Domain         → evaluator, engine, checkpoint, memory services
 * Outbound       → SQLite store, langchain4j summarizer and embeddings
 * </pre>
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextEngineApplication.class, args);
    }
}
