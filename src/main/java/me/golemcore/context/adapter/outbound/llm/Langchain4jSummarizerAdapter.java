package me.golemcore.context.adapter.outbound.llm;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.context.domain.exception.SummarizationException;
import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.SummaryResult;
import me.golemcore.context.infrastructure.config.EngineProperties;
import me.golemcore.context.port.outbound.SummarizerPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Summarizer backed by an OpenAI-compatible chat model through langchain4j.
 *
 * <p>
 * The model is asked for a JSON object
 * {@code {"summary": ..., "keyTopics": [...], "decisions": [...]}}. A reply
 * that is not JSON is taken as the summary text with no topics or decisions.
 *
 * <p>
 * Calls run on a private pool. Cancelling the returned future interrupts the
 * worker thread.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code engine.summarizer.api-key} - API key; without it the summarizer
 * reports itself unavailable
 * <li>{@code engine.summarizer.base-url} - optional OpenAI-compatible endpoint
 * <li>{@code engine.summarizer.model} - model name
 * </ul>
 */
@Component
@Slf4j
public class Langchain4jSummarizerAdapter implements SummarizerPort {

    static final String OUTPUT_INSTRUCTIONS = """
            Reply with a single JSON object and nothing else:
            {"summary": "<summary text>", "keyTopics": ["<topic>", ...], "decisions": ["<decision>", ...]}
            Use at most 5 key topics and at most 5 decisions.""";

    private static final String TRUNCATION_SUFFIX = "...";

    private final EngineProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    private volatile ChatModel chatModel;
    private volatile boolean initialized = false;

    @Autowired
    public Langchain4jSummarizerAdapter(EngineProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "summarizer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Constructor for tests that supply the model directly.
     */
    Langchain4jSummarizerAdapter(EngineProperties properties, ObjectMapper objectMapper, ChatModel chatModel) {
        this(properties, objectMapper);
        this.chatModel = chatModel;
        this.initialized = true;
    }

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        EngineProperties.SummarizerProperties config = properties.getSummarizer();
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Summarizer] API key not configured, compaction will fall back to pruning");
            initialized = true;
            return;
        }

        try {
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(config.getModel())
                    .timeout(config.getTimeout());
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (config.getTemperature() != null) {
                builder.temperature(config.getTemperature());
            }
            chatModel = builder.build();
            log.info("[Summarizer] Chat model initialized: {}", config.getModel());
        } catch (RuntimeException e) {
            log.error("[Summarizer] Failed to initialize chat model", e);
        }

        initialized = true;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }

    @Override
    public CompletableFuture<SummaryResult> summarize(List<Message> messages, String hintPrompt) {
        CompletableFuture<SummaryResult> result = new CompletableFuture<>();
        Future<?> call = executor.submit(() -> {
            try {
                result.complete(call(messages, hintPrompt));
            } catch (Exception e) { // NOSONAR - reported through the future
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((summary, error) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        return result;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private SummaryResult call(List<Message> messages, String hintPrompt) {
        ensureInitialized();
        if (chatModel == null) {
            throw new SummarizationException("Summarizer model not available");
        }

        List<ChatMessage> prompt = new ArrayList<>();
        prompt.add(SystemMessage.from(hintPrompt + "\n\n" + OUTPUT_INSTRUCTIONS));
        prompt.add(UserMessage.from(formatTranscript(messages)));

        ChatResponse response = chatModel.chat(ChatRequest.builder().messages(prompt).build());
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        log.debug("[Summarizer] Summarized {} messages ({} chars)", messages.size(),
                text != null ? text.length() : 0);
        return parse(text);
    }

    String formatTranscript(List<Message> messages) {
        int maxChars = properties.getSummarizer().getMaxCharsPerMessage();
        StringBuilder sb = new StringBuilder();
        for (Message message : messages) {
            String content = message.getEffectiveContent() != null ? message.getEffectiveContent() : "";
            if (content.length() > maxChars) {
                content = content.substring(0, maxChars) + TRUNCATION_SUFFIX;
            }
            String role = message.isToolMessage() && message.getToolName() != null
                    ? message.getRole() + " (" + message.getToolName() + ")"
                    : message.getRole();
            sb.append(role).append(": ").append(content).append('\n');
        }
        return sb.toString();
    }

    SummaryResult parse(String text) {
        if (text == null || text.isBlank()) {
            return new SummaryResult(null, List.of(), List.of());
        }
        String trimmed = stripCodeFence(text.trim());
        if (!trimmed.startsWith("{")) {
            return new SummaryResult(trimmed, List.of(), List.of());
        }
        try {
            JsonNode root = objectMapper.readTree(trimmed);
            JsonNode summary = root.path("summary");
            if (!summary.isTextual()) {
                return new SummaryResult(trimmed, List.of(), List.of());
            }
            return new SummaryResult(summary.asText(), textList(root.path("keyTopics")),
                    textList(root.path("decisions")));
        } catch (IOException e) {
            log.debug("[Summarizer] Reply is not valid JSON, using it as plain text: {}", e.getMessage());
            return new SummaryResult(trimmed, List.of(), List.of());
        }
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    values.add(item.asText().trim());
                }
            }
        }
        return values;
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int lastFence = text.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, lastFence).trim();
    }
}
