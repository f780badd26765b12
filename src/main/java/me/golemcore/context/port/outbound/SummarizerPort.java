package me.golemcore.context.port.outbound;

import me.golemcore.context.domain.model.Message;
import me.golemcore.context.domain.model.SummaryResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the summarizer used by compaction. The returned future must honour
 * {@code cancel(true)}.
 */
public interface SummarizerPort {

    CompletableFuture<SummaryResult> summarize(List<Message> messages, String hintPrompt);

    boolean isAvailable();
}
