package me.golemcore.context.domain.exception;

/**
 * Summarizer failure or timeout. Recovered inside the compression engine by
 * falling back to prune.
 */
public class SummarizationException extends ContextEngineException {

    private static final long serialVersionUID = 1L;

    public SummarizationException(String message) {
        super(message);
    }

    public SummarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
