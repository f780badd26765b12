package me.golemcore.context.domain.exception;

/**
 * Read or write failure against the persisted store. The failed operation is
 * rolled back and the error is propagated to the caller.
 */
public class StorageException extends ContextEngineException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
