package de.jwiegmann.ultraupload.client;

/**
 * Lebenszyklus einer Datei. Übergänge gehen nur vorwärts, Endzustände sind endgültig.
 */
public enum UploadTaskState {
    QUEUED,
    VALIDATING,
    TRANSFORMING,
    TRANSMITTING,
    AWAITING_SCAN,
    FINALIZED(true),
    INVALID(true),
    FAILED(true),
    CANCELLED(true);

    private final boolean terminal;

    UploadTaskState() {
        this(false);
    }

    UploadTaskState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean canTransitionTo(UploadTaskState next) {
        return !terminal && next.ordinal() > ordinal();
    }
}
