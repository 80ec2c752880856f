package de.jwiegmann.ultraupload.client.transport;

import java.util.concurrent.atomic.AtomicBoolean;

public class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
