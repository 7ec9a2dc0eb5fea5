package screennav.navigator;

/**
 * Cooperative cancellation flag checked by the navigator between edges.
 * Thread interruption is honoured as well.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private volatile boolean canceled;

    /** A token nobody cancels. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared no-op token cannot be canceled");
        }
        canceled = true;
    }

    public boolean isCanceled() {
        return canceled || Thread.currentThread().isInterrupted();
    }
}
