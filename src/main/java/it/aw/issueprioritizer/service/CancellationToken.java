package it.aw.issueprioritizer.service;

/**
 * Segnale di cancellazione best-effort, controllato tra un dispatch di scoring e il successivo.
 */
public class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("token non cancellabile");
        }
    };

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new RunCancelledException("run cancellato");
        }
    }
}
