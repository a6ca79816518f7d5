package net.pivx.rpc.timer;

/**
 * Opaque handle for one pending callback, returned by
 * {@link RPCTimerInterface#newTimer(Runnable, long)}.
 * Cancelling it is the only way to stop the callback.
 */
public interface RPCTimerBase {

    /**
     *  Cancel the callback if it hasn't run yet. Idempotent.
     *
     *  @return true if it was pending and is now cancelled
     */
    public boolean cancel();
}
