package net.pivx.rpc;

/**
 * Queue of long-running RPC operations executed by background workers.
 * Supplied by the node, the server only drives its lifecycle:
 * one worker is added when the server starts, and the queue is closed
 * when it stops.
 */
public interface AsyncRPCQueue {

    public void addWorker();

    public int getNumberOfWorkers();

    /**
     *  Cancel pending operations, let the running ones finish,
     *  and wait for the workers to exit.
     */
    public void closeAndWait();

    public boolean isClosed();
}
