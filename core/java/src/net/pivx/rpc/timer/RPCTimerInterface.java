package net.pivx.rpc.timer;

/**
 * RPC timer "driver".
 *
 * As the RPC mechanism is backend-neutral, it can use different implementations
 * of timers: the event loop of the HTTP server, a GUI console's timer, or
 * a plain scheduler. The dispatcher only ever sees this interface.
 */
public interface RPCTimerInterface {

    /** Implementation name, for logging */
    public String getName();

    /**
     *  Factory for timers.
     *  RPC will call this to create a timer that will call func in millis milliseconds.
     *
     *  @param func run once, on a thread of the driver's choosing
     *  @param millis delay, 0 or more
     *  @return handle that cancels the callback
     */
    public RPCTimerBase newTimer(Runnable func, long millis);
}
