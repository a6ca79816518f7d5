package net.pivx.rpc.timer;

import net.i2p.I2PAppContext;
import net.i2p.util.SimpleTimer2;

/**
 * Timer driver on the context's SimpleTimer2 event scheduler.
 * The callbacks run on the scheduler threads and so should not block.
 */
public class SimpleTimer2RPCTimerInterface implements RPCTimerInterface {

    private final SimpleTimer2 _pool;

    public SimpleTimer2RPCTimerInterface(I2PAppContext context) {
        this(context.simpleTimer2());
    }

    public SimpleTimer2RPCTimerInterface(SimpleTimer2 pool) {
        _pool = pool;
    }

    public String getName() {
        return "SimpleTimer2";
    }

    public RPCTimerBase newTimer(Runnable func, long millis) {
        if (func == null)
            throw new IllegalArgumentException();
        RPCTimedEvent rv = new RPCTimedEvent(_pool, func);
        rv.schedule(millis);
        return rv;
    }

    /**
     *  TimedEvent.cancel() implements RPCTimerBase.cancel()
     */
    private static class RPCTimedEvent extends SimpleTimer2.TimedEvent implements RPCTimerBase {
        private final Runnable _func;

        public RPCTimedEvent(SimpleTimer2 pool, Runnable func) {
            super(pool);
            _func = func;
        }

        public void timeReached() {
            _func.run();
        }

        @Override
        public String toString() {
            return "RPC timer for " + _func;
        }
    }
}
