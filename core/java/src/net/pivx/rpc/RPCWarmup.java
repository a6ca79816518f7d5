package net.pivx.rpc;

import net.i2p.I2PAppContext;
import net.i2p.util.Log;

/**
 * Startup gate. While warming up, every call fails with RPC_IN_WARMUP
 * and the current status message.
 *
 * The startup sequence calls setStatus() as it progresses
 * ("Loading block index...", "Verifying wallet..."), then setFinished() once.
 * The gate never reopens.
 */
public class RPCWarmup {

    public static final String INITIAL_STATUS = "RPC server started";

    private final Log _log;
    // Read lock-free, written under the monitor
    private volatile State _state;

    public RPCWarmup(I2PAppContext context) {
        _log = context.logManager().getLog(RPCWarmup.class);
        _state = new State(true, INITIAL_STATUS);
    }

    /**
     *  Update the status message. Ignored once warmup is finished.
     *
     *  @param status non-null
     */
    public synchronized void setStatus(String status) {
        if (status == null)
            throw new IllegalArgumentException();
        if (!_state.isInWarmup()) {
            if (_log.shouldWarn())
                _log.warn("Warmup already finished, ignoring status: " + status);
            return;
        }
        _state = new State(true, status);
        if (_log.shouldInfo())
            _log.info("RPC warmup: " + status);
    }

    /**
     *  One-way transition to ready. Calling it again does nothing.
     */
    public synchronized void setFinished() {
        if (!_state.isInWarmup()) {
            if (_log.shouldWarn())
                _log.warn("Warmup finished twice", new Exception("I did it"));
            return;
        }
        _state = new State(false, _state.getStatus());
        if (_log.shouldInfo())
            _log.info("RPC warmup finished");
    }

    /**
     *  @return a consistent snapshot, never null
     */
    public State getState() {
        return _state;
    }

    public boolean isInWarmup() {
        return _state.isInWarmup();
    }

    /**
     * Immutable (inWarmup, status) pair.
     */
    public static class State {
        private final boolean _inWarmup;
        private final String _status;

        State(boolean inWarmup, String status) {
            _inWarmup = inWarmup;
            _status = status;
        }

        public boolean isInWarmup() {
            return _inWarmup;
        }

        /** the last status set, kept after warmup finishes */
        public String getStatus() {
            return _status;
        }

        @Override
        public String toString() {
            return _inWarmup ? "warming up: " + _status : "ready";
        }
    }
}
