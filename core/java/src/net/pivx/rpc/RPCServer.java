package net.pivx.rpc;

import net.i2p.I2PAppContext;
import net.i2p.app.ClientApp;
import net.i2p.app.ClientAppManager;
import net.i2p.app.ClientAppState;
import static net.i2p.app.ClientAppState.*;
import net.i2p.util.Log;

import net.pivx.rpc.timer.RPCTimerInterface;
import net.pivx.rpc.timer.RPCTimers;
import net.pivx.rpc.timer.SimpleTimer2RPCTimerInterface;

/**
 * The RPC server state: dispatch table, warmup gate, named timers,
 * lifecycle signals, and the running flag.
 *
 * <p>There are no globals, the node creates one of these at startup and
 * passes it to everything that registers commands or handles requests.
 *
 * <p>Lifecycle: INITIALIZED (commands may be registered) -&gt; RUNNING
 * (table frozen) -&gt; STOPPING (interrupted, handlers should wind down)
 * -&gt; STOPPED. Never restarted. If the async worker can't be started the
 * server ends in START_FAILED instead of RUNNING.
 */
public class RPCServer implements ClientApp {

    /**
     *  If true (default), start() registers a SimpleTimer2 timer driver
     *  unless the embedding application already registered one.
     */
    public static final String PROP_DEFAULT_TIMER = "rpc.timer.default";

    private final I2PAppContext _context;
    // may be null
    private final ClientAppManager _mgr;
    private final Log _log;
    private final RPCWarmup _warmup;
    private final RPCSignals _signals;
    private final RPCTable _table;
    private final RPCTimers _timers;
    // guarded by this
    private ClientAppState _state = UNINITIALIZED;
    // the driver we registered ourselves, guarded by this
    private RPCTimerInterface _defaultTimer;
    // guarded by this
    private boolean _stopInProgress;
    private volatile AsyncRPCQueue _asyncQueue;
    private volatile Runnable _shutdownRequest;

    public RPCServer(I2PAppContext context) {
        this(context, null);
    }

    /**
     *  @param mgr may be null, notified of state changes
     */
    public RPCServer(I2PAppContext context, ClientAppManager mgr) {
        _context = context;
        _mgr = mgr;
        _log = context.logManager().getLog(RPCServer.class);
        _warmup = new RPCWarmup(context);
        _signals = new RPCSignals(context);
        _table = new RPCTable(context, _warmup, _signals);
        _timers = new RPCTimers(context);
        _state = INITIALIZED;
    }

    public I2PAppContext getContext() {
        return _context;
    }

    public RPCTable getTable() {
        return _table;
    }

    public RPCWarmup getWarmup() {
        return _warmup;
    }

    public RPCSignals getSignals() {
        return _signals;
    }

    public RPCTimers getTimers() {
        return _timers;
    }

    /**
     *  @param monitor may be null to never be in safe mode
     */
    public void setSafeModeMonitor(SafeModeMonitor monitor) {
        _table.setSafeModeMonitor(monitor);
    }

    /**
     *  Set before startRPC() to have a worker added on start.
     *  @param queue may be null
     */
    public void setAsyncRPCQueue(AsyncRPCQueue queue) {
        _asyncQueue = queue;
    }

    /**
     *  @return may be null
     */
    public AsyncRPCQueue getAsyncRPCQueue() {
        return _asyncQueue;
    }

    /**
     *  What the "stop" command runs to shut the node down.
     *  @param request may be null
     */
    public void setShutdownRequest(Runnable request) {
        _shutdownRequest = request;
    }

    /**
     *  Ask the node to shut down. Returns immediately.
     *
     *  @return false if the node did not set a shutdown request
     */
    public boolean requestShutdown() {
        Runnable r = _shutdownRequest;
        if (r == null) {
            _log.warn("Shutdown requested over RPC but no shutdown handler set");
            return false;
        }
        if (_log.shouldInfo())
            _log.info("Shutdown requested over RPC");
        r.run();
        return true;
    }

    /**
     *  Freeze the table, set up the timer driver and the async worker,
     *  and fire the started signal.
     *
     *  @return false if already started once, or the async worker failed to start
     */
    public boolean startRPC() {
        synchronized (this) {
            if (_state != INITIALIZED) {
                if (_log.shouldWarn())
                    _log.warn("Cannot start RPC server in state " + _state);
                return false;
            }
            changeState(STARTING);
            if (_log.shouldInfo())
                _log.info("Starting RPC server with " + _table.size() + " commands");
            _table.freeze();
            if (_context.getProperty(PROP_DEFAULT_TIMER, true) && _timers.getTimerInterface() == null) {
                _defaultTimer = new SimpleTimer2RPCTimerInterface(_context);
                _timers.registerTimerInterface(_defaultTimer);
            }
            AsyncRPCQueue queue = _asyncQueue;
            if (queue != null) {
                try {
                    queue.addWorker();
                } catch (RuntimeException re) {
                    _log.error("Unable to start async RPC worker", re);
                    if (_defaultTimer != null) {
                        _timers.unregisterTimerInterface(_defaultTimer);
                        _defaultTimer = null;
                    }
                    changeState(START_FAILED, "Failed to start", re);
                    return false;
                }
            }
            changeState(RUNNING);
        }
        _signals.fireStarted();
        return true;
    }

    /**
     *  Clear the running flag. Requests in progress continue,
     *  handlers may check isRPCRunning() to bail out early.
     */
    public synchronized void interruptRPC() {
        if (_state != RUNNING)
            return;
        if (_log.shouldInfo())
            _log.info("Interrupting RPC server");
        changeState(STOPPING);
    }

    /**
     *  Cancel all named timers, close the async queue,
     *  and fire the stopped signal. Only the first call does anything,
     *  and nothing happens if the server was never started.
     */
    public void stopRPC() {
        synchronized (this) {
            if (_stopInProgress || (_state != RUNNING && _state != STOPPING))
                return;
            _stopInProgress = true;
            if (_state == RUNNING)
                changeState(STOPPING);
            if (_log.shouldInfo())
                _log.info("Stopping RPC server");
            _timers.clear();
            if (_defaultTimer != null) {
                _timers.unregisterTimerInterface(_defaultTimer);
                _defaultTimer = null;
            }
        }
        AsyncRPCQueue queue = _asyncQueue;
        if (queue != null) {
            if (_log.shouldInfo())
                _log.info("Waiting for async RPC workers to stop");
            queue.closeAndWait();
        }
        synchronized (this) {
            changeState(STOPPED);
        }
        _signals.fireStopped();
    }

    /**
     *  @return true between startRPC() and interruptRPC() or stopRPC()
     */
    public synchronized boolean isRPCRunning() {
        return _state == RUNNING;
    }

    /////// ClientApp methods

    /**
     *  Same as startRPC()
     *  @throws IllegalStateException if already started or the start failed
     */
    public void startup() {
        if (!startRPC())
            throw new IllegalStateException("RPC server not started, state " + getState());
    }

    /**
     *  interruptRPC() then stopRPC()
     *  @param args ignored
     */
    public void shutdown(String[] args) {
        interruptRPC();
        stopRPC();
    }

    public synchronized ClientAppState getState() {
        return _state;
    }

    public String getName() {
        return "RPC";
    }

    public String getDisplayName() {
        return "RPC Server";
    }

    /////// end ClientApp methods

    private void changeState(ClientAppState state) {
        changeState(state, null, null);
    }

    private synchronized void changeState(ClientAppState state, String msg, Exception e) {
        _state = state;
        if (_mgr != null)
            _mgr.notify(this, state, msg, e);
    }

    @Override
    public String toString() {
        return "RPCServer " + getState() + ' ' + _warmup.getState();
    }
}
