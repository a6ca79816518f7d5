package net.pivx.rpc.timer;

import java.util.HashMap;
import java.util.Map;

import net.i2p.I2PAppContext;
import net.i2p.util.Log;

import net.pivx.rpc.RPCErrorCode;
import net.pivx.rpc.RPCException;

/**
 * Named deferred callbacks on top of the one registered timer driver.
 *
 * <p>runLater() replaces any callback pending under the same name, so at most
 * one callback per name is ever pending. The old handle is cancelled before the
 * new one is created, both under the same lock.
 */
public class RPCTimers {

    /** largest delay that still fits in milliseconds */
    public static final long MAX_SECONDS = Long.MAX_VALUE / 1000;

    private final Log _log;
    // all guarded by this
    private RPCTimerInterface _timerInterface;
    private final Map<String, RPCTimerBase> _deadlineTimers;

    public RPCTimers(I2PAppContext context) {
        _log = context.logManager().getLog(RPCTimers.class);
        _deadlineTimers = new HashMap<String, RPCTimerBase>();
    }

    /**
     *  Set the driver. Only one may be registered at a time.
     *  Registering the current one again does nothing.
     *
     *  @throws IllegalStateException if a different driver is already registered
     */
    public synchronized void registerTimerInterface(RPCTimerInterface iface) {
        if (iface == null)
            throw new IllegalArgumentException();
        if (_timerInterface == iface)
            return;
        if (_timerInterface != null) {
            String msg = "Timer interface " + _timerInterface.getName() +
                         " already registered, unregister it before registering " + iface.getName();
            _log.error(msg);
            throw new IllegalStateException(msg);
        }
        _timerInterface = iface;
        if (_log.shouldInfo())
            _log.info("Registered RPC timer interface " + iface.getName());
    }

    /**
     *  Remove the driver, if it is the registered one.
     *  Callbacks already scheduled through it are not cancelled.
     *
     *  @return true if it was removed
     */
    public synchronized boolean unregisterTimerInterface(RPCTimerInterface iface) {
        if (iface == null || _timerInterface != iface)
            return false;
        _timerInterface = null;
        if (_log.shouldInfo())
            _log.info("Unregistered RPC timer interface " + iface.getName());
        return true;
    }

    /**
     *  @return the driver or null
     */
    public synchronized RPCTimerInterface getTimerInterface() {
        return _timerInterface;
    }

    /**
     *  Run func seconds from now.
     *  Overrides the previous timer with this name, if any.
     *
     *  @param seconds 0 to MAX_SECONDS
     *  @throws RPCException RPC_INTERNAL_ERROR if no driver is registered
     */
    public synchronized void runLater(String name, Runnable func, long seconds) throws RPCException {
        if (name == null || func == null || seconds < 0 || seconds > MAX_SECONDS)
            throw new IllegalArgumentException("runLater " + name + ' ' + seconds);
        if (_timerInterface == null)
            throw new RPCException(RPCErrorCode.RPC_INTERNAL_ERROR, "No timer handler registered for RPC");
        RPCTimerBase old = _deadlineTimers.remove(name);
        if (old != null)
            old.cancel();
        if (_log.shouldDebug())
            _log.debug("queue timer " + name + " in " + seconds + " seconds (using " +
                       _timerInterface.getName() + ')');
        _deadlineTimers.put(name, _timerInterface.newTimer(func, seconds * 1000));
    }

    /**
     *  @return true if a pending timer of that name was cancelled
     */
    public synchronized boolean cancel(String name) {
        RPCTimerBase old = _deadlineTimers.remove(name);
        return old != null && old.cancel();
    }

    /**
     *  Whether a handle exists for that name. It may already have fired.
     */
    public synchronized boolean hasTimer(String name) {
        return _deadlineTimers.containsKey(name);
    }

    public synchronized int size() {
        return _deadlineTimers.size();
    }

    /**
     *  Cancel and forget all named timers.
     */
    public synchronized void clear() {
        for (RPCTimerBase timer : _deadlineTimers.values()) {
            timer.cancel();
        }
        _deadlineTimers.clear();
    }
}
