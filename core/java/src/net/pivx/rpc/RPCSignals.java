package net.pivx.rpc;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import net.i2p.I2PAppContext;
import net.i2p.util.Log;

/**
 * Observer lists for the server lifecycle and for each command.
 *
 * <p>Any number of subsystems may attach. Subscribers run synchronously
 * on the calling thread, in attachment order, so a slow subscriber
 * delays the command. A subscriber that throws is logged and skipped,
 * the remaining subscribers and the command itself still run.
 */
public class RPCSignals {

    /**
     * Called before the actor of a command runs.
     * Not called for calls refused by warmup, lookup or safe mode.
     */
    public interface PreCommandListener {
        public void preCommand(RPCCommand cmd);
    }

    /**
     * Called after the actor of a command returned or threw.
     */
    public interface PostCommandListener {
        /**
         *  @param success false if the actor threw
         */
        public void postCommand(RPCCommand cmd, boolean success);
    }

    private final Log _log;
    private final List<Runnable> _started;
    private final List<Runnable> _stopped;
    private final List<PreCommandListener> _preCommand;
    private final List<PostCommandListener> _postCommand;

    public RPCSignals(I2PAppContext context) {
        _log = context.logManager().getLog(RPCSignals.class);
        _started = new CopyOnWriteArrayList<Runnable>();
        _stopped = new CopyOnWriteArrayList<Runnable>();
        _preCommand = new CopyOnWriteArrayList<PreCommandListener>();
        _postCommand = new CopyOnWriteArrayList<PostCommandListener>();
    }

    public void onStarted(Runnable slot) {
        _started.add(nonNull(slot));
    }

    public boolean removeStarted(Runnable slot) {
        return _started.remove(slot);
    }

    public void onStopped(Runnable slot) {
        _stopped.add(nonNull(slot));
    }

    public boolean removeStopped(Runnable slot) {
        return _stopped.remove(slot);
    }

    public void onPreCommand(PreCommandListener slot) {
        _preCommand.add(nonNull(slot));
    }

    public boolean removePreCommand(PreCommandListener slot) {
        return _preCommand.remove(slot);
    }

    public void onPostCommand(PostCommandListener slot) {
        _postCommand.add(nonNull(slot));
    }

    public boolean removePostCommand(PostCommandListener slot) {
        return _postCommand.remove(slot);
    }

    void fireStarted() {
        fire(_started, "started");
    }

    void fireStopped() {
        fire(_stopped, "stopped");
    }

    void firePreCommand(RPCCommand cmd) {
        for (PreCommandListener l : _preCommand) {
            try {
                l.preCommand(cmd);
            } catch (RuntimeException re) {
                _log.error("Pre-command subscriber failed for " + cmd.getName() + ": " + l, re);
            }
        }
    }

    void firePostCommand(RPCCommand cmd, boolean success) {
        for (PostCommandListener l : _postCommand) {
            try {
                l.postCommand(cmd, success);
            } catch (RuntimeException re) {
                _log.error("Post-command subscriber failed for " + cmd.getName() + ": " + l, re);
            }
        }
    }

    private void fire(List<Runnable> slots, String event) {
        if (_log.shouldDebug())
            _log.debug("Firing " + event + " to " + slots.size() + " subscribers");
        for (Runnable r : slots) {
            try {
                r.run();
            } catch (RuntimeException re) {
                _log.error("RPC " + event + " subscriber failed: " + r, re);
            }
        }
    }

    private static <T> T nonNull(T slot) {
        if (slot == null)
            throw new IllegalArgumentException("null slot");
        return slot;
    }
}
