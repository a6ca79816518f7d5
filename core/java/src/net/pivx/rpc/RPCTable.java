package net.pivx.rpc;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import net.i2p.I2PAppContext;
import net.i2p.util.Log;

/**
 * The RPC command dispatcher.
 *
 * <p>Subsystems register their commands at startup with appendCommand().
 * When the server starts the table is frozen for good: from then on it
 * is read-only and safe to use from any number of request threads.
 *
 * <p>execute() checks, in order: warmup, method lookup, safe mode.
 * Only then are the pre-command hooks fired and the actor run.
 * A command refused by safe mode never reaches the hooks.
 * Post-command hooks fire whether the actor returned or threw.
 */
public class RPCTable {

    /** If true, commands not marked okSafeMode run even in safe mode */
    public static final String PROP_DISABLE_SAFE_MODE = "rpc.disablesafemode";

    private final I2PAppContext _context;
    private final Log _log;
    private final RPCWarmup _warmup;
    private final RPCSignals _signals;
    private final Map<String, RPCCommand> _commands;
    // registration order, for help; guarded by this
    private final List<RPCCommand> _order;
    // guarded by this
    private boolean _frozen;
    private volatile SafeModeMonitor _safeMode;

    /**
     *  @param warmup checked before every call
     *  @param signals pre/post command hooks
     */
    public RPCTable(I2PAppContext context, RPCWarmup warmup, RPCSignals signals) {
        _context = context;
        _log = context.logManager().getLog(RPCTable.class);
        _warmup = warmup;
        _signals = signals;
        _commands = new ConcurrentHashMap<String, RPCCommand>();
        _order = new ArrayList<RPCCommand>();
    }

    /**
     *  Appends a command to the dispatch table.
     *  Commands cannot be overwritten or removed.
     *
     *  @return false if the table is frozen (server started), the name
     *          is already taken, or an argument is null
     */
    public synchronized boolean appendCommand(String name, RPCCommand cmd) {
        if (name == null || cmd == null)
            return false;
        if (_frozen) {
            if (_log.shouldWarn())
                _log.warn("RPC server already started, cannot add command " + name);
            return false;
        }
        if (_commands.containsKey(name)) {
            if (_log.shouldWarn())
                _log.warn("Duplicate RPC command " + name);
            return false;
        }
        _commands.put(name, cmd);
        _order.add(cmd);
        return true;
    }

    /**
     *  Convenience, registers under cmd.getName()
     */
    public boolean appendCommand(RPCCommand cmd) {
        return cmd != null && appendCommand(cmd.getName(), cmd);
    }

    /**
     *  One-way. Called by the server when it starts.
     */
    synchronized void freeze() {
        _frozen = true;
    }

    public synchronized boolean isFrozen() {
        return _frozen;
    }

    /**
     *  @return the command or null
     */
    public RPCCommand get(String name) {
        if (name == null)
            return null;
        return _commands.get(name);
    }

    public int size() {
        return _commands.size();
    }

    /**
     *  @return names in registration order, a copy
     */
    public synchronized List<String> getCommandNames() {
        List<String> rv = new ArrayList<String>(_order.size());
        for (RPCCommand cmd : _order) {
            rv.add(cmd.getName());
        }
        return rv;
    }

    /**
     *  @param monitor may be null to never be in safe mode
     */
    public void setSafeModeMonitor(SafeModeMonitor monitor) {
        _safeMode = monitor;
    }

    /**
     * Execute a method.
     *
     * @param method method to execute
     * @param params may be null for none
     * @return result of the call, a JSON value
     * @throws RPCException RPC_IN_WARMUP, RPC_METHOD_NOT_FOUND, RPC_FORBIDDEN_BY_SAFE_MODE,
     *                      whatever the actor throws, or RPC_MISC_ERROR for
     *                      unchecked exceptions out of the actor
     */
    public Object execute(String method, RPCParams params) throws RPCException {
        RPCWarmup.State state = _warmup.getState();
        if (state.isInWarmup())
            throw new RPCException(RPCErrorCode.RPC_IN_WARMUP, state.getStatus());

        RPCCommand cmd = get(method);
        if (cmd == null)
            throw new RPCException(RPCErrorCode.RPC_METHOD_NOT_FOUND, "Method not found");

        String warning = getSafeModeWarning(cmd);
        if (warning != null) {
            if (_log.shouldWarn())
                _log.warn("Refusing " + method + " in safe mode: " + warning);
            throw new RPCException(RPCErrorCode.RPC_FORBIDDEN_BY_SAFE_MODE, "Safe mode: " + warning);
        }

        if (_log.shouldDebug())
            _log.debug("RPC method=" + method);
        if (params == null)
            params = RPCParams.EMPTY;

        _signals.firePreCommand(cmd);
        boolean success = false;
        try {
            Object rv = cmd.getActor().execute(params, false);
            success = true;
            return rv;
        } catch (RuntimeException re) {
            if (_log.shouldWarn())
                _log.warn("RPC method " + method + " failed", re);
            String msg = re.getMessage();
            throw new RPCException(RPCErrorCode.RPC_MISC_ERROR, msg != null ? msg : re.toString(), re);
        } finally {
            _signals.firePostCommand(cmd, success);
        }
    }

    /**
     *  @return the warning if cmd must be refused, else null
     */
    private String getSafeModeWarning(RPCCommand cmd) {
        if (cmd.isOkSafeMode())
            return null;
        if (_context.getBooleanProperty(PROP_DISABLE_SAFE_MODE))
            return null;
        SafeModeMonitor monitor = _safeMode;
        if (monitor == null)
            return null;
        String warning = monitor.getSafeModeWarning();
        if (warning == null || warning.length() <= 0)
            return null;
        return warning;
    }

    /**
     *  Help text.
     *
     *  With an empty name, the first line of the help of every command that
     *  isn't hidden, grouped by category, categories in the order they were
     *  first registered. An actor registered under several names is listed once.
     *
     *  With a name, the full help of that command.
     *
     *  @param name may be null or empty for all
     *  @return never null, no trailing newline
     */
    public String help(String name) {
        if (name == null)
            name = "";
        boolean all = name.length() <= 0;
        List<RPCCommand> commands;
        synchronized (this) {
            commands = new ArrayList<RPCCommand>(_order);
        }

        Map<String, List<RPCCommand>> byCategory = new LinkedHashMap<String, List<RPCCommand>>();
        for (RPCCommand cmd : commands) {
            if (all) {
                if (RPCCommand.CATEGORY_HIDDEN.equals(cmd.getCategory()))
                    continue;
            } else if (!cmd.getName().equals(name)) {
                continue;
            }
            List<RPCCommand> list = byCategory.get(cmd.getCategory());
            if (list == null) {
                list = new ArrayList<RPCCommand>();
                byCategory.put(cmd.getCategory(), list);
            }
            list.add(cmd);
        }

        StringBuilder buf = new StringBuilder(1024);
        Map<RPCActor, Boolean> done = new IdentityHashMap<RPCActor, Boolean>();
        for (Map.Entry<String, List<RPCCommand>> e : byCategory.entrySet()) {
            boolean header = false;
            for (RPCCommand cmd : e.getValue()) {
                if (done.put(cmd.getActor(), Boolean.TRUE) != null)
                    continue;
                String text = stripTrailingNewlines(getHelp(cmd));
                if (all) {
                    int nl = text.indexOf('\n');
                    if (nl >= 0)
                        text = text.substring(0, nl);
                    if (!header) {
                        if (buf.length() > 0)
                            buf.append('\n');
                        buf.append("== ").append(capitalize(e.getKey())).append(" ==\n");
                        header = true;
                    }
                }
                buf.append(text).append('\n');
            }
        }

        if (buf.length() <= 0)
            return "help: unknown command: " + name;
        buf.setLength(buf.length() - 1);
        return buf.toString();
    }

    /**
     *  Runs the actor in help mode. Actors may return the text or throw with it.
     */
    private String getHelp(RPCCommand cmd) {
        try {
            Object rv = cmd.getActor().execute(RPCParams.EMPTY, true);
            return rv != null ? rv.toString() : "";
        } catch (RPCException e) {
            return String.valueOf(e.getMessage());
        } catch (RuntimeException re) {
            if (_log.shouldDebug())
                _log.debug("Help for " + cmd.getName() + " thrown", re);
            return String.valueOf(re.getMessage());
        }
    }

    private static String stripTrailingNewlines(String text) {
        int len = text.length();
        while (len > 0 && text.charAt(len - 1) == '\n')
            len--;
        return text.substring(0, len);
    }

    private static String capitalize(String category) {
        if (category.length() <= 0)
            return category;
        return category.substring(0, 1).toUpperCase(Locale.US) + category.substring(1);
    }

    @Override
    public synchronized String toString() {
        return "RPCTable: " + _commands.size() + " commands" + (_frozen ? " (frozen)" : "") +
               ' ' + getCommandNames();
    }
}
