package net.pivx.rpc.commands;

import net.pivx.rpc.RPCActor;
import net.pivx.rpc.RPCCommand;
import net.pivx.rpc.RPCErrorCode;
import net.pivx.rpc.RPCException;
import net.pivx.rpc.RPCParams;
import net.pivx.rpc.RPCServer;
import net.pivx.rpc.RPCTable;

/**
 * The commands the server itself provides: help and stop.
 * Both are allowed in safe mode.
 */
public class ControlCommands {

    public static final String CATEGORY = "control";

    private ControlCommands() {}

    /**
     *  Add help and stop to the server's table. Call before startRPC().
     *
     *  @return false if either could not be registered
     */
    public static boolean register(RPCServer server) {
        RPCTable table = server.getTable();
        boolean ok = table.appendCommand(new RPCCommand(CATEGORY, "help", new Help(table), true));
        ok &= table.appendCommand(new RPCCommand(CATEGORY, "stop", new Stop(server), true));
        return ok;
    }

    static class Help implements RPCActor {
        static final String USAGE =
            "help ( \"command\" )\n" +
            "\nList all commands, or get help for a specified command.\n" +
            "\nArguments:\n" +
            "1. \"command\"     (string, optional) The command to get help on\n" +
            "\nResult:\n" +
            "\"text\"     (string) The help text\n";

        private final RPCTable _table;

        Help(RPCTable table) {
            _table = table;
        }

        public Object execute(RPCParams params, boolean help) throws RPCException {
            if (help)
                return USAGE;
            if (params.size() > 1 || params.isNamed())
                throw new RPCException(RPCErrorCode.RPC_MISC_ERROR, USAGE);
            String command = params.getOptString(0, "");
            return _table.help(command);
        }
    }

    static class Stop implements RPCActor {
        static final String USAGE =
            "stop\n" +
            "\nStop PIVX server.";

        private final RPCServer _server;

        Stop(RPCServer server) {
            _server = server;
        }

        public Object execute(RPCParams params, boolean help) throws RPCException {
            if (help)
                return USAGE;
            // one legacy 'detach' argument is accepted and ignored
            if (params.size() > 1)
                throw new RPCException(RPCErrorCode.RPC_MISC_ERROR, USAGE);
            // The reply still goes out, the node shuts down after the
            // current requests have been handled.
            if (!_server.requestShutdown())
                throw new RPCException(RPCErrorCode.RPC_INTERNAL_ERROR, "Shutdown is not available");
            return "PIVX server stopping";
        }
    }
}
