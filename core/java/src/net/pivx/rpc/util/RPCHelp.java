package net.pivx.rpc.util;

import net.i2p.I2PAppContext;

import net.pivx.rpc.RPCErrorCode;
import net.pivx.rpc.RPCException;

/**
 * Builders for the example sections of command help text.
 */
public final class RPCHelp {

    public static final String PROP_CLI = "rpc.help.cli";
    public static final String DEFAULT_CLI = "pivx-cli";
    public static final String PROP_PORT = "rpc.help.port";
    public static final int DEFAULT_PORT = 51473;

    private RPCHelp() {}

    /**
     *  @param args the arguments as typed on the command line, may be empty
     *  @return e.g. "&gt; pivx-cli getblock "hash"\n"
     */
    public static String exampleCli(I2PAppContext ctx, String methodname, String args) {
        String cli = ctx.getProperty(PROP_CLI, DEFAULT_CLI);
        StringBuilder buf = new StringBuilder(64);
        buf.append("> ").append(cli).append(' ').append(methodname);
        if (args != null && args.length() > 0)
            buf.append(' ').append(args);
        buf.append('\n');
        return buf.toString();
    }

    /**
     *  @param args the JSON params array contents, may be empty
     *  @return a curl command line posting the request
     */
    public static String exampleRpc(I2PAppContext ctx, String methodname, String args) {
        int port = ctx.getProperty(PROP_PORT, DEFAULT_PORT);
        return "> curl --user myusername --data-binary '{\"jsonrpc\": \"1.0\", \"id\":\"curltest\", " +
               "\"method\": \"" + methodname + "\", \"params\": [" + (args != null ? args : "") +
               "] }' -H 'content-type: text/plain;' http://127.0.0.1:" + port + "/\n";
    }

    /**
     *  The error a command throws when it is behind an experimental switch that is off.
     *
     *  @param rpc the command name
     *  @param enableArg the option that turns it on, without the leading dash
     */
    public static RPCException experimentalDisabled(String rpc, String enableArg) {
        return new RPCException(RPCErrorCode.RPC_MISC_ERROR,
                                "Error: " + rpc + " is experimental and is disabled by default. " +
                                "Restart pivxd with -" + enableArg + " or add " + enableArg +
                                "=1 to pivx.conf to enable it.");
    }
}
