package net.pivx.rpc;

/**
 * The function behind one RPC command.
 *
 * <p>When help is true the actor must not do anything, only return
 * its usage text (a String, first line is the one-line summary).
 * This keeps the usage next to the code it documents.
 */
public interface RPCActor {

    /**
     *  @param params never null
     *  @param help if true, return the usage text instead of executing
     *  @return a JSON value: Map, List, String, Number, Boolean or null
     *  @throws RPCException on invalid params or a failure the client should see
     */
    public Object execute(RPCParams params, boolean help) throws RPCException;
}
