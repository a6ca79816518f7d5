package net.pivx.rpc;

import org.json.simple.JsonObject;

/**
 * A JSON-RPC error raised while parsing or executing a request.
 *
 * <p>The error object sent back to the client looks like this:
 *
 * <pre>
 * { "code" : -28, "message" : "Loading block index..." }
 * </pre>
 *
 * <p>Like the "Error" in JSON-RPC parlance this is a regular checked
 * exception, it is caught at the dispatch boundary and turned into a
 * response, never allowed to take down the server.
 *
 * @see RPCErrorCode
 */
public class RPCException extends Exception {

    private static final long serialVersionUID = 3614278120375829145L;

    private final int _code;

    /**
     *  @param code one of the RPCErrorCode constants, or a handler specific code
     *  @param message non-null
     */
    public RPCException(int code, String message) {
        super(message);
        _code = code;
    }

    /**
     *  @param cause kept for logging only, not sent to the client
     */
    public RPCException(int code, String message, Throwable cause) {
        super(message, cause);
        _code = code;
    }

    public int getCode() {
        return _code;
    }

    /**
     *  The error object of a reply.
     */
    public JsonObject toJSONObject() {
        JsonObject rv = new JsonObject();
        rv.put("code", Integer.valueOf(_code));
        rv.put("message", getMessage());
        return rv;
    }

    @Override
    public String toString() {
        return RPCErrorCode.toString(_code) + " (" + _code + "): " + getMessage();
    }
}
