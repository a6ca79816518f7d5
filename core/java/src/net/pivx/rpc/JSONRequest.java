package net.pivx.rpc;

import java.util.List;
import java.util.Map;

/**
 * One parsed JSON-RPC call: id, method and params.
 *
 * <p>The id is opaque and echoed back unchanged, it may be null.
 * The method name is case sensitive and never empty.
 * All shape checking happens in {@link #parse(Object)},
 * a JSONRequest that exists is always dispatchable.
 */
public class JSONRequest {

    private final Object _id;
    private final String _method;
    private final RPCParams _params;

    /**
     *  @param id may be null
     *  @param method non-null, non-empty
     *  @param params non-null, use RPCParams.EMPTY for none
     *  @throws IllegalArgumentException on empty method or null params
     */
    public JSONRequest(Object id, String method, RPCParams params) {
        if (method == null || method.length() <= 0)
            throw new IllegalArgumentException("The method name must not be empty");
        if (params == null)
            throw new IllegalArgumentException("The params must not be null");
        _id = id;
        _method = method;
        _params = params;
    }

    /**
     *  Parse a deserialized JSON value.
     *
     *  @param request the output of Jsoner.deserialize(), should be a Map
     *  @throws RPCException RPC_INVALID_REQUEST if the shape is wrong
     */
    @SuppressWarnings("unchecked")
    public static JSONRequest parse(Object request) throws RPCException {
        if (!(request instanceof Map))
            throw new RPCException(RPCErrorCode.RPC_INVALID_REQUEST, "Invalid Request object");
        Map<String, Object> req = (Map<String, Object>) request;

        Object id = req.get("id");

        Object method = req.get("method");
        if (method == null)
            throw new InvalidRequestException("Missing method", id);
        if (!(method instanceof String))
            throw new InvalidRequestException("Method must be a string", id);
        String strMethod = (String) method;
        if (strMethod.length() <= 0)
            throw new InvalidRequestException("Missing method", id);

        Object params = req.get("params");
        RPCParams rpcParams;
        if (params == null)
            rpcParams = RPCParams.EMPTY;
        else if (params instanceof List)
            rpcParams = RPCParams.positional((List<?>) params);
        else if (params instanceof Map)
            rpcParams = RPCParams.named((Map<String, ?>) params);
        else
            throw new InvalidRequestException("Params must be an array or object", id);

        return new JSONRequest(id, strMethod, rpcParams);
    }

    /** @return may be null */
    public Object getID() {
        return _id;
    }

    public String getMethod() {
        return _method;
    }

    public RPCParams getParams() {
        return _params;
    }

    @Override
    public String toString() {
        return "JSONRequest id=" + _id + " method=" + _method + " params=" + _params;
    }

    /**
     * A malformed request that still had a usable id,
     * so the error reply can be correlated by the client.
     */
    public static class InvalidRequestException extends RPCException {

        private static final long serialVersionUID = -2907710393150652718L;

        private final transient Object _id;

        public InvalidRequestException(String message, Object id) {
            super(RPCErrorCode.RPC_INVALID_REQUEST, message);
            _id = id;
        }

        /** @return may be null */
        public Object getID() {
            return _id;
        }
    }
}
