package net.pivx.rpc;

import org.json.simple.JsonArray;
import org.json.simple.JsonObject;
import org.json.simple.Jsoner;

/**
 * Builders for the JSON-RPC 1.0 style messages the node speaks.
 *
 * <p>A reply always carries all three members, exactly one of
 * result and error is non-null:
 *
 * <pre>
 * { "result" : 42, "error" : null, "id" : 1 }
 * { "result" : null, "error" : { "code" : -32601, "message" : "Method not found" }, "id" : 1 }
 * </pre>
 */
public final class JSONRPCReply {

    private JSONRPCReply() {}

    /**
     *  @param result may be null, ignored if error is non-null
     *  @param error may be null
     *  @param id may be null
     */
    public static JsonObject replyObj(Object result, JsonObject error, Object id) {
        JsonObject reply = new JsonObject();
        if (error != null)
            reply.put("result", null);
        else
            reply.put("result", result);
        reply.put("error", error);
        reply.put("id", id);
        return reply;
    }

    /**
     *  Serialized reply followed by a newline.
     */
    public static String reply(Object result, JsonObject error, Object id) {
        return Jsoner.serialize(replyObj(result, error, id)) + "\n";
    }

    public static JsonObject error(int code, String message) {
        return new RPCException(code, message).toJSONObject();
    }

    /**
     *  Serialized request, for clients and tests.
     *
     *  @param params positional params, may be null for none
     *  @param id may be null
     */
    public static String request(String method, JsonArray params, Object id) {
        JsonObject request = new JsonObject();
        request.put("method", method);
        request.put("params", params != null ? params : new JsonArray());
        request.put("id", id);
        return Jsoner.serialize(request) + "\n";
    }
}
