package net.pivx.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.json.simple.DeserializationException;
import org.json.simple.JsonArray;
import org.json.simple.JsonObject;
import org.json.simple.Jsoner;

import net.i2p.I2PAppContext;
import net.i2p.util.Log;

/**
 * Runs single and batch JSON-RPC requests through the dispatch table
 * and builds the replies.
 *
 * <p>Every request gets exactly one reply, in request order. A failure
 * in one element of a batch is turned into that element's error reply
 * and never affects the others. Nothing is thrown to the caller.
 */
public class JSONRPCExecutor {

    private final RPCTable _table;
    private final Log _log;

    public JSONRPCExecutor(I2PAppContext context, RPCTable table) {
        _table = table;
        _log = context.logManager().getLog(JSONRPCExecutor.class);
    }

    /**
     *  Parse and execute one deserialized request.
     *
     *  @param request a Map from the deserializer, anything else gets an error reply
     *  @return the reply object, never null
     */
    public JsonObject execOne(Object request) {
        Object id = null;
        try {
            JSONRequest jreq = JSONRequest.parse(request);
            id = jreq.getID();
            return execute(jreq);
        } catch (JSONRequest.InvalidRequestException ire) {
            return JSONRPCReply.replyObj(null, ire.toJSONObject(), ire.getID());
        } catch (RPCException re) {
            return JSONRPCReply.replyObj(null, re.toJSONObject(), id);
        }
    }

    /**
     *  Execute one parsed request.
     *
     *  @return the reply object, never null
     */
    public JsonObject execute(JSONRequest request) {
        Object id = request.getID();
        try {
            Object result = _table.execute(request.getMethod(), request.getParams());
            checkSerializable(request.getMethod(), result);
            return JSONRPCReply.replyObj(result, null, id);
        } catch (RPCException re) {
            if (_log.shouldDebug())
                _log.debug("Error reply for " + request + ": " + re);
            return JSONRPCReply.replyObj(null, re.toJSONObject(), id);
        } catch (RuntimeException e) {
            _log.error("Unexpected error executing " + request, e);
            return JSONRPCReply.replyObj(null, JSONRPCReply.error(RPCErrorCode.RPC_PARSE_ERROR, String.valueOf(e.getMessage())), id);
        }
    }

    /**
     *  @param requests deserialized requests, each should be a Map
     *  @return one reply per request, same order
     */
    public JsonArray executeBatch(List<?> requests) {
        JsonArray rv = new JsonArray();
        for (Object req : requests) {
            rv.add(execOne(req));
        }
        return rv;
    }

    /**
     *  @return one reply per request, same order
     */
    public List<JsonObject> executeRequests(List<JSONRequest> requests) {
        List<JsonObject> rv = new ArrayList<JsonObject>(requests.size());
        for (JSONRequest req : requests) {
            rv.add(execute(req));
        }
        return rv;
    }

    /**
     *  @return serialized array of replies, followed by a newline
     */
    public String execBatch(List<?> requests) {
        return Jsoner.serialize(executeBatch(requests)) + "\n";
    }

    /**
     *  Handle a complete request body, a single request or a batch.
     *
     *  @param body may be null
     *  @return serialized reply or array of replies, followed by a newline
     */
    public String process(String body) {
        if (body == null)
            return JSONRPCReply.reply(null, JSONRPCReply.error(RPCErrorCode.RPC_PARSE_ERROR, "Parse error"), null);
        Object val;
        try {
            val = Jsoner.deserialize(body);
        } catch (DeserializationException de) {
            if (_log.shouldInfo())
                _log.info("Unable to parse request: " + de.getMessage());
            return JSONRPCReply.reply(null, JSONRPCReply.error(RPCErrorCode.RPC_PARSE_ERROR, "Parse error"), null);
        }
        if (val instanceof Map)
            return Jsoner.serialize(execOne(val)) + "\n";
        if (val instanceof List)
            return execBatch((List<?>) val);
        return JSONRPCReply.reply(null, JSONRPCReply.error(RPCErrorCode.RPC_PARSE_ERROR, "Top-level object parse error"), null);
    }

    /**
     *  A result that can't be serialized must fail its own reply,
     *  not the whole batch later on.
     */
    private static void checkSerializable(String method, Object result) throws RPCException {
        try {
            Jsoner.serialize(result);
        } catch (RuntimeException re) {
            throw new RPCException(RPCErrorCode.RPC_INTERNAL_ERROR, "Unable to serialize result of " + method, re);
        }
    }
}
