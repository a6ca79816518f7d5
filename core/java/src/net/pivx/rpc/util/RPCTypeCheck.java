package net.pivx.rpc.util;

import java.util.List;
import java.util.Map;

import net.pivx.rpc.JSONType;
import net.pivx.rpc.RPCErrorCode;
import net.pivx.rpc.RPCException;
import net.pivx.rpc.RPCParams;

/**
 * Parameter type checks for command handlers.
 * All failures are RPC_TYPE_ERROR.
 */
public final class RPCTypeCheck {

    private RPCTypeCheck() {}

    /**
     *  Type-check positional arguments.
     *  Does not check that the right number of arguments are passed,
     *  just that any passed are the correct type.
     *
     *  <pre>
     *  RPCTypeCheck.check(params, Arrays.asList(JSONType.STRING, JSONType.NUMBER), false);
     *  </pre>
     *
     *  @param allowNull a JSON null matches any type
     */
    public static void check(RPCParams params, List<JSONType> typesExpected, boolean allowNull) throws RPCException {
        List<Object> values = params.getPositionalParams();
        int i = 0;
        for (JSONType t : typesExpected) {
            if (values.size() <= i)
                break;
            Object v = values.get(i);
            if (!matches(v, t, allowNull))
                throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR,
                                       "Expected type " + t.getName() + ", got " + JSONType.nameOf(v));
            i++;
        }
    }

    /**
     *  Check for expected keys/value types in an object.
     *
     *  <pre>
     *  Map&lt;String, JSONType&gt; expected = new LinkedHashMap&lt;String, JSONType&gt;();
     *  expected.put("txid", JSONType.STRING);
     *  expected.put("vout", JSONType.NUMBER);
     *  RPCTypeCheck.checkObj(o, expected, false);
     *  </pre>
     *
     *  @param allowNull if true, missing or null keys are accepted
     */
    public static void checkObj(Map<String, ?> o, Map<String, JSONType> typesExpected, boolean allowNull) throws RPCException {
        for (Map.Entry<String, JSONType> e : typesExpected.entrySet()) {
            Object v = o.get(e.getKey());
            if (!allowNull && v == null)
                throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR, "Missing " + e.getKey());
            if (!matches(v, e.getValue(), allowNull))
                throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR,
                                       "Expected type " + e.getValue().getName() + " for " + e.getKey() +
                                       ", got " + JSONType.nameOf(v));
        }
    }

    private static boolean matches(Object v, JSONType t, boolean allowNull) {
        if (v == null)
            return allowNull || t == JSONType.NULL;
        try {
            return JSONType.of(v) == t;
        } catch (IllegalArgumentException iae) {
            return false;
        }
    }
}
