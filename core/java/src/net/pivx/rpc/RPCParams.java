package net.pivx.rpc;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parameters of one call, either absent, positional (a JSON array)
 * or named (a JSON object). Immutable.
 *
 * The typed getters throw RPCException with RPC_INVALID_PARAMETER for
 * a missing value and RPC_TYPE_ERROR for a value of the wrong JSON type,
 * so handlers can simply let them propagate.
 */
public class RPCParams {

    public enum Type {
        /** no params member, or null */
        NO_PARAMS,
        /** positional, packed as a JSON array */
        ARRAY,
        /** named, packed as a JSON object */
        OBJECT
    }

    public static final RPCParams EMPTY = new RPCParams(Type.NO_PARAMS,
                                                        Collections.<Object>emptyList(),
                                                        Collections.<String, Object>emptyMap());

    private final Type _type;
    private final List<Object> _positional;
    private final Map<String, Object> _named;

    private RPCParams(Type type, List<Object> positional, Map<String, Object> named) {
        _type = type;
        _positional = positional;
        _named = named;
    }

    /**
     *  Positional params from values, null elements allowed.
     */
    public static RPCParams of(Object... values) {
        if (values == null || values.length == 0)
            return positional(Collections.emptyList());
        return positional(Arrays.asList(values));
    }

    /**
     *  @param values non-null, copied
     */
    public static RPCParams positional(List<?> values) {
        return new RPCParams(Type.ARRAY,
                             Collections.unmodifiableList(new ArrayList<Object>(values)),
                             Collections.<String, Object>emptyMap());
    }

    /**
     *  @param values non-null, copied, iteration order kept
     */
    public static RPCParams named(Map<String, ?> values) {
        return new RPCParams(Type.OBJECT,
                             Collections.<Object>emptyList(),
                             Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values)));
    }

    public Type getType() {
        return _type;
    }

    public boolean isNamed() {
        return _type == Type.OBJECT;
    }

    /**
     *  Number of positional or named params.
     */
    public int size() {
        return _type == Type.OBJECT ? _named.size() : _positional.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     *  @return unmodifiable, empty unless ARRAY
     */
    public List<Object> getPositionalParams() {
        return _positional;
    }

    /**
     *  @return unmodifiable, empty unless OBJECT
     */
    public Map<String, Object> getNamedParams() {
        return _named;
    }

    public boolean hasParam(int position) {
        return position >= 0 && position < _positional.size();
    }

    public boolean hasParam(String name) {
        return _named.containsKey(name);
    }

    /**
     *  @return the value, may be null if the client sent null
     *  @throws RPCException if there is no such position
     */
    public Object get(int position) throws RPCException {
        if (!hasParam(position))
            throw new RPCException(RPCErrorCode.RPC_INVALID_PARAMETER,
                                   "Missing parameter " + (position + 1));
        return _positional.get(position);
    }

    /**
     *  @return the value, may be null if the client sent null
     *  @throws RPCException if there is no such name
     */
    public Object get(String name) throws RPCException {
        if (!hasParam(name))
            throw new RPCException(RPCErrorCode.RPC_INVALID_PARAMETER, "Missing parameter " + name);
        return _named.get(name);
    }

    public String getString(int position) throws RPCException {
        Object o = get(position);
        if (!(o instanceof String))
            throw typeError("string", o);
        return (String) o;
    }

    public String getOptString(int position, String defaultValue) throws RPCException {
        if (!hasParam(position) || _positional.get(position) == null)
            return defaultValue;
        return getString(position);
    }

    /**
     *  @throws RPCException if not an integral number that fits in a long
     */
    public long getLong(int position) throws RPCException {
        Object o = get(position);
        if (!(o instanceof Number))
            throw typeError("number", o);
        if (o instanceof BigDecimal) {
            try {
                return ((BigDecimal) o).longValueExact();
            } catch (ArithmeticException ae) {
                throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR, "Expected integer, got " + o);
            }
        }
        if (o instanceof Double || o instanceof Float)
            throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR, "Expected integer, got " + o);
        return ((Number) o).longValue();
    }

    public boolean getBoolean(int position) throws RPCException {
        Object o = get(position);
        if (!(o instanceof Boolean))
            throw typeError("bool", o);
        return ((Boolean) o).booleanValue();
    }

    public boolean getOptBoolean(int position, boolean defaultValue) throws RPCException {
        if (!hasParam(position) || _positional.get(position) == null)
            return defaultValue;
        return getBoolean(position);
    }

    private static RPCException typeError(String expected, Object got) {
        return new RPCException(RPCErrorCode.RPC_TYPE_ERROR,
                                "Expected type " + expected + ", got " + JSONType.nameOf(got));
    }

    @Override
    public String toString() {
        switch (_type) {
            case ARRAY:  return _positional.toString();
            case OBJECT: return _named.toString();
            default:     return "[]";
        }
    }
}
