package net.pivx.rpc;

import java.util.List;
import java.util.Map;

/**
 * The six JSON value types, as seen on the Java objects
 * produced by the org.json.simple deserializer.
 *
 * <pre>
 *     true|false  &lt;---&gt;  java.lang.Boolean
 *     number      &lt;---&gt;  java.lang.Number
 *     string      &lt;---&gt;  java.lang.String
 *     array       &lt;---&gt;  java.util.List
 *     object      &lt;---&gt;  java.util.Map
 *     null        &lt;---&gt;  null
 * </pre>
 */
public enum JSONType {
    NULL("null"),
    OBJECT("object"),
    ARRAY("array"),
    STRING("string"),
    NUMBER("number"),
    BOOL("bool");

    private final String _name;

    JSONType(String name) {
        _name = name;
    }

    /** the name used in type error messages */
    public String getName() {
        return _name;
    }

    /**
     *  @throws IllegalArgumentException for objects that can't come out of a JSON parser
     */
    public static JSONType of(Object o) {
        if (o == null)
            return NULL;
        if (o instanceof Map)
            return OBJECT;
        if (o instanceof List)
            return ARRAY;
        if (o instanceof String)
            return STRING;
        if (o instanceof Number)
            return NUMBER;
        if (o instanceof Boolean)
            return BOOL;
        throw new IllegalArgumentException("Not a JSON value: " + o.getClass().getName());
    }

    /**
     *  Type name for error messages, never throws.
     *  @return the JSON type name, or the class name for non-JSON objects
     */
    public static String nameOf(Object o) {
        try {
            return of(o).getName();
        } catch (IllegalArgumentException iae) {
            return o.getClass().getSimpleName();
        }
    }
}
