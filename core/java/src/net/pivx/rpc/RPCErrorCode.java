package net.pivx.rpc;

/**
 * Error codes carried in the "code" field of a JSON-RPC error object.
 *
 * The -327xx/-326xx values are the standard JSON-RPC ones,
 * the small negative values are specific to the node.
 * Clients rely on these numbers, do not renumber.
 */
public final class RPCErrorCode {

    private RPCErrorCode() {}

    // Standard JSON-RPC 2.0 errors
    public static final int RPC_INVALID_REQUEST = -32600;
    public static final int RPC_METHOD_NOT_FOUND = -32601;
    public static final int RPC_INVALID_PARAMS = -32602;
    public static final int RPC_INTERNAL_ERROR = -32603;
    public static final int RPC_PARSE_ERROR = -32700;

    // General application defined errors
    /** std::exception thrown in command handling */
    public static final int RPC_MISC_ERROR = -1;
    /** Server is in safe mode, and command is not allowed in safe mode */
    public static final int RPC_FORBIDDEN_BY_SAFE_MODE = -2;
    /** Unexpected type was passed as parameter */
    public static final int RPC_TYPE_ERROR = -3;
    /** Invalid address or key */
    public static final int RPC_INVALID_ADDRESS_OR_KEY = -5;
    /** Ran out of memory during operation */
    public static final int RPC_OUT_OF_MEMORY = -7;
    /** Invalid, missing or duplicate parameter */
    public static final int RPC_INVALID_PARAMETER = -8;
    /** Database error */
    public static final int RPC_DATABASE_ERROR = -20;
    /** Error parsing or validating structure in raw format */
    public static final int RPC_DESERIALIZATION_ERROR = -22;
    /** Client still warming up */
    public static final int RPC_IN_WARMUP = -28;

    /**
     *  Short symbolic name for logging.
     *  @return the constant name, or "RPC_ERROR_" + code for unknown codes
     */
    public static String toString(int code) {
        switch (code) {
            case RPC_INVALID_REQUEST:        return "RPC_INVALID_REQUEST";
            case RPC_METHOD_NOT_FOUND:       return "RPC_METHOD_NOT_FOUND";
            case RPC_INVALID_PARAMS:         return "RPC_INVALID_PARAMS";
            case RPC_INTERNAL_ERROR:         return "RPC_INTERNAL_ERROR";
            case RPC_PARSE_ERROR:            return "RPC_PARSE_ERROR";
            case RPC_MISC_ERROR:             return "RPC_MISC_ERROR";
            case RPC_FORBIDDEN_BY_SAFE_MODE: return "RPC_FORBIDDEN_BY_SAFE_MODE";
            case RPC_TYPE_ERROR:             return "RPC_TYPE_ERROR";
            case RPC_INVALID_ADDRESS_OR_KEY: return "RPC_INVALID_ADDRESS_OR_KEY";
            case RPC_OUT_OF_MEMORY:          return "RPC_OUT_OF_MEMORY";
            case RPC_INVALID_PARAMETER:      return "RPC_INVALID_PARAMETER";
            case RPC_DATABASE_ERROR:         return "RPC_DATABASE_ERROR";
            case RPC_DESERIALIZATION_ERROR:  return "RPC_DESERIALIZATION_ERROR";
            case RPC_IN_WARMUP:              return "RPC_IN_WARMUP";
            default:                         return "RPC_ERROR_" + code;
        }
    }
}
