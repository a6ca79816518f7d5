package net.pivx.rpc.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

import net.i2p.data.Hash;

import net.pivx.rpc.JSONType;
import net.pivx.rpc.RPCErrorCode;
import net.pivx.rpc.RPCException;

/**
 * Value parsers for command handlers: hashes, hex blobs and coin amounts.
 */
public final class RPCParse {

    /** satoshis per coin */
    public static final long COIN = 100000000L;
    /** 21 million coins */
    public static final long MAX_MONEY = 21000000L * COIN;
    /** integer digits of MAX_MONEY in coins */
    private static final int MAX_MONEY_DIGITS = 8;

    private RPCParse() {}

    /**
     *  A 256-bit hash given as 64 hex characters, most significant byte first
     *  as displayed. The returned Hash holds the bytes in internal order,
     *  i.e. reversed.
     *
     *  @param name used in the error message
     */
    public static Hash parseHashV(Object v, String name) throws RPCException {
        String s = null;
        if (v instanceof String)
            s = (String) v;
        if (s == null || !isHex(s))
            throw new RPCException(RPCErrorCode.RPC_INVALID_PARAMETER,
                                   name + " must be hexadecimal string (not '" + (s != null ? s : JSONType.nameOf(v)) + "')");
        if (s.length() != 2 * Hash.HASH_LENGTH)
            throw new RPCException(RPCErrorCode.RPC_INVALID_PARAMETER,
                                   name + " must be of length " + (2 * Hash.HASH_LENGTH) + " (not " + s.length() + ")");
        byte[] b = decodeHex(s);
        for (int i = 0, j = b.length - 1; i < j; i++, j--) {
            byte t = b[i];
            b[i] = b[j];
            b[j] = t;
        }
        return new Hash(b);
    }

    /**
     *  parseHashV() of the value under key in o
     */
    public static Hash parseHashO(Map<String, ?> o, String key) throws RPCException {
        return parseHashV(o.get(key), key);
    }

    /**
     *  Arbitrary even-length hex, in the given byte order.
     *
     *  @param name used in the error message
     */
    public static byte[] parseHexV(Object v, String name) throws RPCException {
        String s = null;
        if (v instanceof String)
            s = (String) v;
        if (s == null || !isHex(s))
            throw new RPCException(RPCErrorCode.RPC_INVALID_PARAMETER,
                                   name + " must be hexadecimal string (not '" + (s != null ? s : JSONType.nameOf(v)) + "')");
        return decodeHex(s);
    }

    /**
     *  parseHexV() of the value under key in o
     */
    public static byte[] parseHexO(Map<String, ?> o, String key) throws RPCException {
        return parseHexV(o.get(key), key);
    }

    /**
     *  A JSON number or numeric string in coins, converted to satoshis.
     *  More than 8 decimal places are rounded half up.
     *
     *  @return satoshis, greater than zero and at most MAX_MONEY
     *  @throws RPCException RPC_TYPE_ERROR if not a number or out of range
     */
    public static long amountFromValue(Object value) throws RPCException {
        BigDecimal d;
        try {
            if (value instanceof BigDecimal) {
                d = (BigDecimal) value;
            } else if (value instanceof Number) {
                d = new BigDecimal(value.toString());
            } else if (value instanceof String) {
                d = new BigDecimal(((String) value).trim());
            } else {
                throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR, "Amount is not a number or string");
            }
        } catch (NumberFormatException nfe) {
            // includes NaN and Infinity
            throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR, "Invalid amount", nfe);
        }
        // Check the magnitude before rescaling, the exponent is client supplied.
        // More than MAX_MONEY_DIGITS integer digits is too big,
        // below 10^-9 rounds to zero.
        long intDigits = (long) d.precision() - d.scale();
        if (d.signum() <= 0 || intDigits > MAX_MONEY_DIGITS || intDigits < -8)
            throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR, "Invalid amount");
        BigDecimal sats = d.setScale(8, RoundingMode.HALF_UP).movePointRight(8);
        if (sats.signum() <= 0 || sats.compareTo(BigDecimal.valueOf(MAX_MONEY)) > 0)
            throw new RPCException(RPCErrorCode.RPC_TYPE_ERROR, "Invalid amount");
        return sats.longValueExact();
    }

    /**
     *  Satoshis to coins, always with 8 decimal places
     */
    public static BigDecimal valueFromAmount(long amount) {
        return BigDecimal.valueOf(amount, 8);
    }

    private static boolean isHex(String s) {
        if ((s.length() & 1) != 0)
            return false;
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0)
                return false;
        }
        return true;
    }

    /** s must have passed isHex() */
    private static byte[] decodeHex(String s) {
        byte[] rv = new byte[s.length() / 2];
        for (int i = 0; i < rv.length; i++) {
            int hi = Character.digit(s.charAt(2 * i), 16);
            int lo = Character.digit(s.charAt(2 * i + 1), 16);
            rv[i] = (byte) ((hi << 4) | lo);
        }
        return rv;
    }
}
