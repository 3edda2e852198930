package io.scalex.bridge.codec;

import io.scalex.bridge.error.BridgeException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Locale;

/**
 * Canonical 32-byte account and contract identifiers.
 * 
 * The canonical text form is {@code 0x} followed by 64 lowercase hex digits.
 * Shorter inputs (such as 20-byte EVM addresses) are left-padded with zeros.
 */
public final class Addresses {

    public static final int LENGTH = 32;

    public static final String ZERO = "0x" + "0".repeat(LENGTH * 2);

    private Addresses() {
    }

    /**
     * Normalize an address to its canonical form.
     *
     * @param address hex address with or without 0x prefix, at most 32 bytes
     * @return canonical address
     * @throws BridgeException MALFORMED_MESSAGE if the input is not hex or too long
     */
    public static String normalize(String address) {
        if (address == null) {
            throw BridgeException.malformed("address is null");
        }
        String hex = address.trim().toLowerCase(Locale.ROOT);
        if (hex.startsWith("0x")) {
            hex = hex.substring(2);
        }
        if (hex.isEmpty() || hex.length() > LENGTH * 2 || !hex.matches("[0-9a-f]+")) {
            throw BridgeException.malformed("invalid address '" + address + "'");
        }
        return "0x" + "0".repeat(LENGTH * 2 - hex.length()) + hex;
    }

    /**
     * True for null, blank and all-zero addresses.
     */
    public static boolean isZero(String address) {
        return address == null || address.isBlank() || ZERO.equals(normalize(address));
    }

    public static boolean same(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return normalize(a).equals(normalize(b));
    }

    public static byte[] toBytes(String address) {
        return Hex.decode(normalize(address).substring(2));
    }

    public static String fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw BridgeException.malformed("address must be " + LENGTH + " bytes");
        }
        return "0x" + Hex.toHexString(bytes);
    }
}
