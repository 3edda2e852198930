package io.scalex.bridge.codec;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

import java.nio.ByteBuffer;

/**
 * Deterministic message identifiers.
 * 
 * {@code id = keccak256(originDomain(4, big-endian) | sender(32) | body)}. The id
 * is the only key used to deduplicate deliveries.
 */
public final class MessageIds {

    private MessageIds() {
    }

    public static String compute(int originDomain, String sender, byte[] body) {
        byte[] senderBytes = Addresses.toBytes(sender);
        byte[] payload = body == null ? new byte[0] : body;
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + senderBytes.length + payload.length);
        buffer.putInt(originDomain);
        buffer.put(senderBytes);
        buffer.put(payload);

        Keccak.Digest256 digest = new Keccak.Digest256();
        return "0x" + Hex.toHexString(digest.digest(buffer.array()));
    }
}
