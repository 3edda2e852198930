package io.scalex.bridge.codec;

import io.scalex.bridge.canonical.BridgeMessage;
import io.scalex.bridge.canonical.enums.MessageKind;
import io.scalex.bridge.error.BridgeErrorCode;
import io.scalex.bridge.error.BridgeException;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * Fixed-layout binary codec for {@link BridgeMessage} bodies.
 * 
 * Layout (133 bytes, big-endian):
 * <pre>
 * kind(1) | token(32) | recipient(32) | amount(32) | originDomain(4) | sequence(32)
 * </pre>
 * 
 * Both ends of a route must use this codec. Anything that does not match the
 * layout exactly is rejected.
 */
public final class BridgeMessageCodec {

    public static final int WORD = 32;
    public static final int ENCODED_LENGTH = 1 + WORD + WORD + WORD + Integer.BYTES + WORD;

    private static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private BridgeMessageCodec() {
    }

    public static byte[] encode(BridgeMessage message) {
        if (message == null || message.getKind() == null) {
            throw BridgeException.malformed("message kind is required");
        }
        ByteBuffer buffer = ByteBuffer.allocate(ENCODED_LENGTH);
        buffer.put(message.getKind().getCode());
        buffer.put(Addresses.toBytes(message.getToken()));
        buffer.put(Addresses.toBytes(message.getRecipient()));
        buffer.put(toWord(message.getAmount(), "amount"));
        buffer.putInt(message.getOriginDomain());
        buffer.put(toWord(message.getSequence(), "sequence"));
        return buffer.array();
    }

    public static BridgeMessage decode(byte[] body) {
        if (body == null || body.length != ENCODED_LENGTH) {
            throw BridgeException.malformed("expected " + ENCODED_LENGTH + " bytes, got "
                + (body == null ? "null" : body.length));
        }
        ByteBuffer buffer = ByteBuffer.wrap(body);
        byte code = buffer.get();
        MessageKind kind = MessageKind.fromCode(code);
        if (kind == null) {
            throw new BridgeException(BridgeErrorCode.INVALID_MESSAGE_KIND, "Unknown message kind code: " + code);
        }
        String token = Addresses.fromBytes(read(buffer, WORD));
        String recipient = Addresses.fromBytes(read(buffer, WORD));
        BigInteger amount = new BigInteger(1, read(buffer, WORD));
        int originDomain = buffer.getInt();
        BigInteger sequence = new BigInteger(1, read(buffer, WORD));
        return BridgeMessage.builder()
            .kind(kind)
            .token(token)
            .recipient(recipient)
            .amount(amount)
            .originDomain(originDomain)
            .sequence(sequence)
            .build();
    }

    private static byte[] read(ByteBuffer buffer, int length) {
        byte[] out = new byte[length];
        buffer.get(out);
        return out;
    }

    private static byte[] toWord(BigInteger value, String field) {
        if (value == null || value.signum() < 0 || value.compareTo(MAX_UINT256) > 0) {
            throw BridgeException.malformed(field + " out of uint256 range: " + value);
        }
        byte[] raw = value.toByteArray();
        byte[] word = new byte[WORD];
        // toByteArray may carry a leading sign byte
        int copy = Math.min(raw.length, WORD);
        System.arraycopy(raw, raw.length - copy, word, WORD - copy, copy);
        return word;
    }
}
