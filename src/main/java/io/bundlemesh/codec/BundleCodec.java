package io.bundlemesh.codec;

import io.bundlemesh.model.Audience;
import io.bundlemesh.model.Bundle;
import io.bundlemesh.model.Destination;
import io.bundlemesh.model.Priority;
import io.bundlemesh.util.Hashing;
import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Canonical binary form of a bundle.
 *
 * <p>Layout, big-endian, version 1:
 * <pre>
 * magic "DTNB" | version u8 | id[32] | source[32] | sourceBoxKey[32]
 * | destination u16+utf8 | topic u16+utf8 | priority u8 | audience u8
 * | createdAtMs i64 | expiresAtMs i64 | hopLimit u8 | hopCount u8
 * | custodyRequested u8 | signature u16+bytes | payload u32+bytes
 * </pre>
 * The signable form is the same sequence without magic, version, id,
 * hopCount and signature. The id is the SHA-256 of the signable form.
 */
public final class BundleCodec {
    public static final int VERSION = 1;
    public static final int ID_BYTES = 32;
    public static final int KEY_BYTES = 32;
    public static final int SIGNATURE_BYTES = 64;
    public static final int MAX_TEXT_BYTES = 1024;
    public static final int MAX_PAYLOAD_BYTES = 16 * 1024 * 1024;
    private static final byte[] MAGIC = {'D', 'T', 'N', 'B'};

    private BundleCodec() {
    }

    public static byte[] encode(Bundle bundle) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(256 + bundle.payload().length);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.write(MAGIC);
            out.writeByte(VERSION);
            out.write(idBytes(bundle.id()));
            writeFixed(out, bundle.source(), KEY_BYTES, "source");
            writeFixed(out, bundle.sourceBoxKey(), KEY_BYTES, "sourceBoxKey");
            writeText(out, bundle.destination().toString());
            writeText(out, bundle.topic());
            out.writeByte(bundle.priority().rank());
            out.writeByte(bundle.audience().ordinal());
            out.writeLong(bundle.createdAtMs());
            out.writeLong(bundle.expiresAtMs());
            out.writeByte(bundle.hopLimit());
            out.writeByte(bundle.hopCount());
            out.writeByte(bundle.custodyRequested() ? 1 : 0);
            out.writeShort(bundle.signature().length);
            out.write(bundle.signature());
            out.writeInt(bundle.payload().length);
            out.write(bundle.payload());
        } catch (IOException e) {
            throw new IllegalStateException("In-memory encoding failed", e);
        }
        return bytes.toByteArray();
    }

    public static Bundle decode(byte[] frame) {
        if (frame == null) {
            throw new DecodeException("Frame is null");
        }
        ByteBuffer in = ByteBuffer.wrap(frame);
        try {
            byte[] magic = new byte[MAGIC.length];
            in.get(magic);
            for (int i = 0; i < MAGIC.length; i++) {
                if (magic[i] != MAGIC[i]) {
                    throw new DecodeException("Bad magic");
                }
            }
            int version = Byte.toUnsignedInt(in.get());
            if (version != VERSION) {
                throw new DecodeException("Unsupported bundle version: " + version);
            }
            byte[] id = readFixed(in, ID_BYTES);
            byte[] source = readFixed(in, KEY_BYTES);
            byte[] sourceBoxKey = readFixed(in, KEY_BYTES);
            String destinationRaw = readText(in);
            String topic = readText(in);
            Priority priority = priorityOf(Byte.toUnsignedInt(in.get()));
            Audience audience = audienceOf(Byte.toUnsignedInt(in.get()));
            long createdAtMs = in.getLong();
            long expiresAtMs = in.getLong();
            int hopLimit = Byte.toUnsignedInt(in.get());
            int hopCount = Byte.toUnsignedInt(in.get());
            int custody = Byte.toUnsignedInt(in.get());
            if (custody > 1) {
                throw new DecodeException("Bad custody flag: " + custody);
            }
            int signatureLength = Short.toUnsignedInt(in.getShort());
            if (signatureLength != SIGNATURE_BYTES) {
                throw new DecodeException("Bad signature length: " + signatureLength);
            }
            byte[] signature = readFixed(in, signatureLength);
            int payloadLength = in.getInt();
            if (payloadLength < 0 || payloadLength > MAX_PAYLOAD_BYTES) {
                throw new DecodeException("Bad payload length: " + payloadLength);
            }
            byte[] payload = readFixed(in, payloadLength);
            if (in.hasRemaining()) {
                throw new DecodeException("Trailing bytes after payload: " + in.remaining());
            }
            Destination destination = Destination.parse(destinationRaw);
            return new Bundle(
                    Hex.toHexString(id),
                    source,
                    sourceBoxKey,
                    destination,
                    topic,
                    priority,
                    audience,
                    createdAtMs,
                    expiresAtMs,
                    hopLimit,
                    hopCount,
                    custody == 1,
                    signature,
                    payload
            );
        } catch (BufferUnderflowException e) {
            throw new DecodeException("Truncated frame", e);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid field: " + e.getMessage(), e);
        }
    }

    /**
     * Canonical bytes covered by the signature and the content id.
     */
    public static byte[] signableBytes(
            byte[] source,
            byte[] sourceBoxKey,
            Destination destination,
            String topic,
            Priority priority,
            Audience audience,
            long createdAtMs,
            long expiresAtMs,
            int hopLimit,
            boolean custodyRequested,
            byte[] payload
    ) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(160 + payload.length);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writeFixed(out, source, KEY_BYTES, "source");
            writeFixed(out, sourceBoxKey, KEY_BYTES, "sourceBoxKey");
            writeText(out, destination.toString());
            writeText(out, topic);
            out.writeByte(priority.rank());
            out.writeByte(audience.ordinal());
            out.writeLong(createdAtMs);
            out.writeLong(expiresAtMs);
            out.writeByte(hopLimit);
            out.writeByte(custodyRequested ? 1 : 0);
            out.writeInt(payload.length);
            out.write(payload);
        } catch (IOException e) {
            throw new IllegalStateException("In-memory encoding failed", e);
        }
        return bytes.toByteArray();
    }

    public static byte[] signableBytes(Bundle bundle) {
        return signableBytes(
                bundle.source(),
                bundle.sourceBoxKey(),
                bundle.destination(),
                bundle.topic(),
                bundle.priority(),
                bundle.audience(),
                bundle.createdAtMs(),
                bundle.expiresAtMs(),
                bundle.hopLimit(),
                bundle.custodyRequested(),
                bundle.payload()
        );
    }

    public static String computeId(byte[] signableBytes) {
        return Hashing.sha256Hex(signableBytes);
    }

    public static String computeId(Bundle bundle) {
        return computeId(signableBytes(bundle));
    }

    private static byte[] idBytes(String idHex) {
        byte[] id;
        try {
            id = Hex.decode(idHex);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Bundle id is not hex: " + idHex, e);
        }
        if (id.length != ID_BYTES) {
            throw new IllegalArgumentException("Bundle id must be " + ID_BYTES + " bytes");
        }
        return id;
    }

    private static void writeFixed(DataOutputStream out, byte[] value, int length, String field) throws IOException {
        if (value.length != length) {
            throw new IllegalArgumentException(field + " must be " + length + " bytes, got " + value.length);
        }
        out.write(value);
    }

    private static void writeText(DataOutputStream out, String value) throws IOException {
        byte[] raw = value.getBytes(StandardCharsets.UTF_8);
        if (raw.length > MAX_TEXT_BYTES) {
            throw new IllegalArgumentException("Text field exceeds " + MAX_TEXT_BYTES + " bytes");
        }
        out.writeShort(raw.length);
        out.write(raw);
    }

    private static byte[] readFixed(ByteBuffer in, int length) {
        if (in.remaining() < length) {
            throw new DecodeException("Truncated frame: need " + length + " bytes, have " + in.remaining());
        }
        byte[] out = new byte[length];
        in.get(out);
        return out;
    }

    private static String readText(ByteBuffer in) {
        int length = Short.toUnsignedInt(in.getShort());
        if (length > MAX_TEXT_BYTES) {
            throw new DecodeException("Text field too long: " + length);
        }
        byte[] raw = readFixed(in, length);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Invalid UTF-8 text field", e);
        }
    }

    private static Priority priorityOf(int rank) {
        try {
            return Priority.fromRank(rank);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Unknown priority rank: " + rank, e);
        }
    }

    private static Audience audienceOf(int ordinal) {
        Audience[] values = Audience.values();
        if (ordinal >= values.length) {
            throw new DecodeException("Unknown audience: " + ordinal);
        }
        return values[ordinal];
    }
}
