package org.metapatch.xml;

import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Charset and byte-order marker of a loaded document; re-applied verbatim on save. Bytes that do not decode, and
 * characters the charset cannot hold, are errors: replacing them would rewrite text no edit touched.
 */
final class DocumentEncoding {

    final Charset cs;
    final int offset;

    DocumentEncoding(Charset cs, int offset) {
        this.cs = cs;
        this.offset = offset;
    }

    String decode(byte[] bytes) {
        CharsetDecoder decoder = cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        CharBuffer out = CharBuffer.allocate((int) Math.ceil(in.remaining() * (double) decoder.maxCharsPerByte()) + 1);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) result = decoder.flush(out);
        if (result.isError()) fail(result, "Invalid " + cs.name() + " bytes at offset " + in.position());
        return out.flip().toString();
    }

    byte[] encode(String str) {
        CharsetEncoder encoder = cs.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer in = CharBuffer.wrap(str);
        ByteBuffer buffer = ByteBuffer.allocate((int) Math.ceil(str.length() * (double) encoder.maxBytesPerChar()) + 4);
        CoderResult result = encoder.encode(in, buffer, true);
        if (!result.isError()) result = encoder.flush(buffer);
        if (result.isError()) fail(result, "Character at index " + in.position() + " cannot be written as " + cs.name());
        byte[] body = new byte[buffer.flip().remaining()];
        buffer.get(body);
        if (offset == 0) return body;
        byte[] out = new byte[offset + body.length];
        if (cs == StandardCharsets.UTF_8) {
            out[0] = (byte) 0xEF;
            out[1] = (byte) 0xBB;
            out[2] = (byte) 0xBF;
        } else if (cs == StandardCharsets.UTF_16BE) {
            out[0] = (byte) 0xFE;
            out[1] = (byte) 0xFF;
        } else if (cs == StandardCharsets.UTF_16LE) {
            out[0] = (byte) 0xFF;
            out[1] = (byte) 0xFE;
        }
        System.arraycopy(body, 0, out, offset, body.length);
        return out;
    }

    private static void fail(CoderResult result, String message) {
        try {
            result.throwException();
        } catch (CharacterCodingException e) {
            throw new UncheckedIOException(message, e);
        }
        throw new IllegalStateException(message);
    }

    static DocumentEncoding detect(byte[] bytes, String hint) {
        if (bytes.length >= 3 && bytes[0] == (byte) 0xEF && bytes[1] == (byte) 0xBB && bytes[2] == (byte) 0xBF)
            return new DocumentEncoding(StandardCharsets.UTF_8, 3);
        if (bytes.length >= 2 && bytes[0] == (byte) 0xFE && bytes[1] == (byte) 0xFF)
            return new DocumentEncoding(StandardCharsets.UTF_16BE, 2);
        if (bytes.length >= 2 && bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xFE)
            return new DocumentEncoding(StandardCharsets.UTF_16LE, 2);
        Charset cs = hint != null ? Charset.forName(hint) : StandardCharsets.UTF_8;
        return new DocumentEncoding(cs, 0);
    }

    /** Encoding for documents created in memory: UTF-8 with a byte-order marker, as the platform writes them. */
    static DocumentEncoding platformDefault() {
        return new DocumentEncoding(StandardCharsets.UTF_8, 3);
    }
}
