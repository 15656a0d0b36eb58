package com.scriptdeck.runner.pipeline;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Splits a byte stream on {@code '\n'} and decodes each line as UTF-8,
 * silently dropping malformed byte sequences.
 *
 * Only the newline is stripped; a carriage return before it stays part of the line.
 * A final line without a newline is returned when the stream ends.
 */
final class LineReader {

    private final InputStream in;
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);

    LineReader(InputStream in) {
        this.in = new BufferedInputStream(in);
    }

    /** Next line without its terminating newline, or null at end of stream. */
    String readLine() throws IOException {
        buffer.reset();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return decode();
            }
            buffer.write(b);
        }
        return buffer.size() > 0 ? decode() : null;
    }

    private String decode() throws CharacterCodingException {
        decoder.reset();
        return decoder.decode(ByteBuffer.wrap(buffer.toByteArray())).toString();
    }
}
