package jobrelay.relay.parser;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reassembles newline-terminated lines from a pipe read in arbitrary chunks.
 *
 * A line (or a multi-byte UTF-8 character) split across two reads is held back until
 * the rest arrives. A trailing {@code \r} before {@code \n} is dropped. A line longer than
 * {@link #MAX_LINE_CHARS} is emitted in pieces of at most that size.
 *
 * Not thread-safe; one instance per stream.
 */
public final class LineAssembler {

    static final int MAX_LINE_CHARS = 64 * 1024;

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    private final StringBuilder pending = new StringBuilder();
    // prefix of pending already known to hold no '\n'
    private int scanned;
    private ByteBuffer leftover = ByteBuffer.allocate(0);

    /**
     * Feed the next chunk of bytes.
     *
     * @return lines completed by this chunk, in order
     */
    public List<String> feed(byte[] chunk, int offset, int length) {
        ByteBuffer in = ByteBuffer.allocate(leftover.remaining() + length);
        in.put(leftover).put(chunk, offset, length).flip();

        CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        decoder.decode(in, out, false);
        out.flip();
        pending.append(out);

        // incomplete multi-byte sequence at the end of the chunk
        leftover = in.slice();

        return drainLines();
    }

    public List<String> feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    /**
     * Signal end of stream.
     *
     * @return the final unterminated line, if any
     */
    public Optional<String> finish() {
        CharBuffer out = CharBuffer.allocate(leftover.remaining() + 8);
        decoder.decode(leftover, out, true);
        decoder.flush(out);
        out.flip();
        pending.append(out);
        leftover = ByteBuffer.allocate(0);
        decoder.reset();

        if (pending.length() == 0) {
            return Optional.empty();
        }
        String last = stripCarriageReturn(pending.toString());
        pending.setLength(0);
        scanned = 0;
        return Optional.of(last);
    }

    private List<String> drainLines() {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = scanned; i < pending.length(); i++) {
            if (pending.charAt(i) == '\n') {
                lines.add(stripCarriageReturn(pending.substring(start, i)));
                start = i + 1;
            }
        }
        if (start > 0) {
            pending.delete(0, start);
        }

        while (pending.length() >= MAX_LINE_CHARS) {
            int cut = MAX_LINE_CHARS;
            if (Character.isHighSurrogate(pending.charAt(cut - 1))) {
                cut--;
            }
            lines.add(pending.substring(0, cut));
            pending.delete(0, cut);
        }
        scanned = pending.length();
        return lines;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
