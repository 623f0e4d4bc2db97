package jobrelay.relay.parser;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LineAssemblerTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void splitsCompleteLines() {
        LineAssembler assembler = new LineAssembler();
        assertEquals(List.of("one", "two"), assembler.feed(utf8("one\ntwo\nthr")));
        assertEquals(List.of("three"), assembler.feed(utf8("ee\n")));
        assertEquals(Optional.empty(), assembler.finish());
    }

    @Test
    void lineSplitAcrossChunksIsEmittedOnce() {
        LineAssembler assembler = new LineAssembler();
        assertTrue(assembler.feed(utf8("[150/30")).isEmpty());
        assertTrue(assembler.feed(utf8("00] (5%) Ani")).isEmpty());
        assertEquals(List.of("[150/3000] (5%) Animals/img.jpg"), assembler.feed(utf8("mals/img.jpg\n")));
    }

    @Test
    void multiByteCharacterSplitAcrossChunks() {
        byte[] bytes = utf8("Zürich 🐱\n");
        LineAssembler assembler = new LineAssembler();

        List<String> lines = new ArrayList<>();
        for (byte b : bytes) {
            lines.addAll(assembler.feed(new byte[] { b }));
        }

        assertEquals(List.of("Zürich 🐱"), lines);
    }

    @Test
    void stripsCarriageReturn() {
        LineAssembler assembler = new LineAssembler();
        assertEquals(List.of("windows", ""), assembler.feed(utf8("windows\r\n\r\n")));
    }

    @Test
    void finishReturnsUnterminatedTail() {
        LineAssembler assembler = new LineAssembler();
        assembler.feed(utf8("done\nno newline"));
        assertEquals(Optional.of("no newline"), assembler.finish());
        assertEquals(Optional.empty(), assembler.finish());
    }

    @Test
    void respectsOffsetAndLength() {
        byte[] buffer = utf8("xxabc\nyy");
        assertEquals(List.of("abc"), new LineAssembler().feed(buffer, 2, 4));
    }
    @Test
    void overlongLineIsEmittedInBoundedPieces() {
        LineAssembler assembler = new LineAssembler();
        String line = "x".repeat(LineAssembler.MAX_LINE_CHARS * 2 + LineAssembler.MAX_LINE_CHARS / 2);
        byte[] bytes = utf8(line + "\n");

        List<String> pieces = new ArrayList<>();
        for (int offset = 0; offset < bytes.length; offset += 4096) {
            pieces.addAll(assembler.feed(bytes, offset, Math.min(4096, bytes.length - offset)));
        }

        assertEquals(3, pieces.size());
        for (String piece : pieces) {
            assertTrue(piece.length() <= LineAssembler.MAX_LINE_CHARS);
        }
        assertEquals(line, String.join("", pieces));
        assertEquals(Optional.empty(), assembler.finish());
    }

    @Test
    void overlongLineNeverSplitsSurrogatePair() {
        LineAssembler assembler = new LineAssembler();
        String head = "a".repeat(LineAssembler.MAX_LINE_CHARS - 1);

        List<String> pieces = assembler.feed(utf8(head + "🐱"));

        assertEquals(List.of(head), pieces);
        assertEquals(Optional.of("🐱"), assembler.finish());
    }

    @Test
    void manySmallChunksStillFindTheNewline() {
        LineAssembler assembler = new LineAssembler();
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            lines.addAll(assembler.feed(utf8("ab")));
        }
        lines.addAll(assembler.feed(utf8("\nnext\n")));

        assertEquals(List.of("ab".repeat(1000), "next"), lines);
    }
}
