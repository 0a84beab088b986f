package ai.treemetrics.analyzer;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Source text of one file together with its UTF-8 bytes and a line index. Tree-sitter reports UTF-8 byte offsets, so
 * all slicing and line lookups here are byte based.
 */
public final class SourceContent {
    private static final Logger logger = LogManager.getLogger(SourceContent.class);

    private final String text;
    private final byte[] utf8Bytes;
    /** Byte offset at which each line starts. */
    private final int[] lineStarts;

    private final boolean[] blankLines;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
        this.lineStarts = computeLineStarts(utf8Bytes);
        this.blankLines = computeBlankLines(utf8Bytes, lineStarts);
    }

    public static SourceContent of(String src) {
        var stripped = stripBom(src);
        return new SourceContent(stripped, stripped.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes raw file bytes as strict UTF-8.
     *
     * @throws CharacterCodingException if the bytes are not valid UTF-8
     */
    public static SourceContent decode(byte[] bytes) throws CharacterCodingException {
        var decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        var text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        return of(text);
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }

    private static int[] computeLineStarts(byte[] bytes) {
        if (bytes.length == 0) {
            return new int[0];
        }
        var starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < bytes.length; i++) {
            // a trailing newline does not open another line
            if (bytes[i] == '\n' && i + 1 < bytes.length) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    private static boolean[] computeBlankLines(byte[] bytes, int[] lineStarts) {
        var blank = new boolean[lineStarts.length];
        for (int line = 0; line < lineStarts.length; line++) {
            int end = line + 1 < lineStarts.length ? lineStarts[line + 1] : bytes.length;
            boolean isBlank = true;
            for (int i = lineStarts[line]; i < end; i++) {
                byte b = bytes[i];
                if (b != ' ' && b != '\t' && b != '\r' && b != '\n' && b != '\f' && b != 0x0B) {
                    isBlank = false;
                    break;
                }
            }
            blank[line] = isBlank;
        }
        return blank;
    }

    /**
     * Extracts a substring using UTF-8 byte offsets [startByte, endByte). Out-of-range requests are clamped or answered
     * with the empty string.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            logger.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    utf8Bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (startByte >= utf8Bytes.length) {
            return "";
        }
        if (endByte > utf8Bytes.length) {
            logger.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, utf8Bytes.length);
            endByte = utf8Bytes.length;
        }
        int len = endByte - startByte;
        if (len == 0) return "";

        return new String(utf8Bytes, startByte, len, StandardCharsets.UTF_8);
    }

    /** Number of lines; a trailing newline does not start a new line and an empty file has none. */
    public int lineCount() {
        return lineStarts.length;
    }

    public boolean isBlankLine(int row) {
        return row < 0 || row >= blankLines.length || blankLines[row];
    }

    /** 0-based line containing the given byte offset. */
    public int rowOfByte(int byteOffset) {
        if (lineStarts.length == 0 || byteOffset <= 0) {
            return 0;
        }
        int idx = Arrays.binarySearch(lineStarts, byteOffset);
        return idx >= 0 ? idx : -idx - 2;
    }

    /** Last line touched by the range [startByte, endByte); a range ending right after a newline ends on that line. */
    public int lastRowOfRange(int startByte, int endByte) {
        if (endByte <= startByte) {
            return rowOfByte(startByte);
        }
        return rowOfByte(endByte - 1);
    }

    public String text() {
        return text;
    }

    public byte[] utf8Bytes() {
        return utf8Bytes;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + utf8Bytes.length + ", lines=" + lineStarts.length + ']';
    }
}
