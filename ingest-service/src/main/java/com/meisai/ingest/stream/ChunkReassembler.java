package com.meisai.ingest.stream;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.common.model.ImportChunk;
import com.meisai.ingest.config.ImportProperties.MismatchedSessionPolicy;
import com.meisai.ingest.parser.CharsetSniffer;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds whole CSV rows from the ordered chunks of one session.
 * <p>
 * Chunks may cut a row (or a multi-byte character) anywhere; the unfinished tail is kept and
 * prepended to the next chunk. Rows end at LF outside double quotes, a CR before the LF is dropped.
 * Scanning works on raw bytes: neither '"' nor LF occur inside multi-byte sequences of UTF-8 or Shift_JIS.
 * <p>
 * Not thread safe; the owning session's lock serialises access.
 */
@Slf4j
public class ChunkReassembler {

    private static final byte LF = '\n';
    private static final byte CR = '\r';
    private static final byte QUOTE = '"';

    private final String sessionId;
    private final int maxRowBytes;
    private final MismatchedSessionPolicy mismatchPolicy;

    private Charset charset;
    private ByteArrayOutputStream pending = new ByteArrayOutputStream();
    /** Leading bytes held back until the byte order mark is ruled in or out; null once decided. */
    private byte[] head = new byte[0];
    private boolean inQuotes;
    private boolean pendingAscii = true;
    private Long lastChunkNumber;
    private boolean finished;
    private boolean released;

    /**
     * @param fixedCharset charset to decode with, or null to detect it from the data
     */
    public ChunkReassembler(String sessionId, int maxRowBytes, MismatchedSessionPolicy mismatchPolicy,
                            Charset fixedCharset) {
        this.sessionId = sessionId;
        this.maxRowBytes = maxRowBytes;
        this.mismatchPolicy = mismatchPolicy;
        this.charset = fixedCharset;
    }

    public ReassembledRows accept(ImportChunk chunk) {
        if (released) {
            throw MeisaiException.stream(sessionId, "session buffer already released");
        }
        if (!sessionId.equals(chunk.getSessionId())) {
            if (mismatchPolicy == MismatchedSessionPolicy.IGNORE) {
                log.warn("Ignoring chunk {} of session {} delivered to session {}",
                        chunk.getChunkNumber(), chunk.getSessionId(), sessionId);
                return ReassembledRows.ignoredChunk();
            }
            throw new MeisaiException(ErrorKind.STREAM_ERROR, "chunk belongs to another session",
                    Map.of("sessionId", sessionId, "chunkSessionId", String.valueOf(chunk.getSessionId())));
        }
        if (finished) {
            throw MeisaiException.stream(sessionId, "chunk " + chunk.getChunkNumber() + " arrived after the last chunk");
        }
        checkOrder(chunk.getChunkNumber());

        byte[] data = chunk.getData() == null ? new byte[0] : chunk.getData();
        int received = data.length;
        lastChunkNumber = chunk.getChunkNumber();
        int offset = 0;
        if (head != null) {
            data = concat(head, data);
            if (!chunk.isLast() && CharsetSniffer.couldBeBomPrefix(data)) {
                // too few bytes yet to tell whether the stream starts with a byte order mark
                head = data;
                return new ReassembledRows(List.of(), received, false, false);
            }
            head = null;
            if (CharsetSniffer.startsWithBom(data)) {
                offset = CharsetSniffer.bomLength();
                if (charset == null) {
                    charset = StandardCharsets.UTF_8;
                }
            }
        }

        List<String> rows = new ArrayList<>();
        int rowStart = offset;
        for (int i = offset; i < data.length; i++) {
            byte b = data[i];
            if (b == QUOTE) {
                inQuotes = !inQuotes;
            } else if (b == LF && !inQuotes) {
                append(data, rowStart, i - rowStart);
                emit(rows);
                rowStart = i + 1;
            }
        }
        append(data, rowStart, data.length - rowStart);

        if (chunk.isLast()) {
            finished = true;
            if (inQuotes) {
                throw MeisaiException.stream(sessionId, "input ends inside a quoted field");
            }
            emit(rows);
        }
        return new ReassembledRows(rows, received, chunk.isLast(), false);
    }

    /** Bytes of the unfinished trailing row. */
    public int bufferedBytes() {
        return (pending == null ? 0 : pending.size()) + (head == null ? 0 : head.length);
    }

    public boolean isFinished() {
        return finished;
    }

    /** Drops the buffered partial row; further chunks are rejected. */
    public void release() {
        released = true;
        pending = null;
        head = null;
    }

    private void checkOrder(long chunkNumber) {
        if (lastChunkNumber == null) {
            return;
        }
        if (chunkNumber != lastChunkNumber + 1) {
            throw new MeisaiException(ErrorKind.STREAM_ERROR,
                    chunkNumber <= lastChunkNumber ? "chunk number went backwards" : "chunk number gap",
                    Map.of("sessionId", sessionId, "expected", lastChunkNumber + 1, "received", chunkNumber));
        }
    }

    private static byte[] concat(byte[] first, byte[] second) {
        if (first.length == 0) {
            return second;
        }
        byte[] joined = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, joined, first.length, second.length);
        return joined;
    }

    private void append(byte[] data, int from, int length) {
        if (length <= 0) {
            return;
        }
        if (pendingAscii && !CharsetSniffer.isAscii(data, from, length)) {
            pendingAscii = false;
        }
        pending.write(data, from, length);
        if (pending.size() > maxRowBytes) {
            throw new MeisaiException(ErrorKind.STREAM_ERROR, "row exceeds " + maxRowBytes + " bytes",
                    Map.of("sessionId", sessionId, "maxRowBytes", maxRowBytes));
        }
    }

    private void emit(List<String> rows) {
        byte[] row = pending.toByteArray();
        pending.reset();
        boolean ascii = pendingAscii;
        pendingAscii = true;

        int length = row.length;
        if (length > 0 && row[length - 1] == CR) {
            length--;
        }
        if (length == 0) {
            return;
        }
        if (!ascii && charset == null) {
            // first row with non-ASCII bytes decides; ASCII-only rows decode the same either way
            charset = CharsetSniffer.sniff(row, 0, length);
            log.debug("Session {} decoded as {}", sessionId, charset);
        }
        String text = new String(row, 0, length, charset == null ? StandardCharsets.US_ASCII : charset);
        if (!text.isBlank()) {
            rows.add(text);
        }
    }
}
