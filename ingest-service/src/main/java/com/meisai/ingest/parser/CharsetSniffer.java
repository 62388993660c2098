package com.meisai.ingest.parser;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Statement exports come either as UTF-8 (optionally with BOM) or as Shift_JIS from the ETC portal.
 */
public final class CharsetSniffer {

    public static final Charset WINDOWS_31J = Charset.forName("windows-31j");

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private CharsetSniffer() {
    }

    public static boolean startsWithBom(byte[] data) {
        return data != null && data.length >= 3
                && data[0] == UTF8_BOM[0] && data[1] == UTF8_BOM[1] && data[2] == UTF8_BOM[2];
    }

    /** True while {@code data} is shorter than a byte order mark and matches its first bytes. */
    public static boolean couldBeBomPrefix(byte[] data) {
        if (data.length >= UTF8_BOM.length) {
            return false;
        }
        for (int i = 0; i < data.length; i++) {
            if (data[i] != UTF8_BOM[i]) {
                return false;
            }
        }
        return true;
    }

    public static int bomLength() {
        return UTF8_BOM.length;
    }

    public static boolean isAscii(byte[] data, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            if (data[i] < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * UTF-8 when the bytes decode strictly (a truncated trailing sequence is tolerated), else windows-31j.
     */
    public static Charset sniff(byte[] data, int offset, int length) {
        if (startsWithBom(data)) {
            return StandardCharsets.UTF_8;
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer out = CharBuffer.allocate(Math.max(16, length));
        CoderResult result = decoder.decode(ByteBuffer.wrap(data, offset, length), out, false);
        return result.isError() ? WINDOWS_31J : StandardCharsets.UTF_8;
    }

    public static Charset sniff(byte[] data) {
        return sniff(data, 0, data.length);
    }
}
