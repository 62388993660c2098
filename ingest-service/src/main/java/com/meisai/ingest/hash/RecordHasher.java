package com.meisai.ingest.hash;

import com.meisai.ingest.entity.StatementRecord;
import com.meisai.ingest.parser.TextNormalizer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Content fingerprint of a statement record.
 * <p>
 * SHA-256 over date, time, entry, exit, amount, vehicle and card in that order. Every field is written
 * as {@code <length>:<value>|}, so shifting characters between neighbouring fields changes the input.
 */
@Component
public class RecordHasher {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public String fingerprint(StatementRecord record) {
        StringBuilder canonical = new StringBuilder(160);
        field(canonical, date(record.getDate()));
        field(canonical, time(record.getTime()));
        field(canonical, TextNormalizer.normalize(record.getEntryPoint()));
        field(canonical, TextNormalizer.normalize(record.getExitPoint()));
        field(canonical, record.getTollAmount() == null ? "" : record.getTollAmount().toString());
        field(canonical, TextNormalizer.normalize(record.getVehicleNumber()));
        field(canonical, TextNormalizer.normalize(record.getCardNumber()));
        return sha256(canonical.toString());
    }

    /** date + time + card: what identifies "the same trip" when the other fields were corrected. */
    public String naturalKey(StatementRecord record) {
        StringBuilder key = new StringBuilder(64);
        field(key, date(record.getDate()));
        field(key, time(record.getTime()));
        field(key, TextNormalizer.normalize(record.getCardNumber()));
        return key.toString();
    }

    private static void field(StringBuilder out, String value) {
        out.append(value.length()).append(':').append(value).append('|');
    }

    private static String date(LocalDate date) {
        return date == null ? "" : date.toString();
    }

    private static String time(LocalTime time) {
        return time == null ? "" : TIME.format(time);
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
