package com.meisai.ingest.parser;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.ingest.entity.StatementRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns one CSV row of an ETC statement export into an unsaved {@link StatementRecord}.
 * Row problems are reported as {@link ErrorKind#ROW_PARSE_ERROR}; the caller counts them and moves on.
 */
@Component
public class StatementCsvParser {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();

    // four digit years first, "yy" would otherwise swallow "2024/01/05" as year 20
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("[yyyy/M/d][yyyy-M-d][yyyy.M.d][yyyyMMdd][yy/M/d]");

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm[:ss]");

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    // minimum a data row needs; remarks may be cut off by some exports
    private static final int REQUIRED_COLUMNS = StatementColumn.COUNT - 1;

    /** Splits a single logical row. Quoted cells may contain commas and line breaks. */
    public List<String> split(String line) {
        try (CSVParser parser = CSVParser.parse(line, FORMAT)) {
            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) {
                return List.of();
            }
            List<String> cells = new ArrayList<>();
            it.next().forEach(cells::add);
            return cells;
        } catch (IOException | UncheckedIOException e) {
            throw rowError("unreadable CSV row: " + e.getMessage(), null);
        }
    }

    /**
     * A first line whose leading cell is a date is data. Otherwise it must look like the 13 column header.
     */
    public FirstLineKind classifyFirstLine(List<String> cells) {
        if (cells.isEmpty()) {
            return FirstLineKind.MALFORMED;
        }
        if (isDate(StatementColumn.USAGE_DATE_FROM.cell(cells))
                || (TextNormalizer.normalize(StatementColumn.USAGE_DATE_FROM.cell(cells)).isEmpty()
                && isDate(StatementColumn.USAGE_DATE_TO.cell(cells)))) {
            return FirstLineKind.DATA;
        }
        return cells.size() >= StatementColumn.COUNT ? FirstLineKind.HEADER : FirstLineKind.MALFORMED;
    }

    public StatementRecord parse(List<String> cells) {
        if (cells.size() < REQUIRED_COLUMNS) {
            throw rowError("expected " + StatementColumn.COUNT + " columns but got " + cells.size(), null);
        }

        String dateFrom = TextNormalizer.normalize(StatementColumn.USAGE_DATE_FROM.cell(cells));
        String dateTo = TextNormalizer.normalize(StatementColumn.USAGE_DATE_TO.cell(cells));
        LocalDate date = parseDate(dateFrom.isEmpty() ? dateTo : dateFrom, StatementColumn.USAGE_DATE_FROM);
        LocalDate exitDate = dateTo.isEmpty() ? null : parseDate(dateTo, StatementColumn.USAGE_DATE_TO);

        String timeFrom = TextNormalizer.normalize(StatementColumn.TIME_FROM.cell(cells));
        String timeTo = TextNormalizer.normalize(StatementColumn.TIME_TO.cell(cells));
        LocalTime time = parseTime(timeFrom.isEmpty() ? timeTo : timeFrom, StatementColumn.TIME_FROM);
        LocalTime exitTime = timeTo.isEmpty() ? null : parseTime(timeTo, StatementColumn.TIME_TO);

        return StatementRecord.builder()
                .date(date)
                .time(time)
                .exitDate(exitDate)
                .exitTime(exitTime)
                .entryPoint(required(cells, StatementColumn.ENTRY_IC))
                .exitPoint(required(cells, StatementColumn.EXIT_IC))
                .tollStationName(TextNormalizer.normalizeToNull(StatementColumn.TOLL_STATION_NAME.cell(cells)))
                .tollAmount(parseAmount(StatementColumn.TOLL_AMOUNT.cell(cells)))
                .usageCategory(TextNormalizer.normalizeToNull(StatementColumn.USAGE_CATEGORY.cell(cells)))
                .vehicleClass(TextNormalizer.normalizeToNull(StatementColumn.VEHICLE_CLASS.cell(cells)))
                .vehicleNumber(required(cells, StatementColumn.VEHICLE_NUMBER))
                .cardNumber(required(cells, StatementColumn.CARD_NUMBER))
                .remarks(TextNormalizer.normalizeToNull(StatementColumn.REMARKS.cell(cells)))
                .build();
    }

    public boolean isDate(String value) {
        return tryParseDate(TextNormalizer.normalize(value)).isPresent();
    }

    LocalDate parseDate(String value, StatementColumn column) {
        if (value.isEmpty()) {
            throw rowError("usage date is missing", column);
        }
        return tryParseDate(value)
                .orElseThrow(() -> rowError("unrecognised date '" + value + "'", column));
    }

    private static Optional<LocalDate> tryParseDate(String value) {
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value, DATE_FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    LocalTime parseTime(String value, StatementColumn column) {
        if (value.isEmpty()) {
            throw rowError("usage time is missing", column);
        }
        try {
            return LocalTime.parse(value, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw rowError("unrecognised time '" + value + "'", column);
        }
    }

    int parseAmount(String raw) {
        String cleaned = TextNormalizer.normalize(raw)
                .replace(",", "")
                .replace("円", "")
                .replace("¥", "")
                .replace("￥", "")
                .replace(" ", "");
        if (cleaned.startsWith("-") && DIGITS.matcher(cleaned.substring(1)).matches()) {
            throw rowError("toll amount must not be negative: " + raw, StatementColumn.TOLL_AMOUNT);
        }
        if (!DIGITS.matcher(cleaned).matches()) {
            throw rowError("toll amount is not numeric: '" + raw + "'", StatementColumn.TOLL_AMOUNT);
        }
        try {
            return Integer.parseInt(cleaned);
        } catch (NumberFormatException e) {
            throw rowError("toll amount out of range: " + raw, StatementColumn.TOLL_AMOUNT);
        }
    }

    private static String required(List<String> cells, StatementColumn column) {
        String value = TextNormalizer.normalize(column.cell(cells));
        if (value.isEmpty()) {
            throw rowError(column.name().toLowerCase(Locale.ROOT).replace('_', '-') + " is required", column);
        }
        return value;
    }

    private static MeisaiException rowError(String message, StatementColumn column) {
        return new MeisaiException(ErrorKind.ROW_PARSE_ERROR, message,
                column == null ? Map.of() : Map.of("column", column.name()));
    }
}
