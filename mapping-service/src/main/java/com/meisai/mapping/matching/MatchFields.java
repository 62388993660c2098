package com.meisai.mapping.matching;

import com.meisai.common.model.StatementRecordEvent;
import com.meisai.mapping.client.StatementRecordView;
import com.meisai.mapping.entity.ExternalCandidate;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/** The fields both sides of a match are compared on. Text is normalized on construction. */
@Value
@Builder
public class MatchFields {

    LocalDate date;
    LocalTime time;
    String entryPoint;
    String exitPoint;
    Integer amount;
    String vehicleNumber;

    public static MatchFields of(StatementRecordView record) {
        return normalized(record.getDate(), record.getTime(), record.getEntryPoint(), record.getExitPoint(),
                record.getTollAmount(), record.getVehicleNumber());
    }

    public static MatchFields of(StatementRecordEvent event) {
        return normalized(event.getDate(), event.getTime(), event.getEntryPoint(), event.getExitPoint(),
                event.getTollAmount(), event.getVehicleNumber());
    }

    public static MatchFields of(ExternalCandidate candidate) {
        return normalized(candidate.getDate(), candidate.getTime(), candidate.getEntryPoint(),
                candidate.getExitPoint(), candidate.getAmount(), candidate.getVehicleNumber());
    }

    static MatchFields normalized(LocalDate date, LocalTime time, String entry, String exit,
                                  Integer amount, String vehicle) {
        return new MatchFields(date, time, normalize(entry), normalize(exit), amount, normalize(vehicle));
    }

    /** Trims, maps the ideographic space to ASCII and collapses whitespace runs. */
    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\u3000', ' ').trim().replaceAll("\\s+", " ");
    }

    LocalDateTime dateTime() {
        return date == null || time == null ? null : LocalDateTime.of(date, time);
    }

    boolean sameDate(MatchFields other) {
        return date != null && date.equals(other.date);
    }

    boolean sameTime(MatchFields other) {
        return Objects.equals(time, other.time);
    }

    boolean sameRoute(MatchFields other) {
        return entryPoint.equals(other.entryPoint) && exitPoint.equals(other.exitPoint);
    }

    boolean sameAmount(MatchFields other) {
        return amount != null && amount.equals(other.amount);
    }
}
