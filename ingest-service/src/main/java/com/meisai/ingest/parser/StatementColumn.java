package com.meisai.ingest.parser;

import java.util.List;

/** Column order of the ETC statement CSV export. */
public enum StatementColumn {
    USAGE_DATE_FROM,
    TIME_FROM,
    USAGE_DATE_TO,
    TIME_TO,
    ENTRY_IC,
    EXIT_IC,
    TOLL_STATION_NAME,
    TOLL_AMOUNT,
    USAGE_CATEGORY,
    VEHICLE_CLASS,
    VEHICLE_NUMBER,
    CARD_NUMBER,
    REMARKS;

    public static final int COUNT = values().length;

    public String cell(List<String> cells) {
        return ordinal() < cells.size() ? cells.get(ordinal()) : null;
    }
}
