package io.github.riemr.fleet.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 過去の割当 1 件。serviceDate が無いもの（日付不明）も保持しうる。
 */
@Value
@Builder
public class HistoryEntry {
    String driverId;
    LocalDate serviceDate;
    String slotKey;
    ContractClass contractClass;
    LocalTime startTime;
    PatternGroup patternGroup;
}
