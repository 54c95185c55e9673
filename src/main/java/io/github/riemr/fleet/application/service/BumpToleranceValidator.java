package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.dto.BumpValidation;
import io.github.riemr.fleet.application.util.ClockTimeUtils;
import io.github.riemr.fleet.domain.model.HistoryEntry;
import io.github.riemr.fleet.domain.model.PatternGroup;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * bump 許容幅の判定。通常 ±2 時間、連続勤務の最終日は ±3 時間。
 * 同じパターン群の履歴が無く、他方の群の履歴だけがある場合は要確認とする。
 */
@Service
public class BumpToleranceValidator {

    public static final int STANDARD_TOLERANCE_HOURS = 2;
    public static final int LAST_DAY_TOLERANCE_HOURS = 3;

    public BumpValidation validate(LocalDateTime actualStart, LocalDateTime canonicalStart, PatternGroup patternGroup,
                                   List<HistoryEntry> driverHistory, boolean lastDay) {
        if (canonicalStart == null || patternGroup == null) {
            return new BumpValidation(false, 0, 0.0, false, true,
                    "Block missing pattern metadata (canonical start or pattern group)", 0);
        }
        int bumpMinutes = (int) Duration.between(canonicalStart, actualStart).toMinutes();
        double bumpHours = ClockTimeUtils.round(bumpMinutes / 60.0, 1);
        int toleranceHours = lastDay ? LAST_DAY_TOLERANCE_HOURS : STANDARD_TOLERANCE_HOURS;
        int toleranceMinutes = toleranceHours * 60;
        boolean within = Math.abs(bumpMinutes) <= toleranceMinutes;

        List<HistoryEntry> history = driverHistory == null ? List.of() : driverHistory;
        boolean samePattern = history.stream().anyMatch(h -> h.getPatternGroup() == patternGroup);
        boolean crossPattern = history.stream()
                .map(HistoryEntry::getPatternGroup)
                .filter(Objects::nonNull)
                .anyMatch(g -> g != patternGroup);

        boolean requiresReview = false;
        String reason;
        if (!within) {
            requiresReview = true;
            reason = String.format("Bump of %.1fh exceeds ±%dh tolerance", bumpMinutes / 60.0, toleranceHours);
        } else if (!samePattern && crossPattern) {
            requiresReview = true;
            reason = "Cross-pattern assignment (driver worked " + patternGroup.other() + " pattern, block is "
                    + patternGroup + ")";
        } else if (bumpMinutes != 0) {
            reason = String.format("Bump of %s%.1fh within ±%dh tolerance", bumpMinutes > 0 ? "+" : "",
                    bumpMinutes / 60.0, toleranceHours);
        } else {
            reason = "Exact match - no bump";
        }
        boolean valid = within && (!crossPattern || samePattern);
        return new BumpValidation(valid, bumpMinutes, bumpHours, within, requiresReview, reason, toleranceMinutes);
    }
}
