package io.github.riemr.fleet.application.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 設定値の期間表記を寛容に解釈する。ISO-8601（PT30S）と 500ms / 30s / 2m / 1h / 数値（秒）を受け付ける。
 */
@Slf4j
public final class DurationParser {
    private DurationParser() {}

    public static Duration parseTolerant(String raw, Duration def) {
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim();
        try {
            if (s.startsWith("P")) {
                if (s.matches("^PT\\d+$")) s = s + "S"; // fix common mistake
                return Duration.parse(s);
            }
            String ls = s.toLowerCase();
            if (ls.endsWith("ms")) return Duration.ofMillis(Long.parseLong(ls.substring(0, ls.length() - 2)));
            if (ls.endsWith("s")) return Duration.ofSeconds(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.endsWith("m")) return Duration.ofMinutes(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.endsWith("h")) return Duration.ofHours(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.matches("^\\d+$")) return Duration.ofSeconds(Long.parseLong(ls));
        } catch (RuntimeException e) {
            log.warn("Invalid duration '{}', using default {}", raw, def);
            return def;
        }
        log.warn("Unrecognized duration '{}', using default {}", raw, def);
        return def;
    }
}
