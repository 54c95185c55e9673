package io.github.riemr.fleet.domain.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * コンプライアンス判定結果。valid は status != VIOLATION と等価。
 */
@Value
public class ValidationResult {
    boolean valid;
    ValidationStatus status;
    List<String> messages;
    Map<String, Double> metrics;

    public static ValidationResult of(ValidationStatus status, List<String> messages, Map<String, Double> metrics) {
        return new ValidationResult(status != ValidationStatus.VIOLATION, status,
                Collections.unmodifiableList(new ArrayList<>(messages)),
                Collections.unmodifiableMap(new LinkedHashMap<>(metrics)));
    }

    public static ValidationResult valid() {
        return of(ValidationStatus.VALID, List.of(), Map.of());
    }

    public static ValidationResult violation(String message) {
        return of(ValidationStatus.VIOLATION, List.of(message), Map.of());
    }

    /** 他の結果のメッセージを取り込み、より悪い status を採用する */
    public ValidationResult merge(ValidationResult other) {
        if (other == null) return this;
        var msgs = new ArrayList<>(messages);
        msgs.addAll(other.messages);
        var m = new LinkedHashMap<>(metrics);
        other.metrics.forEach(m::putIfAbsent);
        return of(status.worst(other.status), msgs, m);
    }
}
