package io.github.riemr.fleet.domain.model;

import lombok.Value;

@Value
public class FilterResult {
    boolean valid;
    ViolationKind kind;
    String reason;

    private static final FilterResult OK = new FilterResult(true, null, null);

    public static FilterResult ok() { return OK; }

    public static FilterResult reject(ViolationKind kind, String reason) {
        return new FilterResult(false, kind, reason);
    }
}
