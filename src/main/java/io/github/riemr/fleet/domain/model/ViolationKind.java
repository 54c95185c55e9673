package io.github.riemr.fleet.domain.model;

public enum ViolationKind {
    CONTRACT_MISMATCH,
    DAY_CAP,
    DOUBLE_BOOKING,
    REST,
    HOS,
    PROTECTED_RULE
}
