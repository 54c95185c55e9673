package io.github.riemr.fleet.domain.model;

public enum ValidationStatus {
    VALID,
    WARNING,
    VIOLATION;

    public ValidationStatus worst(ValidationStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
