package io.github.riemr.fleet.domain.model;

public enum SlotClassification {
    OWNED,
    ROTATING,
    UNKNOWN
}
