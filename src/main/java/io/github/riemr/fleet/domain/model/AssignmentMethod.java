package io.github.riemr.fleet.domain.model;

public enum AssignmentMethod {
    DIRECT,
    BUMPED,
    FALLBACK
}
