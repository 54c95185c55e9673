package io.github.riemr.fleet.oracle;

public record RankedDriver(String driverId, double score) {
}
