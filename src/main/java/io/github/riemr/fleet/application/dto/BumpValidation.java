package io.github.riemr.fleet.application.dto;

/**
 * 実開始時刻と正規開始時刻の差（bump）の判定結果。
 */
public record BumpValidation(boolean valid, int bumpMinutes, double bumpHours, boolean withinTolerance,
                             boolean requiresReview, String reason, int toleranceMinutes) {
}
