package io.github.riemr.fleet.oracle;

/**
 * 枠の所有者予測。ownerId が null の場合は所有者なし。
 */
public record OwnershipPrediction(String ownerId, double confidence) {

    public static OwnershipPrediction none() {
        return new OwnershipPrediction(null, 0.0);
    }
}
