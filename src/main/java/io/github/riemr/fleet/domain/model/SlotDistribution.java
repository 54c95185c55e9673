package io.github.riemr.fleet.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * スロットの過去担当者の分布。
 * 最多担当者のシェアが {@link #OWNERSHIP_THRESHOLD} 以上なら OWNED、未満なら ROTATING。
 * 観測が無い場合は UNKNOWN。
 */
@Value
@Builder
public class SlotDistribution {

    public static final double OWNERSHIP_THRESHOLD = 0.70;

    String slotKey;
    SlotClassification classification;
    String ownerId;
    double ownerShare;
    @Singular("share")
    Map<String, Double> shares;
    int totalObservations;

    public double shareOf(String driverId) {
        Double v = shares.get(driverId);
        return v == null ? 0.0 : v;
    }

    public boolean isOwnedBy(String driverId) {
        return classification == SlotClassification.OWNED && ownerId != null && ownerId.equals(driverId);
    }

    public static SlotDistribution unknown(String slotKey) {
        return SlotDistribution.builder()
                .slotKey(slotKey)
                .classification(SlotClassification.UNKNOWN)
                .ownerShare(0.0)
                .totalObservations(0)
                .build();
    }

    /**
     * 担当回数から分布を組み立てる。同数の場合は driverId の昇順で先頭を最多担当者とする。
     */
    public static SlotDistribution fromCounts(String slotKey, Map<String, Integer> counts) {
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (total <= 0) return unknown(slotKey);
        var builder = SlotDistribution.builder().slotKey(slotKey).totalObservations(total);
        String top = null;
        int topCount = -1;
        for (var e : new java.util.TreeMap<>(counts).entrySet()) {
            builder.share(e.getKey(), e.getValue() / (double) total);
            if (e.getValue() > topCount) {
                top = e.getKey();
                topCount = e.getValue();
            }
        }
        double topShare = topCount / (double) total;
        return builder
                .ownerId(topShare >= OWNERSHIP_THRESHOLD ? top : null)
                .ownerShare(topShare)
                .classification(topShare >= OWNERSHIP_THRESHOLD ? SlotClassification.OWNED : SlotClassification.ROTATING)
                .build();
    }
}
