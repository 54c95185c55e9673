package io.github.riemr.fleet.application.dto;

import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;

import java.util.List;
import java.util.Map;

/**
 * @param siblingSlots  bump 先として検討する枠（同じ契約区分・曜日のものが対象）
 * @param takenSlots    slotKey -> 既に確保しているドライバー
 * @param distributions slotKey -> 分布
 */
public record BumpContext(List<Slot> siblingSlots, Map<String, String> takenSlots,
                          Map<String, SlotDistribution> distributions) {

    public SlotDistribution distributionOf(String slotKey) {
        var d = distributions.get(slotKey);
        return d == null ? SlotDistribution.unknown(slotKey) : d;
    }
}
