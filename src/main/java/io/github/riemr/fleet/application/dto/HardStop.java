package io.github.riemr.fleet.application.dto;

import java.util.List;

/**
 * 保護ルール違反による割当拒否。
 */
public record HardStop(String slotId, String driverId, List<String> reasons) {
}
