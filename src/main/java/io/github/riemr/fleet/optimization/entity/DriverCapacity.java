package io.github.riemr.fleet.optimization.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class DriverCapacity {
    private String driverId;
    // 今週追加で割当可能な日数
    private int maxNewDays;
}
