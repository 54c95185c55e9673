package io.github.riemr.fleet.domain.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * ドライバーの今週の稼働状況。割当が確定するたびに {@link #accept(ShiftWindow)} で更新する。
 */
@Getter
public class DriverConstraints {
    private final String driverId;
    private final ContractClass contractClass;
    private final Integer typicalDaysPerWeek;
    private final Set<LocalDate> daysAssignedThisWeek;
    private final List<ShiftWindow> shiftsThisWeek;

    public DriverConstraints(String driverId, ContractClass contractClass, Integer typicalDaysPerWeek,
                             List<ShiftWindow> shiftsThisWeek) {
        this.driverId = driverId;
        this.contractClass = contractClass;
        this.typicalDaysPerWeek = typicalDaysPerWeek;
        this.shiftsThisWeek = new ArrayList<>(shiftsThisWeek == null ? List.of() : shiftsThisWeek);
        this.daysAssignedThisWeek = new TreeSet<>();
        for (var s : this.shiftsThisWeek) daysAssignedThisWeek.add(s.getDate());
    }

    public Set<LocalDate> getDaysAssignedThisWeek() {
        return Collections.unmodifiableSet(daysAssignedThisWeek);
    }

    public List<ShiftWindow> getShiftsThisWeek() {
        return Collections.unmodifiableList(shiftsThisWeek);
    }

    public void accept(ShiftWindow shift) {
        shiftsThisWeek.add(shift);
        daysAssignedThisWeek.add(shift.getDate());
    }

    public DriverConstraints copy() {
        return new DriverConstraints(driverId, contractClass, typicalDaysPerWeek, shiftsThisWeek);
    }
}
