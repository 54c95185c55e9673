package io.github.riemr.fleet.application.service;

import io.github.riemr.fleet.application.dto.BumpContext;
import io.github.riemr.fleet.application.dto.ScoredSlot;
import io.github.riemr.fleet.domain.model.AssignmentMethod;
import io.github.riemr.fleet.domain.model.ContractClass;
import io.github.riemr.fleet.domain.model.DriverScore;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BumpResolverTest {

    private static final LocalDate THURSDAY = LocalDate.of(2025, 6, 12);

    private final BumpResolver resolver = new BumpResolver();

    private static Slot slot(String id, String resource, LocalTime start) {
        return Slot.builder().slotId(id).contractClass(ContractClass.CLASS_A).resourceId(resource)
                .canonicalStartTime(start).dayOfWeek(DayOfWeek.THURSDAY).serviceDate(THURSDAY).build();
    }

    private static DriverScore direct(String driverId, double score) {
        return DriverScore.builder().driverId(driverId).score(score).method(AssignmentMethod.DIRECT).reason("base").build();
    }

    private static final Slot HOME = slot("B-1", "T-1", LocalTime.of(16, 30));
    private static final Slot SIBLING = slot("B-2", "T-2", LocalTime.of(18, 30));
    private static final SlotDistribution HOME_DIST =
            SlotDistribution.fromCounts(HOME.slotKey(), Map.of("X", 8, "Y", 1, "Z", 1));

    private static ScoredSlot scored() {
        return new ScoredSlot(HOME, HOME_DIST, List.of(direct("X", 0.774), direct("Y", 0.5), direct("Z", 0.27)), null);
    }

    private static DriverScore find(List<DriverScore> scores, String driverId) {
        return scores.stream().filter(s -> s.getDriverId().equals(driverId)).findFirst().orElseThrow();
    }

    @Test
    void openSlot_returnsCandidatesUnchanged() {
        var ctx = new BumpContext(List.of(HOME, SIBLING), Map.of(), Map.of());
        var s = scored();
        assertThat(resolver.resolve(s, ctx, 2)).isSameAs(s.candidates());
    }

    @Test
    void ownerOfTakenSlot_isBumpedToNearestOpenSlot() {
        var ctx = new BumpContext(List.of(HOME, SIBLING), Map.of(HOME.slotKey(), "Y"),
                Map.of(HOME.slotKey(), HOME_DIST));

        var out = resolver.resolve(scored(), ctx, 2);

        assertThat(out).extracting(DriverScore::getDriverId).containsExactly("X", "Z");
        var x = find(out, "X");
        assertThat(x.getMethod()).isEqualTo(AssignmentMethod.BUMPED);
        assertThat(x.getBumpMinutes()).isEqualTo(120);
        assertThat(x.getBumpPenalty()).isCloseTo(0.2, within(1e-9));
        assertThat(x.getScore()).isCloseTo(0.574, within(1e-9));
        assertThat(x.getBumpTargetSlotKey()).isEqualTo(SIBLING.slotKey());
        assertThat(x.getReason()).isEqualTo("Bumped +120min to 18:30");

        var z = find(out, "Z");
        assertThat(z.getMethod()).isEqualTo(AssignmentMethod.FALLBACK);
        assertThat(z.getScore()).isCloseTo(0.135, within(1e-9));
        assertThat(z.getReason()).isEqualTo("Non-owner, slot taken");
    }

    @Test
    void bumpIntoSomeoneElsesOwnedSlot_addsConflictPenalty() {
        var siblingDist = SlotDistribution.fromCounts(SIBLING.slotKey(), Map.of("W", 9, "X", 1));
        var ctx = new BumpContext(List.of(HOME, SIBLING), Map.of(HOME.slotKey(), "Y"),
                Map.of(HOME.slotKey(), HOME_DIST, SIBLING.slotKey(), siblingDist));

        var x = find(resolver.resolve(scored(), ctx, 2), "X");

        assertThat(x.getScore()).isCloseTo(0.374, within(1e-9));
        assertThat(x.getReason()).isEqualTo("Bumped +120min to 18:30 (conflicts with W's slot)");
    }

    @Test
    void rotatingTarget_isAnnotated() {
        var siblingDist = SlotDistribution.fromCounts(SIBLING.slotKey(), Map.of("W", 5, "V", 5));
        var ctx = new BumpContext(List.of(HOME, SIBLING), Map.of(HOME.slotKey(), "Y"),
                Map.of(HOME.slotKey(), HOME_DIST, SIBLING.slotKey(), siblingDist));

        var x = find(resolver.resolve(scored(), ctx, 2), "X");

        assertThat(x.getScore()).isCloseTo(0.574, within(1e-9));
        assertThat(x.getReason()).endsWith("(rotating slot)");
    }

    @Test
    void noOpenSibling_fallsBack() {
        var ctx = new BumpContext(List.of(HOME, SIBLING), Map.of(HOME.slotKey(), "Y", SIBLING.slotKey(), "W"),
                Map.of(HOME.slotKey(), HOME_DIST));

        var x = find(resolver.resolve(scored(), ctx, 2), "X");

        assertThat(x.getMethod()).isEqualTo(AssignmentMethod.FALLBACK);
        assertThat(x.getScore()).isCloseTo(0.774 * 0.3, within(1e-9));
        assertThat(x.getBumpPenalty()).isEqualTo(0.7);
        assertThat(x.getReason()).isEqualTo("No bump slots available within ±2h");
    }

    @Test
    void siblingOutsideFlexibility_isNotConsidered() {
        var ctx = new BumpContext(List.of(HOME, SIBLING), Map.of(HOME.slotKey(), "Y"), Map.of(HOME.slotKey(), HOME_DIST));
        var x = find(resolver.resolve(scored(), ctx, 1), "X");
        assertThat(x.getMethod()).isEqualTo(AssignmentMethod.FALLBACK);
        assertThat(x.getReason()).isEqualTo("No bump slots available within ±1h");
    }

    @Test
    void zeroFlexibility_treatsOwnerAsFallback() {
        var ctx = new BumpContext(List.of(HOME, SIBLING), Map.of(HOME.slotKey(), "Y"), Map.of(HOME.slotKey(), HOME_DIST));
        var x = find(resolver.resolve(scored(), ctx, 0), "X");
        assertThat(x.getMethod()).isEqualTo(AssignmentMethod.FALLBACK);
        assertThat(x.getScore()).isCloseTo(0.387, within(1e-9));
    }

    @Test
    void findCandidates_wrapsAroundMidnight() {
        var late = slot("B-3", "T-1", LocalTime.of(23, 30));
        var early = slot("B-4", "T-2", LocalTime.of(0, 30));
        var otherDay = early.toBuilder().slotId("B-5").dayOfWeek(DayOfWeek.FRIDAY).build();
        var classB = early.toBuilder().slotId("B-6").contractClass(ContractClass.CLASS_B).build();
        var ctx = new BumpContext(List.of(late, early, otherDay, classB), Map.of(late.slotKey(), "Y"), Map.of());

        var candidates = resolver.findCandidates(late, "X", 2, ctx);

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).offsetMinutes()).isEqualTo(60);
        assertThat(candidates.get(0).distancePenalty()).isCloseTo(0.1, within(1e-9));
        assertThat(candidates.get(0).open()).isTrue();
    }

    @Test
    void findCandidates_prefersOpenSlotsThenLowerPenalty() {
        var near = slot("B-7", "T-3", LocalTime.of(17, 30));
        var far = slot("B-8", "T-4", LocalTime.of(15, 0));
        var ctx = new BumpContext(List.of(HOME, near, SIBLING, far),
                Map.of(HOME.slotKey(), "Y", near.slotKey(), "W"), Map.of());

        var candidates = resolver.findCandidates(HOME, "X", 2, ctx);

        // far: -90 分 (0.15)、SIBLING: +120 分 (0.2)、near は確保済み
        assertThat(candidates).extracting(c -> c.slot().getSlotId()).containsExactly("B-8", "B-2", "B-7");
    }
}
