package io.github.riemr.fleet.oracle;

import io.github.riemr.fleet.application.service.PlanningPass;
import io.github.riemr.fleet.domain.model.ContractClass;
import io.github.riemr.fleet.domain.model.SlotClassification;
import io.github.riemr.fleet.domain.model.Slot;
import io.github.riemr.fleet.domain.model.SlotDistribution;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OracleGatewayTest {

    private static final LocalDate THURSDAY = LocalDate.of(2025, 6, 12);

    @Mock
    ScoringOracle oracle;

    private ExecutorService executor;
    private OracleGateway gateway;
    private PlanningPass pass;

    private static Slot slot(String id, String resource) {
        return Slot.builder().slotId(id).contractClass(ContractClass.CLASS_A).resourceId(resource)
                .canonicalStartTime(LocalTime.of(16, 30)).dayOfWeek(DayOfWeek.THURSDAY).serviceDate(THURSDAY).build();
    }

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        gateway = new OracleGateway(oracle, executor, "300ms", 2);
        pass = new PlanningPass("test-pass");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void failedCall_fallsBackToUnknownDistribution() {
        var ok = slot("S1", "T-1");
        var broken = slot("S2", "T-2");
        when(oracle.distribution(ok)).thenReturn(SlotDistribution.fromCounts(ok.slotKey(), Map.of("D1", 9, "D2", 1)));
        when(oracle.distribution(broken)).thenThrow(new OracleException("model crashed"));

        var out = gateway.distributions(List.of(ok, broken), pass);

        assertThat(out.get(ok.slotKey()).getClassification()).isEqualTo(SlotClassification.OWNED);
        assertThat(out.get(broken.slotKey()).getClassification()).isEqualTo(SlotClassification.UNKNOWN);
        assertThat(pass.getOracleFallbacks()).isEqualTo(1);
    }

    @Test
    void slowCall_timesOutToNeutralAvailability() {
        when(oracle.availability(eq("D1"), eq(THURSDAY), anyList())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return 0.9;
        });
        when(oracle.availability(eq("D2"), eq(THURSDAY), anyList())).thenReturn(0.2);

        var out = gateway.availability(List.of(new OracleGateway.AvailabilityKey("D1", THURSDAY),
                new OracleGateway.AvailabilityKey("D2", THURSDAY)), Map.of(), pass);

        assertThat(out.get(new OracleGateway.AvailabilityKey("D1", THURSDAY))).isEqualTo(0.5);
        assertThat(out.get(new OracleGateway.AvailabilityKey("D2", THURSDAY))).isEqualTo(0.2);
        assertThat(pass.getOracleFallbacks()).isEqualTo(1);
    }

    @Test
    void duplicateSlotKeys_areQueriedOnce() {
        var a = slot("S1", "T-1");
        var sameKey = slot("S9", "T-1");
        when(oracle.predictOwner(any())).thenReturn(new OwnershipPrediction("D1", 0.8));

        var out = gateway.owners(List.of(a, sameKey), pass);

        assertThat(out).hasSize(1);
        assertThat(out.get(a.slotKey()).ownerId()).isEqualTo("D1");
        verify(oracle, times(1)).predictOwner(any());
    }

    @Test
    void failedPattern_usesFallbackCap() {
        when(oracle.pattern("D1")).thenThrow(new OracleException("no data"));
        when(oracle.pattern("D2")).thenReturn(new DriverPattern("D2", 5, 0.9));

        var out = gateway.patterns(List.of("D1", "D2"), pass);

        assertThat(out.get("D1").typicalDaysPerWeek()).isEqualTo(6);
        assertThat(out.get("D2").typicalDaysPerWeek()).isEqualTo(5);
    }

    @Test
    void failedBackupRanking_isEmpty() {
        var s = slot("S1", "T-1");
        when(oracle.rankBackups(eq(s), anyList(), eq("D1"))).thenThrow(new OracleException("rank failed"));

        assertThat(gateway.rankBackups(s, List.of("D2", "D3"), "D1", pass)).isEmpty();
        assertThat(pass.getOracleFallbacks()).isEqualTo(1);
    }
}
