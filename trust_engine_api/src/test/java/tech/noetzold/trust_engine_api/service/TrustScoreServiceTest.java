package tech.noetzold.trust_engine_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.noetzold.trust_engine_api.exception.ConfigurationException;
import tech.noetzold.trust_engine_api.exception.StaleSnapshotException;
import tech.noetzold.trust_engine_api.model.CanonicalCluster;
import tech.noetzold.trust_engine_api.model.ClusterMapping;
import tech.noetzold.trust_engine_api.model.ControlRef;
import tech.noetzold.trust_engine_api.model.CoverageReport;
import tech.noetzold.trust_engine_api.repository.ClusterMappingRepository;
import tech.noetzold.trust_engine_api.repository.EvidenceLedgerRepository;
import tech.noetzold.trust_engine_api.repository.OrganizationSettingsRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrustScoreServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Mock private ClusterMappingRepository mappingRepo;
    @Mock private EvidenceLedgerRepository ledger;
    @Mock private OrganizationSettingsRepository settingsRepo;

    private TrustScoreService service;

    @BeforeEach
    void setUp() {
        service = new TrustScoreService(mappingRepo, ledger, settingsRepo,
                new CoverageCalculator(new StalenessDecay(90, 0.5)), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ClusterMapping mapping(long version) {
        CanonicalCluster cluster = new CanonicalCluster("CC-0001",
                new TreeSet<>(List.of(ControlRef.parse("SOC2:CC6.1"))), "Encrypt data at rest", "crypto");
        return new ClusterMapping(version, 1, 0.8, List.of(cluster), NOW);
    }

    @Test
    void retriesWhenAMappingIsPublishedMidComputation() {
        when(mappingRepo.current()).thenReturn(mapping(1), mapping(2));

        CoverageReport report = service.getTrustScore("acme");

        assertThat(report.mappingVersion()).isEqualTo(2);
    }

    @Test
    void givesUpAfterThreeStaleSnapshots() {
        when(mappingRepo.current()).thenReturn(mapping(1), mapping(2), mapping(3), mapping(4), mapping(5), mapping(6), mapping(7));

        assertThatThrownBy(() -> service.getTrustScore("acme")).isInstanceOf(StaleSnapshotException.class);
    }

    @Test
    void pinnedVersionFailsOnceSuperseded() {
        when(mappingRepo.current()).thenReturn(mapping(2));

        StaleSnapshotException e = catchThrowableOfType(() -> service.getTrustScore("acme", 1), StaleSnapshotException.class);

        assertThat(e).isNotNull();
        assertThat(e.getRequestedVersion()).isEqualTo(1);
        assertThat(e.getCurrentVersion()).isEqualTo(2);
    }

    @Test
    void pinnedVersionIsServedWhileActive() {
        when(mappingRepo.current()).thenReturn(mapping(2));

        assertThat(service.getTrustScore("acme", 2).mappingVersion()).isEqualTo(2);
        verify(ledger).findLatestByOrg("acme");
    }

    @Test
    void weightsMustBeNonNegativeAndNotAllZero() {
        assertThatThrownBy(() -> service.updateFrameworkWeights("acme", Map.of("SOC2", -1.0)))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> service.updateFrameworkWeights("acme", Map.of("SOC2", 0.0, "GDPR", 0.0)))
                .isInstanceOf(ConfigurationException.class);
        verify(settingsRepo, never()).saveFrameworkWeights(any(), anyMap());
    }

    @Test
    void validWeightsAreStored() {
        when(settingsRepo.findFrameworkWeights("acme")).thenReturn(Map.of("SOC2", 2.0));

        assertThat(service.updateFrameworkWeights("acme", Map.of("SOC2", 2.0))).containsEntry("SOC2", 2.0);
        verify(settingsRepo).saveFrameworkWeights(eq("acme"), eq(Map.of("SOC2", 2.0)));
    }
}
