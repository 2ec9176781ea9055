package tech.noetzold.trust_engine_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.noetzold.trust_engine_api.exception.ConfigurationException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.RiskAppetiteThreshold;
import tech.noetzold.trust_engine_api.model.ThresholdRequest;
import tech.noetzold.trust_engine_api.repository.impl.InMemoryThresholdRepository;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tech.noetzold.trust_engine_api.model.StakeholderRole.*;

class ThresholdServiceTest {

    private InMemoryThresholdRepository repo;
    private ThresholdService service;

    @BeforeEach
    void setUp() {
        repo = new InMemoryThresholdRepository();
        service = new ThresholdService(repo);
    }

    private static List<ThresholdRequest> standardBands() {
        return List.of(
                new ThresholdRequest(2_000_000.0, null, List.of(CEO, CISO), 60),
                new ThresholdRequest(0.0, 500_000.0, List.of(AUTO_RESOLVED), 0),
                new ThresholdRequest(500_000.0, 2_000_000.0, List.of(SECURITY_TEAM), 240));
    }

    @Nested
    @DisplayName("accepted configurations")
    class Accepted {

        @Test
        void storesBandsOrderedByMinimum() {
            List<RiskAppetiteThreshold> stored = service.replaceAll("acme", standardBands());

            assertThat(stored).extracting(RiskAppetiteThreshold::minImpact).containsExactly(0.0, 500_000.0, 2_000_000.0);
            assertThat(stored).extracting(RiskAppetiteThreshold::thresholdId).allMatch(id -> id.startsWith("TH-"));
            assertThat(repo.findByOrg("acme")).isEqualTo(stored);
        }

        @Test
        void bandsGivenOnlyByMinimumEndWhereTheNextBegins() {
            List<RiskAppetiteThreshold> stored = service.replaceAll("acme", List.of(
                    new ThresholdRequest(2_000_000.0, null, List.of(CEO, CISO), 60),
                    new ThresholdRequest(500_000.0, null, List.of(SECURITY_TEAM), 240),
                    new ThresholdRequest(0.0, null, List.of(AUTO_RESOLVED), 0)));

            assertThat(stored).extracting(RiskAppetiteThreshold::maxImpact)
                    .containsExactly(500_000.0, 2_000_000.0, null);
            assertThat(stored).filteredOn(t -> t.contains(2_800_000.0))
                    .singleElement()
                    .extracting(RiskAppetiteThreshold::route)
                    .isEqualTo(List.of(CEO, CISO));
            assertThat(stored).filteredOn(t -> t.contains(499_999.0))
                    .singleElement()
                    .extracting(RiskAppetiteThreshold::route)
                    .isEqualTo(List.of(AUTO_RESOLVED));
        }

        @Test
        void addingABandAboveTheOpenTopClosesItAtTheNewMinimum() {
            service.replaceAll("acme", List.of(
                    new ThresholdRequest(0.0, 500_000.0, List.of(AUTO_RESOLVED), 0),
                    new ThresholdRequest(500_000.0, null, List.of(SECURITY_TEAM), 240)));

            List<RiskAppetiteThreshold> stored =
                    service.add("acme", new ThresholdRequest(2_000_000.0, null, List.of(CEO), 60));

            assertThat(stored).extracting(RiskAppetiteThreshold::maxImpact)
                    .containsExactly(500_000.0, 2_000_000.0, null);
        }

        @Test
        void addingABandInsideAClosedBandIsRejected() {
            service.replaceAll("acme", standardBands());

            assertThatThrownBy(() -> service.add("acme", new ThresholdRequest(1_000_000.0, null, List.of(CISO), 60)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("overlap");
            assertThat(service.list("acme")).hasSize(3);
        }

        @Test
        void deletingAnUnknownBandIsAnUnknownReference() {
            service.replaceAll("acme", standardBands());

            assertThatThrownBy(() -> service.delete("acme", "TH-9999"))
                    .isInstanceOf(UnknownReferenceException.class);
        }
    }

    @Nested
    @DisplayName("rejected configurations")
    class Rejected {

        @Test
        void overlappingBands() {
            List<ThresholdRequest> bands = List.of(
                    new ThresholdRequest(0.0, 600_000.0, List.of(AUTO_RESOLVED), 0),
                    new ThresholdRequest(500_000.0, null, List.of(CISO), 60));

            assertThatThrownBy(() -> service.replaceAll("acme", bands))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("overlap");
        }

        @Test
        void twoBandsWithTheSameMinimum() {
            List<ThresholdRequest> bands = List.of(
                    new ThresholdRequest(0.0, null, List.of(AUTO_RESOLVED), 0),
                    new ThresholdRequest(0.0, null, List.of(CISO), 60));

            assertThatThrownBy(() -> service.replaceAll("acme", bands))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("overlap");
        }

        @Test
        void gapBetweenBands() {
            List<ThresholdRequest> bands = List.of(
                    new ThresholdRequest(0.0, 400_000.0, List.of(AUTO_RESOLVED), 0),
                    new ThresholdRequest(500_000.0, null, List.of(CISO), 60));

            assertThatThrownBy(() -> service.replaceAll("acme", bands))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Gap");
        }

        @Test
        void boundedTopBand() {
            List<ThresholdRequest> bands = List.of(new ThresholdRequest(0.0, 1_000_000.0, List.of(CISO), 60));

            assertThatThrownBy(() -> service.replaceAll("acme", bands)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void maxNotAboveMin() {
            List<ThresholdRequest> bands = List.of(new ThresholdRequest(100.0, 100.0, List.of(CISO), 60));

            assertThatThrownBy(() -> service.replaceAll("acme", bands)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void negativeSla() {
            List<ThresholdRequest> bands = List.of(new ThresholdRequest(0.0, null, List.of(CISO), -1));

            assertThatThrownBy(() -> service.replaceAll("acme", bands)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void autoResolvedMixedWithPeople() {
            List<ThresholdRequest> bands = List.of(new ThresholdRequest(0.0, null, List.of(AUTO_RESOLVED, CISO), 0));

            assertThatThrownBy(() -> service.replaceAll("acme", bands)).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void emptyList() {
            assertThatThrownBy(() -> service.replaceAll("acme", List.of())).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void rejectedWriteKeepsThePreviousBands() {
            List<RiskAppetiteThreshold> stored = service.replaceAll("acme", standardBands());

            assertThatThrownBy(() -> service.replaceAll("acme", List.of(
                    new ThresholdRequest(0.0, 10.0, List.of(CISO), 5))))
                    .isInstanceOf(ConfigurationException.class);
            assertThat(service.list("acme")).isEqualTo(stored);
        }
    }
}
