package tech.noetzold.trust_engine_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.noetzold.trust_engine_api.exception.StatusConflictException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.*;
import tech.noetzold.trust_engine_api.repository.impl.InMemoryClusterMappingRepository;
import tech.noetzold.trust_engine_api.repository.impl.InMemoryControlCatalogRepository;
import tech.noetzold.trust_engine_api.repository.impl.InMemoryEvidenceLedgerRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvidenceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private InMemoryEvidenceLedgerRepository ledger;
    private EvidenceService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        InMemoryClusterMappingRepository mappingRepo = new InMemoryClusterMappingRepository();
        new CatalogService(new InMemoryControlCatalogRepository(), mappingRepo,
                new ControlNormalizer(new DescriptionCanonicalizer()), clock, 0.8)
                .importCatalog(new CatalogImportRequest(CatalogServiceTest.CATALOG, null, null));

        ledger = new InMemoryEvidenceLedgerRepository();
        service = new EvidenceService(ledger, mappingRepo, clock, List.of("aws-config"), 0.9);
    }

    private static EvidenceIngestRequest byControl(String ref, double confidence, String source) {
        return new EvidenceIngestRequest(null, ref, confidence, null, source, null);
    }

    @Nested
    @DisplayName("ingest")
    class Ingest {

        @Test
        void rawControlResolvesToItsCluster() {
            EvidenceItem item = service.ingest("acme", byControl("GDPR:Art32", 0.9, "auditor"));

            assertThat(item.clusterId()).isEqualTo("CC-0001");
            assertThat(item.anchorControl()).isEqualTo(ControlRef.parse("GDPR:Art32"));
            assertThat(item.status()).isEqualTo(EvidenceStatus.PENDING);
            assertThat(item.collectedAt()).isEqualTo(NOW);
            assertThat(item.contributionWeight()).isEqualTo(1.0);
            assertThat(item.evidenceId()).startsWith("ev_");
        }

        @Test
        void clusterIdIsAnchoredOnItsFirstMember() {
            EvidenceItem item = service.ingest("acme",
                    new EvidenceIngestRequest("CC-0001", null, 0.7, null, null, 0.5));

            assertThat(item.anchorControl()).isEqualTo(ControlRef.parse("GDPR:Art32"));
            assertThat(item.sourceSystem()).isEqualTo("manual");
        }

        @Test
        void trustedSourceWithHighConfidenceIsAutoApproved() {
            assertThat(service.ingest("acme", byControl("SOC2:CC6.1", 0.95, "AWS-Config")).status())
                    .isEqualTo(EvidenceStatus.AUTO_APPROVED);
            assertThat(service.ingest("acme", byControl("SOC2:CC6.1", 0.85, "aws-config")).status())
                    .isEqualTo(EvidenceStatus.PENDING);
        }

        @Test
        void unknownReferencesAreRejected() {
            assertThatThrownBy(() -> service.ingest("acme", byControl("PCI:3.4", 0.9, null)))
                    .isInstanceOf(UnknownReferenceException.class);
            assertThatThrownBy(() -> service.ingest("acme", new EvidenceIngestRequest("CC-0404", null, 0.9, null, null, null)))
                    .isInstanceOf(UnknownReferenceException.class);
        }

        @Test
        void missingReferenceOrBadRangeIsInvalid() {
            assertThatThrownBy(() -> service.ingest("acme", new EvidenceIngestRequest(null, null, 0.9, null, null, null)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.ingest("acme", byControl("SOC2:CC6.1", 1.2, null)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.ingest("acme", new EvidenceIngestRequest("CC-0001", null, 0.9, null, null, 0.0)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("status transitions")
    class Transitions {

        @Test
        void verifyingKeepsTheHistory() {
            EvidenceItem item = service.ingest("acme", byControl("SOC2:CC6.1", 0.9, null));

            EvidenceItem verified = service.transition("acme", item.evidenceId(), EvidenceStatus.PENDING, EvidenceStatus.VERIFIED);

            assertThat(verified.revision()).isEqualTo(2);
            assertThat(service.history("acme", item.evidenceId()))
                    .extracting(EvidenceItem::status)
                    .containsExactly(EvidenceStatus.PENDING, EvidenceStatus.VERIFIED);
            assertThat(service.currentEvidence("acme")).containsExactly(verified);
        }

        @Test
        void staleExpectedStatusConflicts() {
            EvidenceItem item = service.ingest("acme", byControl("SOC2:CC6.1", 0.9, null));
            service.transition("acme", item.evidenceId(), EvidenceStatus.PENDING, EvidenceStatus.VERIFIED);

            assertThatThrownBy(() -> service.transition("acme", item.evidenceId(), EvidenceStatus.PENDING, EvidenceStatus.REJECTED))
                    .isInstanceOf(StatusConflictException.class);
        }

        @Test
        void rejectedIsTerminal() {
            EvidenceItem item = service.ingest("acme", byControl("SOC2:CC6.1", 0.9, null));
            service.transition("acme", item.evidenceId(), EvidenceStatus.PENDING, EvidenceStatus.REJECTED);

            assertThatThrownBy(() -> service.transition("acme", item.evidenceId(), EvidenceStatus.REJECTED, EvidenceStatus.VERIFIED))
                    .isInstanceOf(StatusConflictException.class);
        }

        @Test
        void evidenceIsScopedToItsOrganization() {
            EvidenceItem item = service.ingest("acme", byControl("SOC2:CC6.1", 0.9, null));

            assertThatThrownBy(() -> service.transition("globex", item.evidenceId(), EvidenceStatus.PENDING, EvidenceStatus.VERIFIED))
                    .isInstanceOf(UnknownReferenceException.class);
            assertThatThrownBy(() -> service.history("globex", item.evidenceId()))
                    .isInstanceOf(UnknownReferenceException.class);
        }
    }
}
