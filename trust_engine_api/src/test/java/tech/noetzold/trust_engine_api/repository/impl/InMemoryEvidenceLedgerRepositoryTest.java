package tech.noetzold.trust_engine_api.repository.impl;

import org.junit.jupiter.api.Test;
import tech.noetzold.trust_engine_api.model.ControlRef;
import tech.noetzold.trust_engine_api.model.EvidenceItem;
import tech.noetzold.trust_engine_api.model.EvidenceStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEvidenceLedgerRepositoryTest {

    private final InMemoryEvidenceLedgerRepository ledger = new InMemoryEvidenceLedgerRepository();

    private static EvidenceItem item(String id, String org) {
        return EvidenceItem.builder()
                .evidenceId(id)
                .orgId(org)
                .clusterId("CC-0001")
                .anchorControl(ControlRef.parse("SOC2:CC6.1"))
                .confidence(0.9)
                .contributionWeight(1.0)
                .status(EvidenceStatus.PENDING)
                .collectedAt(Instant.parse("2026-03-01T00:00:00Z"))
                .revision(1)
                .build();
    }

    @Test
    void appendRejectsDuplicateIds() {
        ledger.append(item("ev_1", "acme"));

        assertThatThrownBy(() -> ledger.append(item("ev_1", "acme"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void organizationsAreIsolated() {
        ledger.append(item("ev_1", "acme"));
        ledger.append(item("ev_2", "globex"));

        assertThat(ledger.findLatestByOrg("acme")).extracting(EvidenceItem::evidenceId).containsExactly("ev_1");
        assertThat(ledger.findLatest("globex", "ev_1")).isEmpty();
    }

    @Test
    void compareAndSetFailsOnAStaleExpectation() {
        EvidenceItem original = ledger.append(item("ev_1", "acme"));
        EvidenceItem verified = original.withStatus(EvidenceStatus.VERIFIED);

        assertThat(ledger.compareAndSet("acme", "ev_1", original, verified)).isTrue();
        assertThat(ledger.compareAndSet("acme", "ev_1", original, original.withStatus(EvidenceStatus.REJECTED))).isFalse();
        assertThat(ledger.history("acme", "ev_1")).containsExactly(original, verified);
    }

    @Test
    void onlyOneConcurrentTransitionWins() throws Exception {
        EvidenceItem original = ledger.append(item("ev_1", "acme"));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                EvidenceStatus next = i % 2 == 0 ? EvidenceStatus.VERIFIED : EvidenceStatus.REJECTED;
                calls.add(() -> ledger.compareAndSet("acme", "ev_1", original, original.withStatus(next)));
            }
            int wins = 0;
            for (Future<Boolean> f : pool.invokeAll(calls)) {
                if (f.get()) wins++;
            }

            assertThat(wins).isEqualTo(1);
            assertThat(ledger.history("acme", "ev_1")).hasSize(2);
        } finally {
            pool.shutdownNow();
        }
    }
}
