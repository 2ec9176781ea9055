package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(name = "routing_decision_records", indexes = {
        @Index(name = "idx_routing_records_incident", columnList = "org_id,incident_id")
})
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoutingDecisionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "decision_id", length = 120, nullable = false, unique = true)
    private String decisionId;

    @Column(name = "org_id", length = 120, nullable = false)
    private String orgId;

    @Column(name = "incident_id", length = 120, nullable = false)
    private String incidentId;

    @Column(name = "outcome", length = 40, nullable = false)
    private String outcome; // ROUTED, AUTO_RESOLVED, MANUAL_TRIAGE

    @Column(name = "estimated_impact", nullable = false)
    private Double estimatedImpact;

    @Column(name = "exception_applied", nullable = false)
    private Boolean exceptionApplied;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "decision_json", nullable = false)
    private JsonNode decisionJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
