package com.companya.crm.model.domain;

import com.companya.crm.model.IdentifierType;
import com.companya.crm.model.MatchConfidence;
import jakarta.persistence.*;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Append-only audit row: one observed email or phone and the match decision taken for it.
 * There are no setters; rows are written once and never updated.
 */
@Getter
@Entity
@Table(name = "CUSTOMER_IDENTIFIER", indexes = {
        @Index(name = "idx_identifier_customer", columnList = "customer_id"),
        @Index(name = "idx_identifier_normalized", columnList = "identifier_type, normalized_value")
})
public class CustomerIdentifier {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", length = 36, nullable = false)
    private String customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "identifier_type", length = 10, nullable = false)
    private IdentifierType identifierType;

    @Column(name = "raw_value")
    private String rawValue;

    @Column(name = "normalized_value", nullable = false)
    private String normalizedValue;

    @Column(name = "source", length = 64)
    private String source;

    @Column(name = "source_record_id")
    private String sourceRecordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_confidence", length = 10)
    private MatchConfidence matchConfidence;

    @Column(name = "match_reason", length = 64)
    private String matchReason;

    @Column(name = "observed_at")
    private LocalDateTime observedAt;

    @Column(name = "is_primary")
    private boolean primary;

    protected CustomerIdentifier() {
    }

    public CustomerIdentifier(String customerId, IdentifierType identifierType, String rawValue,
                              String normalizedValue, String source, String sourceRecordId,
                              MatchConfidence matchConfidence, String matchReason,
                              LocalDateTime observedAt, boolean primary) {
        this.customerId = customerId;
        this.identifierType = identifierType;
        this.rawValue = rawValue;
        this.normalizedValue = normalizedValue;
        this.source = source;
        this.sourceRecordId = sourceRecordId;
        this.matchConfidence = matchConfidence;
        this.matchReason = matchReason;
        this.observedAt = observedAt;
        this.primary = primary;
    }

    @Override
    public String toString() {
        return "CustomerIdentifier{" +
                "customerId='" + customerId + '\'' +
                ", identifierType=" + identifierType +
                ", normalizedValue='" + normalizedValue + '\'' +
                ", source='" + source + '\'' +
                ", matchConfidence=" + matchConfidence +
                ", matchReason='" + matchReason + '\'' +
                ", primary=" + primary +
                '}';
    }
}
