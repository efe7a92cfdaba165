package com.companya.crm.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * The moment a customer first qualified for an A/B experiment, and in which group.
 */
@Getter
@Setter
@Entity
@Table(name = "EXPERIMENT_ENTRY", uniqueConstraints = {
        @UniqueConstraint(name = "uk_experiment_customer", columnNames = {"customer_id", "experiment_id"})
})
public class ExperimentEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", length = 64, nullable = false)
    private String customerId;

    @Column(name = "experiment_id", length = 100, nullable = false)
    private String experimentId;

    @Column(name = "ab_group", length = 10)
    private String abGroup;

    @Column(name = "entry_flag", length = 100)
    private String entryFlag;

    @Column(name = "entry_date")
    private LocalDateTime entryDate;

    public ExperimentEntry() {
    }

    public ExperimentEntry(String customerId, String experimentId, String abGroup, String entryFlag,
                           LocalDateTime entryDate) {
        this.customerId = customerId;
        this.experimentId = experimentId;
        this.abGroup = abGroup;
        this.entryFlag = entryFlag;
        this.entryDate = entryDate;
    }
}
