package com.companya.crm.model.domain;

import com.companya.crm.model.FlagPriority;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A live marketing/operational flag. The composite key keeps at most one row
 * per (customer_id, flag_type); re-triggering replaces the row.
 */
@Getter
@Setter
@Entity
@Table(name = "CUSTOMER_FLAG")
public class CustomerFlag {

    @EmbeddedId
    private CustomerFlagId id = new CustomerFlagId();

    @Column(name = "triggered_date")
    private LocalDateTime triggeredDate;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "flag_data", length = 8192)
    private Map<String, Object> flagData = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", length = 10)
    private FlagPriority priority;

    @Column(name = "flag_added_date")
    private LocalDateTime flagAddedDate;

    public CustomerFlag() {
    }

    public CustomerFlag(String customerId, String flagType, LocalDateTime triggeredDate,
                        Map<String, Object> flagData, FlagPriority priority, LocalDateTime flagAddedDate) {
        this.id = new CustomerFlagId(customerId, flagType);
        this.triggeredDate = triggeredDate;
        this.flagData = flagData != null ? new LinkedHashMap<>(flagData) : new LinkedHashMap<>();
        this.priority = priority;
        this.flagAddedDate = flagAddedDate;
    }

    public String getCustomerId() {
        return id.getCustomerId();
    }

    public String getFlagType() {
        return id.getFlagType();
    }

    @Override
    public String toString() {
        return "CustomerFlag{" +
                "id=" + id +
                ", triggeredDate=" + triggeredDate +
                ", priority=" + priority +
                ", flagAddedDate=" + flagAddedDate +
                '}';
    }
}
