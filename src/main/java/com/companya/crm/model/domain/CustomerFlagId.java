package com.companya.crm.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;

@Embeddable
@Getter
@Setter
@EqualsAndHashCode
public class CustomerFlagId implements Serializable {

    @Column(name = "customer_id", length = 64)
    private String customerId;

    @Column(name = "flag_type", length = 100)
    private String flagType;

    public CustomerFlagId() {
    }

    public CustomerFlagId(String customerId, String flagType) {
        this.customerId = customerId;
        this.flagType = flagType;
    }

    @Override
    public String toString() {
        return customerId + "/" + flagType;
    }
}
