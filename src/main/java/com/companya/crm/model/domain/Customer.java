package com.companya.crm.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One resolved real-world person, assembled from every source that mentioned them.
 *
 * Primary values hold the normalized identifiers seen when the customer was created
 * and are never rewritten afterwards. Customers are never deleted or merged.
 */
@Getter
@Setter
@Entity
@Table(name = "CUSTOMER")
public class Customer {

    @Id
    @Column(name = "customer_id", length = 36)
    private String customerId;

    @Column(name = "primary_email")
    private String primaryEmail;

    @Column(name = "primary_phone", length = 32)
    private String primaryPhone;

    @Column(name = "primary_name")
    private String primaryName;

    @Column(name = "first_seen")
    private LocalDateTime firstSeen;

    @Column(name = "last_seen")
    private LocalDateTime lastSeen;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "CUSTOMER_SOURCE", joinColumns = @JoinColumn(name = "customer_id"))
    @Column(name = "source", length = 64)
    private Set<String> sources = new LinkedHashSet<>();

    public Customer() {
    }

    public Customer(String customerId, String primaryEmail, String primaryPhone, String primaryName,
                    LocalDateTime firstSeen, String source) {
        this.customerId = customerId;
        this.primaryEmail = primaryEmail;
        this.primaryPhone = primaryPhone;
        this.primaryName = primaryName;
        this.firstSeen = firstSeen;
        this.lastSeen = firstSeen;
        if (source != null) {
            this.sources.add(source);
        }
    }

    /**
     * Records another sighting of this customer. last_seen only moves forward.
     */
    public void recordSighting(String source, LocalDateTime seenAt) {
        if (seenAt != null && (lastSeen == null || seenAt.isAfter(lastSeen))) {
            lastSeen = seenAt;
        }
        if (source != null) {
            sources.add(source);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Customer customer = (Customer) o;
        return Objects.equals(customerId, customer.customerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(customerId);
    }

    @Override
    public String toString() {
        return "Customer{" +
                "customerId='" + customerId + '\'' +
                ", primaryEmail='" + primaryEmail + '\'' +
                ", primaryPhone='" + primaryPhone + '\'' +
                ", firstSeen=" + firstSeen +
                ", lastSeen=" + lastSeen +
                ", sources=" + sources +
                '}';
    }
}
