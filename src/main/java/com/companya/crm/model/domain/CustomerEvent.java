package com.companya.crm.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One timestamped customer touchpoint: purchase, check-in, membership change,
 * communication, or a flag_set written back by the flagging run.
 */
@Getter
@Setter
@Entity
@Table(name = "CUSTOMER_EVENT", indexes = {
        @Index(name = "idx_event_customer_date", columnList = "customer_id, event_date")
})
public class CustomerEvent {

    public static final String FLAG_SET = "flag_set";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", length = 64, nullable = false)
    private String customerId;

    @Column(name = "event_type", length = 64, nullable = false)
    private String eventType;

    @Column(name = "event_date")
    private LocalDateTime eventDate;

    @Column(name = "source", length = 64)
    private String source;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "payload", length = 8192)
    private Map<String, Object> payload = new LinkedHashMap<>();

    public CustomerEvent() {
    }

    public CustomerEvent(String customerId, String eventType, LocalDateTime eventDate, String source,
                         Map<String, Object> payload) {
        this.customerId = customerId;
        this.eventType = eventType;
        this.eventDate = eventDate;
        this.source = source;
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
    }

    /**
     * Reads a payload value as a string; missing and null values become "".
     */
    public String payloadString(String key) {
        Object value = payload != null ? payload.get(key) : null;
        return value != null ? value.toString() : "";
    }

    @Override
    public String toString() {
        return "CustomerEvent{" +
                "customerId='" + customerId + '\'' +
                ", eventType='" + eventType + '\'' +
                ", eventDate=" + eventDate +
                ", source='" + source + '\'' +
                '}';
    }
}
