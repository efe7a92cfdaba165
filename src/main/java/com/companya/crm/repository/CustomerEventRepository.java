package com.companya.crm.repository;

import com.companya.crm.model.domain.CustomerEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface CustomerEventRepository extends JpaRepository<CustomerEvent, Long> {

    List<CustomerEvent> findByCustomerIdOrderByEventDateAsc(String customerId);

    /**
     * Events of one type in the half-open window {@code [from, to)}.
     */
    List<CustomerEvent> findByEventTypeAndEventDateGreaterThanEqualAndEventDateLessThan(String eventType,
                                                                                      LocalDateTime from,
                                                                                      LocalDateTime to);
}
