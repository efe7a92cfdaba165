package com.companya.crm.client;

import com.companya.crm.model.dto.ContactRecord;

import java.util.List;

/**
 * Supplies raw contact records from one or more upstream systems (CRM, payment
 * processors, mailing platform). Allows swapping between file-backed and live implementations.
 */
public interface ContactSourceClient {
    String name();
    List<ContactRecord> fetchContacts();
}
