package com.companya.crm.client;

import com.companya.crm.model.dto.ContactRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonContactSourceClientTest {

    private JsonContactSourceClient clientFor(String location) {
        return new JsonContactSourceClient(new ObjectMapper(), new DefaultResourceLoader(), location);
    }

    @Test
    void readsContactExportFromClasspath() {
        List<ContactRecord> records = clientFor("classpath:test-data/contacts.json").fetchContacts();

        assertThat(records).hasSize(6);
        ContactRecord first = records.get(0);
        assertThat(first.email()).isEqualTo("Jane.Doe@Gmail.com");
        assertThat(first.name()).isEqualTo("Jane Doe");
        assertThat(first.source()).isEqualTo("capitan");
        assertThat(first.sourceRecordId()).isEqualTo("cap-100");
        assertThat(first.firstSeen()).isEqualTo(LocalDateTime.of(2026, 1, 1, 9, 0));
    }

    @Test
    void normalizesMixedTimestampsAndMissingFields() {
        List<ContactRecord> records = clientFor("classpath:test-data/contacts.json").fetchContacts();

        assertThat(records.get(1).phone()).isNull();
        assertThat(records.get(1).firstSeen()).isEqualTo(LocalDateTime.of(2026, 1, 5, 12, 30));
        assertThat(records.get(2).firstSeen()).isEqualTo(LocalDateTime.of(2026, 1, 7, 8, 15));
        assertThat(records.get(3).firstSeen()).isEqualTo(LocalDateTime.of(2026, 1, 9, 0, 0));
    }

    @Test
    void missingExportFailsLoudly() {
        JsonContactSourceClient client = clientFor("classpath:test-data/does-not-exist.json");

        assertThat(client.name()).isEqualTo("json:classpath:test-data/does-not-exist.json");
        assertThatThrownBy(client::fetchContacts)
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("does-not-exist.json");
    }
}
