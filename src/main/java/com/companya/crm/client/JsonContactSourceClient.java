package com.companya.crm.client;

import com.companya.crm.model.dto.ContactRecord;
import com.companya.crm.util.TimestampUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads contact exports dropped as a JSON array by the upstream fetchers.
 *
 * Each element carries {@code email}, {@code phone}, either {@code name} or
 * {@code first_name}/{@code last_name}, {@code source}, {@code source_id} and
 * {@code first_seen}. Unknown fields are ignored.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.identity.contacts-location")
public class JsonContactSourceClient implements ContactSourceClient {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final String location;

    public JsonContactSourceClient(ObjectMapper objectMapper, ResourceLoader resourceLoader,
                                   @Value("${app.identity.contacts-location}") String location) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    @Override
    public String name() {
        return "json:" + location;
    }

    @Override
    public List<ContactRecord> fetchContacts() {
        log.info("📥 Loading contact records from {}", location);
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<Map<String, Object>> rows = objectMapper.readValue(in, new TypeReference<List<Map<String, Object>>>() {});
            List<ContactRecord> records = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                records.add(toContactRecord(row));
            }
            log.info("📥 Loaded {} contact records from {}", records.size(), location);
            return records;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read contact records from " + location, e);
        }
    }

    private ContactRecord toContactRecord(Map<String, Object> row) {
        String name = asString(row.get("name"));
        if (name == null) {
            String joined = (nullToEmpty(asString(row.get("first_name"))) + " "
                    + nullToEmpty(asString(row.get("last_name")))).trim();
            name = joined.isEmpty() ? null : joined;
        }
        LocalDateTime firstSeen = TimestampUtils.toNaive(row.get("first_seen"));
        return new ContactRecord(
                asString(row.get("email")),
                asString(row.get("phone")),
                name,
                asString(row.get("source")),
                asString(row.get("source_id")),
                firstSeen
        );
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
