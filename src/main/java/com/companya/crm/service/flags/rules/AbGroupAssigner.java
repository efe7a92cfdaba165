package com.companya.crm.service.flags.rules;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic A/B split for the day-pass conversion experiment.
 *
 * Hashing the email first, then the phone, keeps a household in one group because
 * children without an email borrow a parent's phone. The last hex digit of the MD5,
 * mod 10, puts 0-4 in group A and 5-9 in group B.
 */
@Slf4j
public class AbGroupAssigner {

    public static final String GROUP_A = "A";
    public static final String GROUP_B = "B";

    private static final Set<String> BLANK_MARKERS = Set.of("", "nan", "none");

    private final Map<String, String> overrides;

    public AbGroupAssigner(Map<String, String> overrides) {
        this.overrides = Map.copyOf(overrides);
        if (!this.overrides.isEmpty()) {
            log.info("A/B group overrides configured for {} customers", this.overrides.size());
        }
    }

    public String assign(String customerId, String email, String phone) {
        String override = overrides.get(customerId);
        if (override != null) {
            return override;
        }
        String hash;
        if (isPresent(email)) {
            hash = md5(email.trim().toLowerCase(Locale.ROOT));
        } else if (isPresent(phone) && !digitsOf(phone).isEmpty()) {
            hash = md5(digitsOf(phone));
        } else {
            hash = md5(String.valueOf(customerId));
        }
        int lastDigit = Character.digit(hash.charAt(hash.length() - 1), 16) % 10;
        return lastDigit <= 4 ? GROUP_A : GROUP_B;
    }

    private static boolean isPresent(String value) {
        return value != null && !BLANK_MARKERS.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String digitsOf(String phone) {
        return phone.replaceAll("\\D", "");
    }

    private static String md5(String value) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8));
    }
}
