package com.companya.crm.service.flags.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AbGroupAssigner Tests")
class AbGroupAssignerTest {

    private final AbGroupAssigner assigner = new AbGroupAssigner(Map.of());

    @Test
    void emailHashDecidesGroup() {
        assertThat(assigner.assign("cust-7", "alice@example.com", null)).isEqualTo(AbGroupAssigner.GROUP_A);
        assertThat(assigner.assign("cust-1", "carol@example.com", null)).isEqualTo(AbGroupAssigner.GROUP_B);
    }

    @Test
    void emailIsTrimmedAndLowercasedBeforeHashing() {
        assertThat(assigner.assign("cust-1", "  Carol@Example.COM ", null)).isEqualTo(AbGroupAssigner.GROUP_B);
    }

    @Test
    void phoneDigitsUsedWhenEmailMissing() {
        assertThat(assigner.assign("cust-7", null, "(555) 123-4567")).isEqualTo(AbGroupAssigner.GROUP_A);
        assertThat(assigner.assign("cust-7", "nan", "555.123.4567")).isEqualTo(AbGroupAssigner.GROUP_A);
    }

    @Test
    void customerIdUsedWithoutContactDetails() {
        assertThat(assigner.assign("cust-7", null, null)).isEqualTo(AbGroupAssigner.GROUP_B);
        assertThat(assigner.assign("cust-1", "", "no digits")).isEqualTo(AbGroupAssigner.GROUP_A);
    }

    @Test
    void overrideWins() {
        AbGroupAssigner withOverride = new AbGroupAssigner(Map.of("cust-1", "B"));

        assertThat(withOverride.assign("cust-1", "alice@example.com", null)).isEqualTo(AbGroupAssigner.GROUP_B);
    }

    @Test
    void householdSharesGroupThroughSharedPhone() {
        String parent = assigner.assign("parent-1", null, "5551234567");

        assertThat(assigner.assign("child-1", null, "555-123-4567")).isEqualTo(parent);
    }
}
