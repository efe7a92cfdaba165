package com.companya.crm.service.flags.rules;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlagRuleRegistryTest {

    @Test
    void keepsRegistrationOrder() {
        FlagRuleRegistry registry = new FlagRuleRegistry(List.of(new NewMemberRule(), new ReadyForMembershipRule()));

        assertThat(registry.flagTypes()).containsExactly("new_member", "ready_for_membership");
        assertThat(registry.findByFlagType("ready_for_membership")).isPresent();
        assertThat(registry.findByFlagType("unknown")).isEmpty();
    }

    @Test
    void rejectsDuplicateFlagTypes() {
        assertThatThrownBy(() -> new FlagRuleRegistry(List.of(new NewMemberRule(), new NewMemberRule())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("new_member");
    }
}
