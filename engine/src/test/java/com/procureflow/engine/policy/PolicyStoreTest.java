package com.procureflow.engine.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PolicyStoreTest {

    @Mock ApprovalRuleRepository ruleRepository;
    @Mock ApproverRepository approverRepository;

    PolicyStore policyStore;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
        policyStore = new PolicyStore(ruleRepository, approverRepository, clock);
    }

    private static ApprovalRule rule(long id, String max, String... roles) {
        return ApprovalRule.builder().id(id).maxAmount(new BigDecimal(max))
                .requiredApprovers(new ArrayList<>(List.of(roles))).build();
    }

    @Test
    @DisplayName("findRule: matched bracket, re-read from the repository on every call")
    void findRuleReloadsEachTime() {
        when(ruleRepository.findByActiveTrue())
                .thenReturn(List.of(rule(1, "1000", "manager")))
                .thenReturn(List.of(rule(1, "1000", "manager"), rule(2, "500", "lead")));

        RuleLookup first = policyStore.findRule(new BigDecimal("400"));
        RuleLookup second = policyStore.findRule(new BigDecimal("400"));

        assertThat(first.isMatched()).isTrue();
        assertThat(first.getRule().getId()).isEqualTo(1L);
        assertThat(second.getRule().getId()).isEqualTo(2L);
        verify(ruleRepository, times(2)).findByActiveTrue();
    }

    @Test
    @DisplayName("findRule: requires manual escalation when no bracket covers the amount")
    void findRuleEscalates() {
        when(ruleRepository.findByActiveTrue()).thenReturn(List.of(rule(1, "1000", "manager")));

        RuleLookup lookup = policyStore.findRule(new BigDecimal("1000000"));

        assertThat(lookup.requiresManualEscalation()).isTrue();
        assertThat(lookup.getRule()).isNull();
    }

    @Test
    @DisplayName("isActive: false for unknown and deactivated approvers")
    void isActive() {
        when(approverRepository.findById("manager"))
                .thenReturn(Optional.of(Approver.builder().role("manager").name("M").email("m@x").active(true).build()));
        when(approverRepository.findById("cfo"))
                .thenReturn(Optional.of(Approver.builder().role("cfo").name("C").email("c@x").active(false).build()));
        when(approverRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThat(policyStore.isActive("manager")).isTrue();
        assertThat(policyStore.isActive("cfo")).isFalse();
        assertThat(policyStore.isActive("ghost")).isFalse();
    }

    @Test
    @DisplayName("approversFor: keeps the requested order and drops unknown roles")
    void approversForKeepsOrder() {
        when(approverRepository.findAllById(anyCollection())).thenReturn(List.of(
                Approver.builder().role("cfo").name("C").email("c@x").build(),
                Approver.builder().role("manager").name("M").email("m@x").build()));

        Map<String, Approver> result = policyStore.approversFor(List.of("manager", "ghost", "cfo"));

        assertThat(result.keySet()).containsExactly("manager", "cfo");
    }
}
