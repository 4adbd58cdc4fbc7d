package me.golemcore.runner.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ApprovalLedgerTest {

    private ApprovalLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ApprovalLedger();
    }

    @Test
    void shouldBeUnknownWithoutDecision() {
        assertEquals(ApprovalStatus.UNKNOWN, ledger.getStatus("delete", "c1"));
    }

    @Test
    void shouldTrackDecisionsPerCall() {
        ledger.approve("delete", "c1", false);
        ledger.reject("delete", "c2", false);

        assertEquals(ApprovalStatus.APPROVED, ledger.getStatus("delete", "c1"));
        assertEquals(ApprovalStatus.REJECTED, ledger.getStatus("delete", "c2"));
        assertEquals(ApprovalStatus.UNKNOWN, ledger.getStatus("delete", "c3"));
        assertEquals(ApprovalStatus.UNKNOWN, ledger.getStatus("read", "c1"));
    }

    @Test
    void shouldLetLaterDecisionReplaceEarlierOne() {
        ledger.reject("delete", "c1", false);
        ledger.approve("delete", "c1", false);

        assertEquals(ApprovalStatus.APPROVED, ledger.getStatus("delete", "c1"));
    }

    @Test
    void shouldApplyToolWideDecisionBeforePerCallOnes() {
        ledger.approve("delete", "c1", false);
        ledger.reject("delete", "c2", true);

        assertEquals(ApprovalStatus.REJECTED, ledger.getStatus("delete", "c1"));
        assertEquals(ApprovalStatus.REJECTED, ledger.getStatus("delete", "any"));

        ledger.approve("delete", "c3", true);

        assertEquals(ApprovalStatus.APPROVED, ledger.getStatus("delete", "c2"));
    }

    @Test
    void shouldPreferApprovalWhenRestoredFlagsConflict() {
        ApprovalLedger.ToolApprovals conflicting = new ApprovalLedger.ToolApprovals();
        conflicting.setAlwaysApproved(true);
        conflicting.setAlwaysRejected(true);

        ledger.restore(Map.of("delete", conflicting));

        assertEquals(ApprovalStatus.APPROVED, ledger.getStatus("delete", "c1"));
    }

    @Test
    void shouldReturnDetachedSnapshot() {
        ledger.approve("delete", "c1", false);

        Map<String, ApprovalLedger.ToolApprovals> snapshot = ledger.snapshot();
        snapshot.get("delete").getApprovedCallIds().clear();

        assertEquals(ApprovalStatus.APPROVED, ledger.getStatus("delete", "c1"));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("read", null));
    }
}
