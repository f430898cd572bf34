package com.flagship.tip_ledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class IdempotencyKeysTest {

    @Test
    @DisplayName("Transaction ids are stable per payment and differ between payments")
    void testTipTransactionIdIsDeterministic() {
        assertEquals(IdempotencyKeys.tipTransactionId("pay-1"), IdempotencyKeys.tipTransactionId("pay-1"));
        assertNotEquals(IdempotencyKeys.tipTransactionId("pay-1"), IdempotencyKeys.tipTransactionId("pay-2"));
    }

    @Test
    @DisplayName("Recovery keys of one credit share a common prefix")
    void testDebtRecoveryPrefix() {
        UUID credit = UUID.randomUUID();
        String key = IdempotencyKeys.debtRecovery(credit, UUID.randomUUID());

        assertTrue(key.startsWith(IdempotencyKeys.debtRecoveryPrefix(credit)));
        assertFalse(key.startsWith(IdempotencyKeys.debtRecoveryPrefix(UUID.randomUUID())));
    }

    @Test
    @DisplayName("Tip-out credit keys extend the debit key per recipient")
    void testTipOutKeys() {
        UUID txn = UUID.randomUUID();
        UUID rule = UUID.randomUUID();
        UUID giver = UUID.randomUUID();
        String debit = IdempotencyKeys.tipOutDebit(txn, rule, giver);

        assertTrue(IdempotencyKeys.tipOutCredit(txn, rule, giver, UUID.randomUUID()).startsWith(debit + ":"));
        assertNotEquals(IdempotencyKeys.transferDebit("k"), IdempotencyKeys.transferCredit("k"));
    }

    @Test
    @DisplayName("Id order compares canonical strings")
    void testIdOrder() {
        List<UUID> ids = new ArrayList<>(List.of(
            UUID.fromString("b0000000-0000-0000-0000-000000000000"),
            UUID.fromString("0a000000-0000-0000-0000-000000000000"),
            UUID.fromString("a0000000-0000-0000-0000-000000000000")));

        ids.sort(IdOrder.ASCENDING);

        assertEquals("0a000000-0000-0000-0000-000000000000", ids.get(0).toString());
        assertEquals("b0000000-0000-0000-0000-000000000000", ids.get(2).toString());
    }
}
