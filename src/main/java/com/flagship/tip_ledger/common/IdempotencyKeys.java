package com.flagship.tip_ledger.common;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Deterministic idempotency keys and ids.
 *
 * Every key is derived from identifiers supplied by a collaborator (payment id)
 * or from ids that were themselves derived that way, so a replayed webhook or a
 * retried call lands on the same rows.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static UUID tipTransactionId(String paymentId) {
        return nameBased("tip-txn:" + paymentId);
    }

    public static String tipCredit(UUID transactionId, UUID employeeId) {
        return "tip-credit:" + transactionId + ":" + employeeId;
    }

    public static String tipOutDebit(UUID transactionId, UUID ruleId, UUID giverId) {
        return "tip-out:" + transactionId + ":" + ruleId + ":" + giverId;
    }

    public static String tipOutCredit(UUID transactionId, UUID ruleId, UUID giverId, UUID recipientId) {
        return tipOutDebit(transactionId, ruleId, giverId) + ":" + recipientId;
    }

    public static String bankCollection(UUID bankedShareId) {
        return "bank-collect:" + bankedShareId;
    }

    public static String debtRecoveryPrefix(UUID creditEntryId) {
        return "debt-recovery:" + creditEntryId + ":";
    }

    public static String debtRecovery(UUID creditEntryId, UUID debtId) {
        return debtRecoveryPrefix(creditEntryId) + debtId;
    }

    public static String reversal(UUID entryId) {
        return "reversal:" + entryId;
    }

    public static String transferDebit(String key) {
        return "transfer:" + key + ":debit";
    }

    public static String transferCredit(String key) {
        return "transfer:" + key + ":credit";
    }

    public static String adjustment(String key) {
        return "adjustment:" + key;
    }

    /**
     * Name-based (type 3) UUID, stable across processes and restarts.
     */
    public static UUID nameBased(String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }
}
