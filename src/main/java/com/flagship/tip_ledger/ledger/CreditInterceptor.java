package com.flagship.tip_ledger.ledger;

import java.util.List;

/**
 * Hook run inside the posting transaction, after a recoverable credit was
 * appended and while the account row is still locked.
 */
public interface CreditInterceptor {

    /**
     * @return entries the interceptor appended to the same account, possibly empty
     */
    List<LedgerEntry> afterCredit(LedgerAccount lockedAccount, LedgerEntry credit);
}
