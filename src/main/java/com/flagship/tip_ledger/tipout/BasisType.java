package com.flagship.tip_ledger.tipout;

/**
 * What a tip-out percentage is taken of.
 */
public enum BasisType {
    /** The giver's attributed tip share. */
    TIPS_EARNED,
    /** The giver's proportional part of the check's sales. */
    SALES
}
