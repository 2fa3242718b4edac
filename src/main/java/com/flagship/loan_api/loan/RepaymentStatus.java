package com.flagship.loan_api.loan;

/**
 * Classification of a loan by its latest payment relative to its due date.
 */
public enum RepaymentStatus {
    /**
     * Paid no more than 5 days after the due date (early payments included).
     */
    ON_TIME,

    /**
     * Paid 6 to 30 days after the due date.
     */
    LATE,

    /**
     * Paid more than 30 days after the due date.
     */
    DEFAULTED,

    /**
     * No payment recorded.
     */
    UNPAID
}
