package com.company.jobmonitor.alert;

public enum DispatchResult {
    SENT,
    /** Same kind already alerted for the job inside the suppression window. */
    SUPPRESSED,
    /** Delivery failed; suppression bookkeeping was still updated. */
    FAILED,
    /** Recovery cleared the job's suppression record. */
    CLEARED
}
