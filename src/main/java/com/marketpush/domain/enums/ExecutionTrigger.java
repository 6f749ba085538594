package com.marketpush.domain.enums;

/** What started a push execution. */
public enum ExecutionTrigger {

    /** Accelerated run shortly after the scheduler starts. */
    STARTUP,

    /** Regular timer tick. */
    SCHEDULED,

    /** Operator-initiated run via API. */
    MANUAL
}
