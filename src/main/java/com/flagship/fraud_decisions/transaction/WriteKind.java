package com.flagship.fraud_decisions.transaction;

/**
 * What an idempotent write did to the store.
 */
public enum WriteKind {
    /** First observation of the business key; event and review inserted. */
    CREATED,
    /** Key already stored; delivery metadata refreshed. */
    UPDATED,
    /** Key already stored with identical delivery metadata; nothing written. */
    NOOP
}
