package com.containermgmt.streamagent.store;

import com.containermgmt.streamagent.dto.Batch;

/**
 * Applies a batch to the relational store in one transaction.
 */
public interface StoreApplier {

    /**
     * Applies every event of the batch, in order, and commits once.
     * Events whose sequence is not above the entity's last applied sequence are
     * skipped, so reapplying a batch is a no-op.
     *
     * @return counts of applied and skipped events, only after the commit succeeded
     * @throws com.containermgmt.streamagent.exception.TransientStoreException the batch was
     *         rolled back and may succeed if applied again
     * @throws com.containermgmt.streamagent.exception.FatalStoreException the batch was
     *         rolled back and will keep failing
     */
    ApplyResult apply(Batch batch);
}
