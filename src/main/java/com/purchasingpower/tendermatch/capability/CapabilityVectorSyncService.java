package com.purchasingpower.tendermatch.capability;

import com.purchasingpower.tendermatch.model.company.Capability;
import com.purchasingpower.tendermatch.model.vector.SyncResult;

import java.util.List;

/**
 * Keeps capability vectors in the capabilities namespace in step with capability text.
 *
 * <p>Capabilities are immutable: every operation that changes the vector reference
 * returns a new copy and leaves persisting it to the caller.
 *
 * @since 1.0.0
 */
public interface CapabilityVectorSyncService {

    /**
     * Embeds the capability text into a new vector record.
     *
     * @param firmId owning firm, stored with the vector
     * @return copy of {@code capability} referencing the new record
     */
    Capability embedCapability(String firmId, Capability capability);

    /**
     * Re-embeds after a text change. The new record is written and referenced before
     * the old one is deleted, so the capability never points at a missing vector.
     *
     * @return copy referencing the new record; on failure the exception propagates
     *         and the old record is still in place
     */
    Capability reembed(String firmId, Capability capability);

    /**
     * Embeds every capability that has no vector reference yet. Failures are counted, not thrown.
     */
    SyncResult syncMissing(String firmId, List<Capability> capabilities);

    /**
     * Deletes the capability's vector record, if it has one.
     */
    void remove(Capability capability);
}
