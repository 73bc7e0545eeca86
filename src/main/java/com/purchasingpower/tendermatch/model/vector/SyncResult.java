package com.purchasingpower.tendermatch.model.vector;

import com.purchasingpower.tendermatch.model.company.Capability;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of embedding the capabilities that had no vector yet.
 */
@Value
@Builder
public class SyncResult {

    /**
     * Every input capability, with new vector ids where embedding succeeded.
     */
    @Singular
    List<Capability> capabilities;

    int synced;

    int failed;

    /**
     * Ids of capabilities that could not be embedded.
     */
    @Singular
    List<Long> failedIds;

    public boolean isComplete() {
        return failed == 0;
    }
}
