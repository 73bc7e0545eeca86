package com.purchasingpower.tendermatch.model.company;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Read-only snapshot of a company profile, assembled by the profile layer.
 */
@Value
@Builder(toBuilder = true)
public class CompanyProfile {

    String firmId;

    String companyName;

    @Singular
    List<Capability> capabilities;

    @Singular
    List<PastWin> pastWins;

    SearchPreference searchPreference;

    public Optional<SearchPreference> searchPreference() {
        return Optional.ofNullable(searchPreference);
    }
}
