package com.purchasingpower.tendermatch.model.match;

import com.purchasingpower.tendermatch.model.contract.Contract;
import lombok.Value;

@Value
public class RankedContract {

    Contract contract;

    MatchResult matchResult;

    public double getTotalScore() {
        return matchResult.getTotalScore();
    }

    /**
     * First match reason, or a generic line when the scorer gave none.
     */
    public String getHeadlineReason() {
        return matchResult.getMatchReasons().isEmpty()
                ? "Matches your profile"
                : matchResult.getMatchReasons().get(0);
    }
}
