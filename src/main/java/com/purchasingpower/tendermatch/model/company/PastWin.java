package com.purchasingpower.tendermatch.model.company;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class PastWin {

    String contractTitle;

    String buyerName;

    BigDecimal value;

    LocalDate awardDate;

    Integer durationMonths;

    String description;
}
