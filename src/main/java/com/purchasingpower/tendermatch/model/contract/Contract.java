package com.purchasingpower.tendermatch.model.contract;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * A procurement notice as seen by the match scorer.
 *
 * <p>{@code vectorId} references the notice's record in the contracts namespace;
 * {@code embedding} is the vector itself once the caller has fetched it.
 * The scorer only reads {@code embedding}.
 */
@Value
@Builder(toBuilder = true)
public class Contract {

    String noticeId;

    String title;

    String description;

    String buyerName;

    BigDecimal value;

    String region;

    String vectorId;

    List<Double> embedding;

    LocalDateTime publishedDate;

    LocalDateTime closingDate;

    @Builder.Default
    List<String> cpvCodes = List.of();

    /**
     * Title and description joined, lower-cased, for keyword and category matching.
     */
    public String searchableText() {
        String text = (title == null ? "" : title) + " " + (description == null ? "" : description);
        return text.toLowerCase(Locale.ROOT);
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }
}
