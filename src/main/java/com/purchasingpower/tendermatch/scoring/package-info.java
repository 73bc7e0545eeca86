/**
 * Contract match scoring: capability similarity, past-win history and search preferences,
 * combined into one weighted score with human-readable reasons.
 *
 * @since 1.0.0
 */
package com.purchasingpower.tendermatch.scoring;
