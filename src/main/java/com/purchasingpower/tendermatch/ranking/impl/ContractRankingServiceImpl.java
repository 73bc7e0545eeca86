package com.purchasingpower.tendermatch.ranking.impl;

import com.purchasingpower.tendermatch.config.RankingConfig;
import com.purchasingpower.tendermatch.knowledge.EmbeddingResolver;
import com.purchasingpower.tendermatch.model.company.CompanyProfile;
import com.purchasingpower.tendermatch.model.contract.Contract;
import com.purchasingpower.tendermatch.model.match.MatchResult;
import com.purchasingpower.tendermatch.model.match.RankedContract;
import com.purchasingpower.tendermatch.ranking.ContractRankingService;
import com.purchasingpower.tendermatch.scoring.MatchScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import static com.google.common.base.Preconditions.checkNotNull;

@Slf4j
@Service
public class ContractRankingServiceImpl implements ContractRankingService {

    private final MatchScorer matchScorer;
    private final EmbeddingResolver embeddingResolver;
    private final RankingConfig config;
    private final Executor scoringExecutor;

    public ContractRankingServiceImpl(MatchScorer matchScorer,
                                      EmbeddingResolver embeddingResolver,
                                      RankingConfig config,
                                      @Qualifier("scoringExecutor") Executor scoringExecutor) {
        this.matchScorer = matchScorer;
        this.embeddingResolver = embeddingResolver;
        this.config = config;
        this.scoringExecutor = scoringExecutor;
    }

    @Override
    public List<RankedContract> rank(List<Contract> contracts, CompanyProfile profile, int limit) {
        int effectiveLimit = limit < 1 ? config.getDefaultLimit() : limit;
        List<RankedContract> ranked = scoreAll(contracts, profile);
        List<RankedContract> top = ranked.size() > effectiveLimit ? ranked.subList(0, effectiveLimit) : ranked;

        log.info("Ranked {} of {} candidates for firm {}, returning {}",
                ranked.size(), contracts.size(), profile.getFirmId(), top.size());
        return List.copyOf(top);
    }

    @Override
    public List<RankedContract> digest(List<Contract> contracts, CompanyProfile profile) {
        List<RankedContract> matches = scoreAll(contracts, profile).stream()
                .filter(r -> r.getTotalScore() >= config.getDigestMinScore())
                .toList();

        log.info("Digest for firm {}: {} of {} contracts scored at least {}",
                profile.getFirmId(), matches.size(), contracts.size(), config.getDigestMinScore());
        return matches;
    }

    @Override
    public int candidatePoolSize(int limit) {
        int effectiveLimit = limit < 1 ? config.getDefaultLimit() : limit;
        return effectiveLimit * config.getCandidateMultiplier();
    }

    /**
     * Scores every candidate in parallel and returns the non-excluded ones, best first.
     */
    private List<RankedContract> scoreAll(List<Contract> contracts, CompanyProfile profile) {
        checkNotNull(contracts, "contracts");
        checkNotNull(profile, "profile");
        if (contracts.isEmpty()) {
            return List.of();
        }

        CompanyProfile resolvedProfile = embeddingResolver.resolveCapabilities(profile);
        List<Contract> resolvedContracts = embeddingResolver.resolveContracts(contracts);

        List<CompletableFuture<Optional<RankedContract>>> futures = new ArrayList<>(resolvedContracts.size());
        for (Contract contract : resolvedContracts) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> scoreOne(contract, resolvedProfile), scoringExecutor)
                    .exceptionally(e -> {
                        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                        log.warn("Dropping contract {}: scoring failed: {}", contract.getNoticeId(), cause.getMessage());
                        return Optional.empty();
                    }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // List.sort is stable, so equal scores keep input order
        List<RankedContract> ranked = new ArrayList<>(futures.size());
        for (CompletableFuture<Optional<RankedContract>> future : futures) {
            future.join().ifPresent(ranked::add);
        }
        ranked.sort(Comparator.comparingDouble(RankedContract::getTotalScore).reversed());

        log.debug("Scored {} candidates, {} passed filters", resolvedContracts.size(), ranked.size());
        return ranked;
    }

    private Optional<RankedContract> scoreOne(Contract contract, CompanyProfile profile) {
        Optional<MatchResult> result = matchScorer.score(contract, profile);
        return result.map(r -> new RankedContract(contract, r));
    }
}
