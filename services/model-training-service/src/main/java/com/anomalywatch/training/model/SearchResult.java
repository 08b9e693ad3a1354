package com.anomalywatch.training.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a hyperparameter search.
 *
 * @param <P> candidate parameter type
 */
@Value
public class SearchResult<P> {

    P bestParameters;

    /**
     * Mean cross-validated AUPRC of {@link #bestParameters}.
     */
    double bestScore;

    /**
     * Every evaluated candidate with its mean score, in evaluation order.
     */
    List<CandidateScore<P>> candidates;

    @Value
    public static class CandidateScore<P> {
        P parameters;
        double meanAuprc;
    }
}
