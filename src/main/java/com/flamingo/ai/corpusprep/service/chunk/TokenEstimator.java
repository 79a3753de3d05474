package com.flamingo.ai.corpusprep.service.chunk;

/**
 * Estimates how many tokens a piece of text costs against a chunk budget.
 *
 * <p>Implementations must be deterministic: the same text always yields the same estimate.
 */
public interface TokenEstimator {

  int estimate(String text);
}
