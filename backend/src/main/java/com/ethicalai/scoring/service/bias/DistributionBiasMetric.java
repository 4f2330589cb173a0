package com.ethicalai.scoring.service.bias;

import java.util.Collection;

/**
 * Normalized divergence of a category distribution from uniform: 0 when every category is equally
 * frequent, 1 when a single category holds every value.
 */
public enum DistributionBiasMetric {

  /** {@code (p_max - 1/k) / (1 - 1/k)}: how far the largest share exceeds its uniform share. */
  DOMINANCE {
    @Override
    double computeFor(Collection<Double> shares, int categories) {
      double max = shares.stream().mapToDouble(Double::doubleValue).max().orElse(1.0);
      double uniform = 1.0 / categories;
      return (max - uniform) / (1.0 - uniform);
    }
  },

  /** {@code 1 - H / ln k} with H the Shannon entropy in nats. */
  ENTROPY_DEFICIT {
    @Override
    double computeFor(Collection<Double> shares, int categories) {
      double entropy = 0.0;
      for (double p : shares) {
        if (p > 0) {
          entropy -= p * Math.log(p);
        }
      }
      return 1.0 - entropy / Math.log(categories);
    }
  };

  public double compute(Collection<Double> shares) {
    if (shares == null || shares.isEmpty()) {
      throw new IllegalArgumentException("Distribution must contain at least one category");
    }
    int categories = shares.size();
    if (categories == 1) {
      return 1.0;
    }
    return Math.min(1.0, Math.max(0.0, computeFor(shares, categories)));
  }

  abstract double computeFor(Collection<Double> shares, int categories);
}
