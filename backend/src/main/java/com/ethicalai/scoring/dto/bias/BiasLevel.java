package com.ethicalai.scoring.dto.bias;

/** Risk level derived from a bias score; a lower score never maps to a lower risk. */
public enum BiasLevel {
  LOW,
  MODERATE,
  HIGH
}
