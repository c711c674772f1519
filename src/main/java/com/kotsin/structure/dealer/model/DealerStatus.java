package com.kotsin.structure.dealer.model;

/**
 * Quality of a dealer metrics result. Derived by the classifier, never set directly.
 */
public enum DealerStatus {
    FULL,
    LIMITED,
    INVALID
}
