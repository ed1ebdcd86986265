package com.gillianbc.annuity.model;

/**
 * How the objective ratio responds as the unknown grows. Controls when the solver halves its step
 * and which way a solved money value is rounded.
 */
public enum SearchDirection {
    INCREASING,
    DECREASING
}
