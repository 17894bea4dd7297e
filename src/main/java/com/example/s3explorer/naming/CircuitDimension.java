package com.example.s3explorer.naming;

/**
 * Fields a set of circuit names can be grouped by.
 */
public enum CircuitDimension {
    TYPE,
    YEAR_MONTH,
    PROJECT,
    BATCH
}
