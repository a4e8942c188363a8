package com.headcount.service.core.catalog;

/** Bucket rules a computed dimension can be derived from. */
public enum BucketKind {
    /** Boundaries come from the configuration store and are re-read per call. */
    AGE,
    /** Fixed boundaries. */
    TENURE
}
