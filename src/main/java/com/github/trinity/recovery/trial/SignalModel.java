package com.github.trinity.recovery.trial;

/**
 * Kind of ground truth a trial synthesizes.
 *
 * @author Sean Phillips
 */
public enum SignalModel {
    /** s-sparse vector. */
    SPARSE_VECTOR,
    /** General d1 x d2 matrix of rank r. */
    LOW_RANK,
    /** Symmetric positive semidefinite d x d matrix of rank r. */
    SYMMETRIC_PSD
}
