package com.github.trinity.recovery.operator;

/**
 * Random sensing ensembles a trial can draw its operator from.
 *
 * @author Sean Phillips
 */
public enum SensingModel {
    /** i.i.d. standard Gaussian measurement matrices. */
    GAUSSIAN,
    /** Gaussian matrices symmetrized as (G + G^T)/2; square signals only. */
    SYMMETRIC_GAUSSIAN,
    /** Rank-one matrices a a^T with Gaussian a, the phase retrieval ensemble; square signals only. */
    RANK_ONE,
    /** Random rows of the real (Hartley) discrete Fourier matrix. */
    PARTIAL_FOURIER
}
