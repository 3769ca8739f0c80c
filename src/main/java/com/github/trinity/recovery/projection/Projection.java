package com.github.trinity.recovery.projection;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Maps an unconstrained signal-shaped array to the nearest array (Frobenius distance) in a
 * structured set such as rank-r matrices or s-sparse vectors. Implementations are pure and never
 * modify their argument. A budget at least as large as the ambient dimension leaves the input
 * unchanged.
 *
 * @author Sean Phillips
 */
@FunctionalInterface
public interface Projection {

    RealMatrix project(RealMatrix x);
}
