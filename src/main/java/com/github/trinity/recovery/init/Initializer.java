package com.github.trinity.recovery.init;

import com.github.trinity.recovery.solver.RecoveryProblem;

/**
 * Produces a starting estimate for a solver from the measurements alone. When the problem
 * carries a ground truth it is used for the history's error columns only.
 *
 * @author Sean Phillips
 */
public interface Initializer {

    InitResult initialize(RecoveryProblem problem);
}
