/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.solver;

import com.powsybl.openies.opt.VariableRef;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a solve: the variable values and objective of an optimal solution, or a failure.
 *
 * @author Open IES developers
 */
public final class SolverResult {

    private final String solverName;

    private final Map<VariableRef, Double> values;

    private final double objectiveValue;

    private final SolveFailure failure;

    private final long solveTimeMillis;

    private SolverResult(String solverName, Map<VariableRef, Double> values, double objectiveValue, SolveFailure failure,
                         long solveTimeMillis) {
        this.solverName = Objects.requireNonNull(solverName);
        this.values = Collections.unmodifiableMap(values);
        this.objectiveValue = objectiveValue;
        this.failure = failure;
        this.solveTimeMillis = solveTimeMillis;
    }

    public static SolverResult success(String solverName, Map<VariableRef, Double> values, double objectiveValue, long solveTimeMillis) {
        return new SolverResult(solverName, Objects.requireNonNull(values), objectiveValue, null, solveTimeMillis);
    }

    public static SolverResult failure(String solverName, SolveFailure failure, long solveTimeMillis) {
        return new SolverResult(solverName, Map.of(), Double.NaN, Objects.requireNonNull(failure), solveTimeMillis);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public String getSolverName() {
        return solverName;
    }

    public Map<VariableRef, Double> getValues() {
        return values;
    }

    /**
     * Value of a variable, zero for variables not part of the solution.
     */
    public double getValue(VariableRef ref) {
        return values.getOrDefault(ref, 0.0);
    }

    public double getObjectiveValue() {
        return objectiveValue;
    }

    public Optional<SolveFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    public long getSolveTimeMillis() {
        return solveTimeMillis;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "SolverResult(solver=" + solverName + ", objective=" + objectiveValue + ")"
                : "SolverResult(solver=" + solverName + ", failure=" + failure + ")";
    }
}
