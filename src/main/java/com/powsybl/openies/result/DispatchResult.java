/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.result;

import com.powsybl.openies.opt.ProblemType;
import com.powsybl.openies.solver.SolveFailure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a dispatch run. On success it holds the device schedules and the cost breakdown, otherwise the failure.
 *
 * @author Open IES developers
 */
public final class DispatchResult {

    private final DispatchStatus status;

    private final ProblemType problemType;

    private final String solverName;

    private final int horizon;

    private final Map<String, DeviceResult> deviceResults;

    private final CostBreakdown costBreakdown;

    private final double objectiveValue;

    private final double maxBalanceMismatch;

    private final SolveFailure failure;

    private DispatchResult(DispatchStatus status, ProblemType problemType, String solverName, int horizon,
                           List<DeviceResult> deviceResults, CostBreakdown costBreakdown, double objectiveValue,
                           double maxBalanceMismatch, SolveFailure failure) {
        this.status = Objects.requireNonNull(status);
        this.problemType = Objects.requireNonNull(problemType);
        this.solverName = Objects.requireNonNull(solverName);
        this.horizon = horizon;
        Map<String, DeviceResult> byId = new LinkedHashMap<>();
        for (DeviceResult deviceResult : deviceResults) {
            byId.put(deviceResult.getDeviceId(), deviceResult);
        }
        this.deviceResults = Collections.unmodifiableMap(byId);
        this.costBreakdown = Objects.requireNonNull(costBreakdown);
        this.objectiveValue = objectiveValue;
        this.maxBalanceMismatch = maxBalanceMismatch;
        this.failure = failure;
    }

    static DispatchResult optimal(ProblemType problemType, String solverName, int horizon, List<DeviceResult> deviceResults,
                                  CostBreakdown costBreakdown, double objectiveValue, double maxBalanceMismatch) {
        return new DispatchResult(DispatchStatus.OPTIMAL, problemType, solverName, horizon, deviceResults, costBreakdown,
                objectiveValue, maxBalanceMismatch, null);
    }

    static DispatchResult failed(ProblemType problemType, String solverName, int horizon, SolveFailure failure) {
        return new DispatchResult(DispatchStatus.FAILED, problemType, solverName, horizon, List.of(), CostBreakdown.ZERO,
                Double.NaN, Double.NaN, Objects.requireNonNull(failure));
    }

    public DispatchStatus getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status == DispatchStatus.OPTIMAL;
    }

    public ProblemType getProblemType() {
        return problemType;
    }

    public String getSolverName() {
        return solverName;
    }

    public int getHorizon() {
        return horizon;
    }

    public Map<String, DeviceResult> getDeviceResults() {
        return deviceResults;
    }

    public DeviceResult getDeviceResult(String deviceId) {
        DeviceResult deviceResult = deviceResults.get(deviceId);
        if (deviceResult == null) {
            throw new IllegalArgumentException("No result for device '" + deviceId + "'");
        }
        return deviceResult;
    }

    public CostBreakdown getCostBreakdown() {
        return costBreakdown;
    }

    public double getTotalCost() {
        return costBreakdown.getTotalCost();
    }

    /**
     * Objective value reported by the solver, equal to the total cost up to the solver tolerance.
     */
    public double getObjectiveValue() {
        return objectiveValue;
    }

    /**
     * Largest absolute bus balance residual of the solution.
     */
    public double getMaxBalanceMismatch() {
        return maxBalanceMismatch;
    }

    public Optional<SolveFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return isOptimal()
                ? "DispatchResult(status=" + status + ", totalCost=" + getTotalCost() + ")"
                : "DispatchResult(status=" + status + ", failure=" + failure + ")";
    }
}
