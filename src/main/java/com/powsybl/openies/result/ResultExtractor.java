/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.result;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.constraints.ConstraintKind;
import com.powsybl.openies.constraints.LinearConstraint;
import com.powsybl.openies.network.BalanceTerm;
import com.powsybl.openies.network.Carrier;
import com.powsybl.openies.network.IesDevice;
import com.powsybl.openies.opt.CostTerm;
import com.powsybl.openies.opt.DispatchProblem;
import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.opt.VariableRef;
import com.powsybl.openies.solver.SolverResult;
import com.powsybl.openies.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the raw variable values of a solve into device schedules and a cost breakdown. The problem and the solver
 * result are only read.
 *
 * @author Open IES developers
 */
public class ResultExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultExtractor.class);

    private final double balanceTolerance;

    public ResultExtractor(double balanceTolerance) {
        this.balanceTolerance = balanceTolerance;
    }

    public DispatchResult extract(DispatchProblem problem, SolverResult solverResult) {
        return extract(problem, solverResult, ReportNode.NO_OP);
    }

    public DispatchResult extract(DispatchProblem problem, SolverResult solverResult, ReportNode reportNode) {
        Objects.requireNonNull(problem);
        Objects.requireNonNull(solverResult);
        Objects.requireNonNull(reportNode);
        int horizon = problem.getNetwork().getHorizon();
        if (!solverResult.isSuccess()) {
            return DispatchResult.failed(problem.getProblemType(), solverResult.getSolverName(), horizon,
                    solverResult.getFailure().orElseThrow());
        }

        List<DeviceResult> deviceResults = new ArrayList<>();
        for (IesDevice device : problem.getNetwork().getDevices()) {
            deviceResults.add(extractDevice(device, horizon, solverResult));
        }

        CostBreakdown costBreakdown = extractCosts(problem.getCostTerms(), solverResult);
        double maxMismatch = checkBalances(problem, solverResult, reportNode);
        Reports.reportTotalCost(reportNode, costBreakdown.getTotalCost(), costBreakdown.fuelCost(), costBreakdown.gridCost(),
                costBreakdown.cyclingCost());

        return DispatchResult.optimal(problem.getProblemType(), solverResult.getSolverName(), horizon, deviceResults, costBreakdown,
                solverResult.getObjectiveValue(), maxMismatch);
    }

    private static DeviceResult extractDevice(IesDevice device, int horizon, SolverResult solverResult) {
        Map<DispatchVariableType, double[]> series = new EnumMap<>(DispatchVariableType.class);
        for (DispatchVariableType type : device.getVariableTypes()) {
            double[] values = new double[horizon];
            for (int t = 0; t < horizon; t++) {
                values[t] = solverResult.getValue(new VariableRef(device.getNum(), type, t));
            }
            series.put(type, values);
        }
        Map<Carrier, double[]> injections = new EnumMap<>(Carrier.class);
        for (Carrier carrier : device.getCarriers()) {
            double[] injection = new double[horizon];
            for (BalanceTerm term : device.getBalanceTerms(carrier)) {
                double[] values = series.get(term.type());
                for (int t = 0; t < horizon; t++) {
                    injection[t] += term.coefficient() * values[t];
                }
            }
            injections.put(carrier, injection);
        }
        return new DeviceResult(device.getId(), device.getType(), series, injections);
    }

    private static CostBreakdown extractCosts(List<CostTerm> costTerms, SolverResult solverResult) {
        double fuelCost = 0;
        double gridCost = 0;
        double cyclingCost = 0;
        for (CostTerm term : costTerms) {
            double cost = term.coefficient() * solverResult.getValue(term.variable());
            switch (term.category()) {
                case FUEL -> fuelCost += cost;
                case GRID -> gridCost += cost;
                case CYCLING -> cyclingCost += cost;
            }
        }
        return new CostBreakdown(fuelCost, gridCost, cyclingCost);
    }

    /**
     * Balance equalities hold by construction; a residual above tolerance means the solution is not trustworthy.
     */
    private double checkBalances(DispatchProblem problem, SolverResult solverResult, ReportNode reportNode) {
        double maxMismatch = 0;
        LinearConstraint worst = null;
        for (LinearConstraint constraint : problem.getConstraints().getConstraints(ConstraintKind.BUS_BALANCE)) {
            double mismatch = constraint.getViolation(solverResult::getValue);
            if (mismatch > maxMismatch) {
                maxMismatch = mismatch;
                worst = constraint;
            }
        }
        if (worst != null && maxMismatch > balanceTolerance) {
            String carrier = worst.getCarrier().map(Carrier::getSymbol).orElse("?");
            LOGGER.warn("Balance mismatch of {} on bus '{}' at timestep {}", maxMismatch, carrier, worst.getTimestep());
            Reports.reportBalanceMismatch(reportNode, carrier, worst.getTimestep(), maxMismatch);
        }
        return maxMismatch;
    }
}
