/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.solver;

import com.google.ortools.modelbuilder.SolveStatus;
import com.powsybl.openies.OpenIesParameters;
import com.powsybl.openies.network.IesBus;
import com.powsybl.openies.network.IesNetwork;
import com.powsybl.openies.opt.DispatchProblem;
import com.powsybl.openies.opt.DispatchProblemFormulator;
import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.opt.VariableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Locates the bus balances which cannot be met by solving the balance relaxed problem: every shortfall or surplus
 * above the balance tolerance is a violation.
 *
 * @author Open IES developers
 */
public class InfeasibilityDiagnoser {

    private static final Logger LOGGER = LoggerFactory.getLogger(InfeasibilityDiagnoser.class);

    private final OpenIesParameters parameters;

    public InfeasibilityDiagnoser(OpenIesParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    /**
     * Balance violations ordered by bus then timestep, empty if all balances can be met or if the relaxed problem
     * could not be solved.
     */
    public List<BalanceViolation> diagnose(IesNetwork network) {
        DispatchProblem elasticProblem = new DispatchProblemFormulator(parameters).formulateElastic(network);
        OrToolsDispatchSolver.ModelSolution solution = OrToolsDispatchSolver.solveModel(elasticProblem, parameters);
        if (solution == null || solution.status() != SolveStatus.OPTIMAL) {
            LOGGER.warn("Balance relaxed problem could not be solved ({}), infeasibility not located",
                    solution != null ? solution.status() : "solver not supported");
            return List.of();
        }

        double tolerance = parameters.getBalanceTolerance();
        List<BalanceViolation> violations = new ArrayList<>();
        for (IesBus bus : network.getBuses()) {
            for (int t = 0; t < network.getHorizon(); t++) {
                double shortfall = solution.values().getOrDefault(new VariableRef(bus.getNum(), DispatchVariableType.BALANCE_SHORTFALL, t), 0.0);
                double surplus = solution.values().getOrDefault(new VariableRef(bus.getNum(), DispatchVariableType.BALANCE_SURPLUS, t), 0.0);
                if (shortfall > tolerance || surplus > tolerance) {
                    violations.add(new BalanceViolation(bus.getCarrier(), t,
                            shortfall > tolerance ? shortfall : 0, surplus > tolerance ? surplus : 0));
                }
            }
        }
        LOGGER.debug("{} balance violation(s) located, total relaxation {}", violations.size(), solution.objectiveValue());
        return violations;
    }
}
