/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.opt;

import com.google.common.base.Stopwatch;
import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.LinearExprBuilder;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.Variable;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.OpenIesParameters;
import com.powsybl.openies.constraints.BusBalanceConstraintGenerator;
import com.powsybl.openies.constraints.ConstraintGenerator;
import com.powsybl.openies.constraints.ConstraintKind;
import com.powsybl.openies.constraints.ConstraintSet;
import com.powsybl.openies.constraints.HeatPumpModeExclusivityConstraintGenerator;
import com.powsybl.openies.constraints.LinearConstraint;
import com.powsybl.openies.constraints.LinearTerm;
import com.powsybl.openies.constraints.LinkCapacityConstraintGenerator;
import com.powsybl.openies.constraints.StorageStateOfChargeConstraintGenerator;
import com.powsybl.openies.network.IesBus;
import com.powsybl.openies.network.IesDevice;
import com.powsybl.openies.network.IesNetwork;
import com.powsybl.openies.util.Markers;
import com.powsybl.openies.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Assembles the variables, constraints and objective of a dispatch problem over the whole horizon and translates
 * them into an OR-Tools model. The network is only read.
 *
 * @author Open IES developers
 */
public class DispatchProblemFormulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DispatchProblemFormulator.class);

    private final OpenIesParameters parameters;

    public DispatchProblemFormulator(OpenIesParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public List<ConstraintGenerator> createConstraintGenerators() {
        return List.of(new BusBalanceConstraintGenerator(),
                       new StorageStateOfChargeConstraintGenerator(parameters.getStorageBoundaryPolicy()),
                       new LinkCapacityConstraintGenerator(),
                       new HeatPumpModeExclusivityConstraintGenerator());
    }

    /**
     * MILP is needed only when a discrete mode decision exists. An LP request on such a network is promoted to MILP,
     * exclusivity is never relaxed.
     */
    public static ProblemType getProblemType(SolveMode solveMode, IesNetwork network, ReportNode reportNode) {
        boolean exclusivity = network.hasModeExclusivity();
        return switch (solveMode) {
            case MILP -> ProblemType.MILP;
            case AUTO -> exclusivity ? ProblemType.MILP : ProblemType.LP;
            case LP -> {
                if (exclusivity) {
                    int exclusiveLinkCount = network.getExclusiveLinks().size();
                    LOGGER.warn("LP requested but {} device(s) need mode exclusivity, solving as MILP", exclusiveLinkCount);
                    Reports.reportMilpPromotion(reportNode, exclusiveLinkCount);
                    yield ProblemType.MILP;
                }
                yield ProblemType.LP;
            }
        };
    }

    public DispatchProblem formulate(IesNetwork network) {
        return formulate(network, ReportNode.NO_OP);
    }

    public DispatchProblem formulate(IesNetwork network, ReportNode reportNode) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(reportNode);
        ProblemType problemType = getProblemType(parameters.getSolveMode(), network, reportNode);
        DispatchProblem problem = formulate(network, problemType, false);
        Reports.reportProblemSize(reportNode, problemType.name(), problem.getVariableCount(), problem.getBinaryVariableCount(),
                problem.getConstraints().size());
        return problem;
    }

    /**
     * Balance relaxed variant: every bus balance gets a shortfall and a surplus variable and the objective is their
     * sum, so that the problem is feasible whenever the other constraints are.
     */
    public DispatchProblem formulateElastic(IesNetwork network) {
        Objects.requireNonNull(network);
        ProblemType problemType = network.hasModeExclusivity() ? ProblemType.MILP : ProblemType.LP;
        return formulate(network, problemType, true);
    }

    private DispatchProblem formulate(IesNetwork network, ProblemType problemType, boolean elastic) {
        Loader.loadNativeLibraries();

        Stopwatch stopwatch = Stopwatch.createStarted();

        ModelBuilder model = new ModelBuilder();
        Map<VariableRef, Variable> variables = new LinkedHashMap<>();
        int horizon = network.getHorizon();
        for (IesDevice device : network.getDevices()) {
            for (DispatchVariableType type : device.getVariableTypes()) {
                for (int t = 0; t < horizon; t++) {
                    VariableRef ref = new VariableRef(device.getNum(), type, t);
                    Variable variable;
                    if (type.isBinary() && problemType == ProblemType.MILP) {
                        variable = model.newBoolVar(ref.getName());
                    } else {
                        variable = model.newNumVar(device.getMinValue(type, t), device.getMaxValue(type, t), ref.getName());
                    }
                    variables.put(ref, variable);
                }
            }
        }

        ConstraintSet constraints = new ConstraintSet();
        for (ConstraintGenerator generator : createConstraintGenerators()) {
            int before = constraints.size();
            generator.generate(network, constraints);
            LOGGER.debug("Constraint generator '{}' added {} constraints", generator.getName(), constraints.size() - before);
        }

        Map<String, List<Variable>> balanceSlacks = elastic ? createBalanceSlacks(network, model, variables) : Map.of();
        for (LinearConstraint constraint : constraints.getConstraints()) {
            addConstraint(model, variables, constraint, balanceSlacks);
        }

        List<CostTerm> costTerms = new ArrayList<>();
        LinearExprBuilder objective = LinearExpr.newBuilder();
        if (elastic) {
            variables.forEach((ref, variable) -> {
                if (ref.type().isBusVariable()) {
                    objective.addTerm(variable, 1);
                }
            });
        } else {
            for (IesDevice device : network.getDevices()) {
                for (int t = 0; t < horizon; t++) {
                    for (CostTerm costTerm : device.getCostTerms(t)) {
                        costTerms.add(costTerm);
                        objective.addTerm(variables.get(costTerm.variable()), costTerm.coefficient());
                    }
                }
            }
        }
        model.minimize(objective.build());

        stopwatch.stop();
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "{}{} problem formulated in {} ms: {} variables, {} constraints",
                problemType, elastic ? " elastic" : "", stopwatch.elapsed(TimeUnit.MILLISECONDS), variables.size(), constraints.size());

        return new DispatchProblem(network, problemType, elastic, variables, constraints, costTerms, model);
    }

    private static Map<String, List<Variable>> createBalanceSlacks(IesNetwork network, ModelBuilder model, Map<VariableRef, Variable> variables) {
        Map<String, List<Variable>> slacks = new LinkedHashMap<>();
        for (IesBus bus : network.getBuses()) {
            for (int t = 0; t < network.getHorizon(); t++) {
                VariableRef shortfallRef = new VariableRef(bus.getNum(), DispatchVariableType.BALANCE_SHORTFALL, t);
                VariableRef surplusRef = new VariableRef(bus.getNum(), DispatchVariableType.BALANCE_SURPLUS, t);
                Variable shortfall = model.newNumVar(0, Double.POSITIVE_INFINITY, shortfallRef.getName());
                Variable surplus = model.newNumVar(0, Double.POSITIVE_INFINITY, surplusRef.getName());
                variables.put(shortfallRef, shortfall);
                variables.put(surplusRef, surplus);
                slacks.put(BusBalanceConstraintGenerator.getConstraintName(bus, t), List.of(shortfall, surplus));
            }
        }
        return slacks;
    }

    private static void addConstraint(ModelBuilder model, Map<VariableRef, Variable> variables, LinearConstraint constraint,
                                      Map<String, List<Variable>> balanceSlacks) {
        LinearExprBuilder expr = LinearExpr.newBuilder();
        for (LinearTerm term : constraint.getTerms()) {
            Variable variable = variables.get(term.variable());
            if (variable == null) {
                throw new IllegalStateException("Constraint '" + constraint.getName() + "' references undeclared variable " + term.variable());
            }
            expr.addTerm(variable, term.coefficient());
        }
        if (constraint.getKind() == ConstraintKind.BUS_BALANCE) {
            List<Variable> slacks = balanceSlacks.get(constraint.getName());
            if (slacks != null) {
                expr.addTerm(slacks.get(0), 1);
                expr.addTerm(slacks.get(1), -1);
            }
        }
        switch (constraint.getSense()) {
            case LESS_OR_EQUAL -> model.addLessOrEqual(expr.build(), constraint.getRhs());
            case GREATER_OR_EQUAL -> model.addGreaterOrEqual(expr.build(), constraint.getRhs());
            case EQUAL -> model.addEquality(expr.build(), constraint.getRhs());
        }
    }
}
