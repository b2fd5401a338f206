/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.solver;

import com.google.common.base.Stopwatch;
import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.ModelSolver;
import com.google.ortools.modelbuilder.SolveStatus;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.OpenIesParameters;
import com.powsybl.openies.opt.DispatchProblem;
import com.powsybl.openies.opt.VariableRef;
import com.powsybl.openies.util.Markers;
import com.powsybl.openies.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Solves dispatch problems with the OR-Tools model builder solvers. Non optimal statuses are cross-checked with the
 * balance relaxed problem to tell an infeasible balance from an unbounded or broken model.
 *
 * @author Open IES developers
 */
public class OrToolsDispatchSolver implements DispatchSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrToolsDispatchSolver.class);

    public static final String NAME = "OR-Tools";

    record ModelSolution(String solverName, SolveStatus status, Map<VariableRef, Double> values, double objectiveValue,
                         long solveTimeMillis, boolean timeLimitReached) {
    }

    private final OpenIesParameters parameters;

    private final InfeasibilityDiagnoser diagnoser;

    public OrToolsDispatchSolver(OpenIesParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
        this.diagnoser = new InfeasibilityDiagnoser(parameters);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Time limit in seconds as a duration of at least one nanosecond.
     */
    static Duration toDuration(double timeLimit) {
        return Duration.ofNanos(Math.max(1, Math.round(timeLimit * 1e9)));
    }

    /**
     * Runs the solver configured for the problem type, null if this solver is not available in the OR-Tools build.
     */
    static ModelSolution solveModel(DispatchProblem problem, OpenIesParameters parameters) {
        Loader.loadNativeLibraries();
        String solverName = parameters.getSolverName(problem.getProblemType());
        ModelSolver solver = new ModelSolver(solverName);
        if (!solver.solverIsSupported()) {
            return null;
        }
        solver.setTimeLimit(toDuration(parameters.getTimeLimit()));
        solver.enableOutput(parameters.isSolverOutput());

        Stopwatch stopwatch = Stopwatch.createStarted();
        SolveStatus status = solver.solve(problem.getModel());
        stopwatch.stop();
        long solveTimeMillis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        LOGGER.debug(Markers.PERFORMANCE_MARKER, "{} problem solved by '{}' with status {} in {} ms", problem, solverName, status, solveTimeMillis);

        Map<VariableRef, Double> values = new HashMap<>();
        double objectiveValue = Double.NaN;
        if (status == SolveStatus.OPTIMAL || status == SolveStatus.FEASIBLE) {
            for (VariableRef ref : problem.getVariableRefs()) {
                values.put(ref, solver.getValue(problem.getVariable(ref)));
            }
            objectiveValue = solver.getObjectiveValue();
        }
        boolean timeLimitReached = stopwatch.elapsed().compareTo(toDuration(parameters.getTimeLimit())) >= 0;
        return new ModelSolution(solverName, status, values, objectiveValue, solveTimeMillis, timeLimitReached);
    }

    @Override
    public SolverResult solve(DispatchProblem problem, ReportNode reportNode) {
        Objects.requireNonNull(problem);
        Objects.requireNonNull(reportNode);

        String solverName = parameters.getSolverName(problem.getProblemType());
        ModelSolution solution = solveModel(problem, parameters);
        if (solution == null) {
            return fail(solverName, new SolveFailure(SolveFailureKind.SOLVER_ERROR,
                    "Solver '" + solverName + "' is not supported by this OR-Tools installation"), 0, reportNode);
        }
        return toResult(problem, solution, reportNode);
    }

    /**
     * Maps the solver status to a result. A feasible but not optimal solution or a solve stopped at the time limit
     * is a timeout.
     */
    SolverResult toResult(DispatchProblem problem, ModelSolution solution, ReportNode reportNode) {
        String solverName = solution.solverName();
        Reports.reportSolveStatus(reportNode, solverName, solution.status().name());

        return switch (solution.status()) {
            case OPTIMAL -> {
                LOGGER.info("Dispatch problem solved by '{}' with objective {}", solverName, solution.objectiveValue());
                yield SolverResult.success(solverName, solution.values(), solution.objectiveValue(), solution.solveTimeMillis());
            }
            case FEASIBLE -> timeout(solverName, solution, reportNode);
            case INFEASIBLE, UNBOUNDED -> fail(solverName, classify(problem, solution.status(), reportNode), solution.solveTimeMillis(), reportNode);
            default -> {
                if (solution.timeLimitReached()) {
                    yield timeout(solverName, solution, reportNode);
                }
                yield fail(solverName, classify(problem, solution.status(), reportNode), solution.solveTimeMillis(), reportNode);
            }
        };
    }

    /**
     * Tells apart a balance that cannot be met from an unbounded or abnormally terminated model, some solvers not
     * distinguishing infeasible from unbounded.
     */
    private SolveFailure classify(DispatchProblem problem, SolveStatus status, ReportNode reportNode) {
        if (!parameters.isInfeasibilityDiagnosis()) {
            return switch (status) {
                case INFEASIBLE -> new SolveFailure(SolveFailureKind.INFEASIBLE, "Solver status " + status);
                case UNBOUNDED -> new SolveFailure(SolveFailureKind.UNBOUNDED, "Solver status " + status);
                default -> new SolveFailure(SolveFailureKind.SOLVER_ERROR, "Solver status " + status);
            };
        }
        List<BalanceViolation> violations = diagnoser.diagnose(problem.getNetwork());
        if (!violations.isEmpty()) {
            for (BalanceViolation violation : violations) {
                Reports.reportInfeasibleBalance(reportNode, violation.carrier().getSymbol(), violation.timestep(),
                        violation.shortfall(), violation.surplus());
            }
            return new SolveFailure(SolveFailureKind.INFEASIBLE,
                    violations.size() + " bus balance(s) cannot be met", violations);
        }
        return switch (status) {
            case INFEASIBLE -> new SolveFailure(SolveFailureKind.INFEASIBLE, "Solver status " + status + ", no balance violation located");
            case UNBOUNDED -> new SolveFailure(SolveFailureKind.UNBOUNDED, "Objective is unbounded");
            default -> new SolveFailure(SolveFailureKind.SOLVER_ERROR, "Abnormal solver termination: " + status);
        };
    }

    private SolverResult timeout(String solverName, ModelSolution solution, ReportNode reportNode) {
        LOGGER.warn("Solver '{}' stopped at the time limit of {} s with status {}", solverName, parameters.getTimeLimit(), solution.status());
        return fail(solverName, SolveFailure.timeout(), solution.solveTimeMillis(), reportNode);
    }

    private static SolverResult fail(String solverName, SolveFailure failure, long solveTimeMillis, ReportNode reportNode) {
        LOGGER.warn("Dispatch problem not solved by '{}': {} ({})", solverName, failure.kind(), failure.reason());
        Reports.reportSolveFailure(reportNode, failure.kind().name(), failure.reason());
        return SolverResult.failure(solverName, failure, solveTimeMillis);
    }
}
