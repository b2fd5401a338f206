/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.network.DeviceSpec;
import com.powsybl.openies.network.IesNetwork;
import com.powsybl.openies.network.IesNetworkBuilder;
import com.powsybl.openies.network.Scenario;
import com.powsybl.openies.opt.DispatchProblem;
import com.powsybl.openies.opt.DispatchProblemFormulator;
import com.powsybl.openies.result.DispatchResult;
import com.powsybl.openies.result.ResultExtractor;
import com.powsybl.openies.solver.DispatchSolver;
import com.powsybl.openies.solver.OrToolsDispatchSolver;
import com.powsybl.openies.solver.SolverResult;
import com.powsybl.openies.util.Markers;
import com.powsybl.openies.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Entry point of a dispatch run: builds the network, formulates and solves the problem and extracts the result.
 * Every run works on its own network and problem, so runs can be executed in parallel.
 * <p>
 * Invalid devices or scenarios are thrown as {@link com.powsybl.openies.network.ConfigurationException}, solve
 * failures are returned in the result.
 *
 * @author Open IES developers
 */
public final class OpenIesDispatch {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenIesDispatch.class);

    private final Function<OpenIesParameters, DispatchSolver> solverFactory;

    public OpenIesDispatch() {
        this(OrToolsDispatchSolver::new);
    }

    public OpenIesDispatch(Function<OpenIesParameters, DispatchSolver> solverFactory) {
        this.solverFactory = Objects.requireNonNull(solverFactory);
    }

    public static DispatchResult run(List<DeviceSpec> devices, Scenario scenario) {
        return new OpenIesDispatch().run(devices, scenario, OpenIesParameters.load(), ReportNode.NO_OP);
    }

    public DispatchResult run(List<DeviceSpec> devices, Scenario scenario, OpenIesParameters parameters, ReportNode reportNode) {
        Objects.requireNonNull(devices);
        Objects.requireNonNull(scenario);
        Objects.requireNonNull(parameters);
        Objects.requireNonNull(reportNode);

        LOGGER.info("Dispatch of {} devices over {} timesteps, parameters: {}", devices.size(), scenario.getHorizon(), parameters);
        ReportNode dispatchReportNode = Reports.createDispatchReporter(reportNode, scenario.getHorizon());

        Stopwatch stopwatch = Stopwatch.createStarted();

        IesNetwork network = IesNetworkBuilder.build(devices, scenario, dispatchReportNode);
        DispatchProblem problem = new DispatchProblemFormulator(parameters).formulate(network, dispatchReportNode);
        DispatchSolver solver = solverFactory.apply(parameters);
        SolverResult solverResult = solver.solve(problem, dispatchReportNode);
        DispatchResult result = new ResultExtractor(parameters.getBalanceTolerance()).extract(problem, solverResult, dispatchReportNode);

        stopwatch.stop();
        LOGGER.info(Markers.PERFORMANCE_MARKER, "Dispatch ran in {} ms: {}", stopwatch.elapsed(TimeUnit.MILLISECONDS), result);

        return result;
    }

    public CompletableFuture<DispatchResult> runAsync(List<DeviceSpec> devices, Scenario scenario, OpenIesParameters parameters,
                                                      ReportNode reportNode, Executor executor) {
        Objects.requireNonNull(executor);
        return CompletableFuture.supplyAsync(() -> run(devices, scenario, parameters, reportNode), executor);
    }
}
