/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.commons.parameters.Parameter;
import com.powsybl.commons.parameters.ParameterType;
import com.powsybl.openies.network.DeviceCatalog;
import com.powsybl.openies.opt.ProblemType;
import com.powsybl.openies.opt.SolveMode;
import com.powsybl.openies.opt.StorageBoundaryPolicy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parameters of a dispatch run.
 *
 * @author Open IES developers
 */
public class OpenIesParameters {

    public static final String MODULE_NAME = "open-ies-default-parameters";

    public static final SolveMode SOLVE_MODE_DEFAULT_VALUE = SolveMode.AUTO;

    public static final String LP_SOLVER_NAME_DEFAULT_VALUE = "highs";

    public static final String MILP_SOLVER_NAME_DEFAULT_VALUE = "scip";

    public static final double TIME_LIMIT_DEFAULT_VALUE = 60;

    public static final StorageBoundaryPolicy STORAGE_BOUNDARY_POLICY_DEFAULT_VALUE = StorageBoundaryPolicy.CYCLIC;

    public static final double BALANCE_TOLERANCE_DEFAULT_VALUE = 1e-6;

    public static final boolean INFEASIBILITY_DIAGNOSIS_DEFAULT_VALUE = true;

    public static final boolean SOLVER_OUTPUT_DEFAULT_VALUE = false;

    public static final String SOLVE_MODE_PARAM_NAME = "solveMode";

    public static final String LP_SOLVER_NAME_PARAM_NAME = "lpSolverName";

    public static final String MILP_SOLVER_NAME_PARAM_NAME = "milpSolverName";

    public static final String TIME_LIMIT_PARAM_NAME = "timeLimit";

    public static final String STORAGE_BOUNDARY_POLICY_PARAM_NAME = "storageBoundaryPolicy";

    public static final String BALANCE_TOLERANCE_PARAM_NAME = "balanceTolerance";

    public static final String INFEASIBILITY_DIAGNOSIS_PARAM_NAME = "infeasibilityDiagnosis";

    public static final String SOLVER_OUTPUT_PARAM_NAME = "solverOutput";

    public static final List<Parameter> SPECIFIC_PARAMETERS = List.of(
        new Parameter(SOLVE_MODE_PARAM_NAME, ParameterType.STRING, "Requested problem type", SOLVE_MODE_DEFAULT_VALUE.name(), DeviceCatalog.getEnumPossibleValues(SolveMode.class)),
        new Parameter(LP_SOLVER_NAME_PARAM_NAME, ParameterType.STRING, "OR-Tools solver used for LP problems", LP_SOLVER_NAME_DEFAULT_VALUE),
        new Parameter(MILP_SOLVER_NAME_PARAM_NAME, ParameterType.STRING, "OR-Tools solver used for MILP problems", MILP_SOLVER_NAME_DEFAULT_VALUE),
        new Parameter(TIME_LIMIT_PARAM_NAME, ParameterType.DOUBLE, "Solver time limit in seconds", TIME_LIMIT_DEFAULT_VALUE),
        new Parameter(STORAGE_BOUNDARY_POLICY_PARAM_NAME, ParameterType.STRING, "State of charge boundary condition", STORAGE_BOUNDARY_POLICY_DEFAULT_VALUE.name(), DeviceCatalog.getEnumPossibleValues(StorageBoundaryPolicy.class)),
        new Parameter(BALANCE_TOLERANCE_PARAM_NAME, ParameterType.DOUBLE, "Tolerance on bus balance and infeasibility violations", BALANCE_TOLERANCE_DEFAULT_VALUE),
        new Parameter(INFEASIBILITY_DIAGNOSIS_PARAM_NAME, ParameterType.BOOLEAN, "Locate balance violations of infeasible problems", INFEASIBILITY_DIAGNOSIS_DEFAULT_VALUE),
        new Parameter(SOLVER_OUTPUT_PARAM_NAME, ParameterType.BOOLEAN, "Print solver logs", SOLVER_OUTPUT_DEFAULT_VALUE)
    );

    private SolveMode solveMode = SOLVE_MODE_DEFAULT_VALUE;

    private String lpSolverName = LP_SOLVER_NAME_DEFAULT_VALUE;

    private String milpSolverName = MILP_SOLVER_NAME_DEFAULT_VALUE;

    private double timeLimit = TIME_LIMIT_DEFAULT_VALUE;

    private StorageBoundaryPolicy storageBoundaryPolicy = STORAGE_BOUNDARY_POLICY_DEFAULT_VALUE;

    private double balanceTolerance = BALANCE_TOLERANCE_DEFAULT_VALUE;

    private boolean infeasibilityDiagnosis = INFEASIBILITY_DIAGNOSIS_DEFAULT_VALUE;

    private boolean solverOutput = SOLVER_OUTPUT_DEFAULT_VALUE;

    public static double checkParameterValue(double parameterValue, boolean condition, String parameterName) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": " + parameterValue);
        }
        return parameterValue;
    }

    public SolveMode getSolveMode() {
        return solveMode;
    }

    public OpenIesParameters setSolveMode(SolveMode solveMode) {
        this.solveMode = Objects.requireNonNull(solveMode);
        return this;
    }

    public String getLpSolverName() {
        return lpSolverName;
    }

    public OpenIesParameters setLpSolverName(String lpSolverName) {
        this.lpSolverName = Objects.requireNonNull(lpSolverName);
        return this;
    }

    public String getMilpSolverName() {
        return milpSolverName;
    }

    public OpenIesParameters setMilpSolverName(String milpSolverName) {
        this.milpSolverName = Objects.requireNonNull(milpSolverName);
        return this;
    }

    public String getSolverName(ProblemType problemType) {
        return problemType == ProblemType.MILP ? milpSolverName : lpSolverName;
    }

    /**
     * Solver time limit in seconds.
     */
    public double getTimeLimit() {
        return timeLimit;
    }

    public OpenIesParameters setTimeLimit(double timeLimit) {
        this.timeLimit = checkParameterValue(timeLimit, timeLimit > 0, TIME_LIMIT_PARAM_NAME);
        return this;
    }

    public StorageBoundaryPolicy getStorageBoundaryPolicy() {
        return storageBoundaryPolicy;
    }

    public OpenIesParameters setStorageBoundaryPolicy(StorageBoundaryPolicy storageBoundaryPolicy) {
        this.storageBoundaryPolicy = Objects.requireNonNull(storageBoundaryPolicy);
        return this;
    }

    public double getBalanceTolerance() {
        return balanceTolerance;
    }

    public OpenIesParameters setBalanceTolerance(double balanceTolerance) {
        this.balanceTolerance = checkParameterValue(balanceTolerance, balanceTolerance > 0, BALANCE_TOLERANCE_PARAM_NAME);
        return this;
    }

    public boolean isInfeasibilityDiagnosis() {
        return infeasibilityDiagnosis;
    }

    public OpenIesParameters setInfeasibilityDiagnosis(boolean infeasibilityDiagnosis) {
        this.infeasibilityDiagnosis = infeasibilityDiagnosis;
        return this;
    }

    public boolean isSolverOutput() {
        return solverOutput;
    }

    public OpenIesParameters setSolverOutput(boolean solverOutput) {
        this.solverOutput = solverOutput;
        return this;
    }

    public static OpenIesParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static OpenIesParameters load(PlatformConfig platformConfig) {
        OpenIesParameters parameters = new OpenIesParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setSolveMode(config.getEnumProperty(SOLVE_MODE_PARAM_NAME, SolveMode.class, SOLVE_MODE_DEFAULT_VALUE))
                .setLpSolverName(config.getStringProperty(LP_SOLVER_NAME_PARAM_NAME, LP_SOLVER_NAME_DEFAULT_VALUE))
                .setMilpSolverName(config.getStringProperty(MILP_SOLVER_NAME_PARAM_NAME, MILP_SOLVER_NAME_DEFAULT_VALUE))
                .setTimeLimit(config.getDoubleProperty(TIME_LIMIT_PARAM_NAME, TIME_LIMIT_DEFAULT_VALUE))
                .setStorageBoundaryPolicy(config.getEnumProperty(STORAGE_BOUNDARY_POLICY_PARAM_NAME, StorageBoundaryPolicy.class, STORAGE_BOUNDARY_POLICY_DEFAULT_VALUE))
                .setBalanceTolerance(config.getDoubleProperty(BALANCE_TOLERANCE_PARAM_NAME, BALANCE_TOLERANCE_DEFAULT_VALUE))
                .setInfeasibilityDiagnosis(config.getBooleanProperty(INFEASIBILITY_DIAGNOSIS_PARAM_NAME, INFEASIBILITY_DIAGNOSIS_DEFAULT_VALUE))
                .setSolverOutput(config.getBooleanProperty(SOLVER_OUTPUT_PARAM_NAME, SOLVER_OUTPUT_DEFAULT_VALUE)));
        return parameters;
    }

    public static OpenIesParameters load(Map<String, String> properties) {
        return new OpenIesParameters().update(properties);
    }

    public OpenIesParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(SOLVE_MODE_PARAM_NAME))
                .ifPresent(prop -> this.setSolveMode(SolveMode.valueOf(prop)));
        Optional.ofNullable(properties.get(LP_SOLVER_NAME_PARAM_NAME))
                .ifPresent(this::setLpSolverName);
        Optional.ofNullable(properties.get(MILP_SOLVER_NAME_PARAM_NAME))
                .ifPresent(this::setMilpSolverName);
        Optional.ofNullable(properties.get(TIME_LIMIT_PARAM_NAME))
                .ifPresent(prop -> this.setTimeLimit(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(STORAGE_BOUNDARY_POLICY_PARAM_NAME))
                .ifPresent(prop -> this.setStorageBoundaryPolicy(StorageBoundaryPolicy.valueOf(prop)));
        Optional.ofNullable(properties.get(BALANCE_TOLERANCE_PARAM_NAME))
                .ifPresent(prop -> this.setBalanceTolerance(Double.parseDouble(prop)));
        Optional.ofNullable(properties.get(INFEASIBILITY_DIAGNOSIS_PARAM_NAME))
                .ifPresent(prop -> this.setInfeasibilityDiagnosis(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(SOLVER_OUTPUT_PARAM_NAME))
                .ifPresent(prop -> this.setSolverOutput(Boolean.parseBoolean(prop)));
        return this;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(SOLVE_MODE_PARAM_NAME, solveMode);
        map.put(LP_SOLVER_NAME_PARAM_NAME, lpSolverName);
        map.put(MILP_SOLVER_NAME_PARAM_NAME, milpSolverName);
        map.put(TIME_LIMIT_PARAM_NAME, timeLimit);
        map.put(STORAGE_BOUNDARY_POLICY_PARAM_NAME, storageBoundaryPolicy);
        map.put(BALANCE_TOLERANCE_PARAM_NAME, balanceTolerance);
        map.put(INFEASIBILITY_DIAGNOSIS_PARAM_NAME, infeasibilityDiagnosis);
        map.put(SOLVER_OUTPUT_PARAM_NAME, solverOutput);
        return map;
    }

    @Override
    public String toString() {
        return "OpenIesParameters(" + toMap().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ")";
    }
}
