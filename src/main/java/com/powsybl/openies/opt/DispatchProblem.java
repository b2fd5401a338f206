/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.opt;

import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.Variable;
import com.powsybl.openies.constraints.ConstraintSet;
import com.powsybl.openies.network.IesNetwork;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A formulated dispatch problem: the solver independent variables, constraints and cost terms together with the
 * OR-Tools model they were translated into. Read-only once formulated.
 *
 * @author Open IES developers
 */
public class DispatchProblem {

    private final IesNetwork network;

    private final ProblemType problemType;

    private final boolean elastic;

    private final Map<VariableRef, Variable> variables;

    private final ConstraintSet constraints;

    private final List<CostTerm> costTerms;

    private final ModelBuilder model;

    DispatchProblem(IesNetwork network, ProblemType problemType, boolean elastic, Map<VariableRef, Variable> variables,
                    ConstraintSet constraints, List<CostTerm> costTerms, ModelBuilder model) {
        this.network = Objects.requireNonNull(network);
        this.problemType = Objects.requireNonNull(problemType);
        this.elastic = elastic;
        this.variables = Collections.unmodifiableMap(variables);
        this.constraints = Objects.requireNonNull(constraints);
        this.costTerms = List.copyOf(costTerms);
        this.model = Objects.requireNonNull(model);
    }

    public IesNetwork getNetwork() {
        return network;
    }

    public ProblemType getProblemType() {
        return problemType;
    }

    /**
     * True for the balance relaxed variant used to locate infeasibilities.
     */
    public boolean isElastic() {
        return elastic;
    }

    public Set<VariableRef> getVariableRefs() {
        return variables.keySet();
    }

    public boolean hasVariable(VariableRef ref) {
        return variables.containsKey(ref);
    }

    public Variable getVariable(VariableRef ref) {
        Variable variable = variables.get(ref);
        if (variable == null) {
            throw new IllegalArgumentException("Variable " + ref + " not found");
        }
        return variable;
    }

    public int getVariableCount() {
        return variables.size();
    }

    public int getBinaryVariableCount() {
        return (int) variables.keySet().stream().filter(ref -> ref.type().isBinary()).count();
    }

    public ConstraintSet getConstraints() {
        return constraints;
    }

    public List<CostTerm> getCostTerms() {
        return costTerms;
    }

    public ModelBuilder getModel() {
        return model;
    }

    @Override
    public String toString() {
        return "DispatchProblem(type=" + problemType + ", elastic=" + elastic + ", variables=" + variables.size()
                + ", constraints=" + constraints.size() + ")";
    }
}
