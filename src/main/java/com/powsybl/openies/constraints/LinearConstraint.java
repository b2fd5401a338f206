/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.constraints;

import com.powsybl.openies.network.Carrier;
import com.powsybl.openies.opt.VariableRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Solver independent linear constraint {@code sum(coefficient * variable) sense rhs}, tagged with the timestep and
 * the bus carrier or device it belongs to.
 *
 * @author Open IES developers
 */
public final class LinearConstraint {

    private final String name;

    private final ConstraintKind kind;

    private final List<LinearTerm> terms;

    private final ConstraintSense sense;

    private final double rhs;

    private final int timestep;

    private final Carrier carrier;

    private final String deviceId;

    private LinearConstraint(String name, ConstraintKind kind, List<LinearTerm> terms, ConstraintSense sense, double rhs,
                             int timestep, Carrier carrier, String deviceId) {
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.terms = List.copyOf(terms);
        this.sense = Objects.requireNonNull(sense);
        this.rhs = rhs;
        this.timestep = timestep;
        this.carrier = carrier;
        this.deviceId = deviceId;
    }

    public static Builder builder(String name, ConstraintKind kind, int timestep) {
        return new Builder(name, kind, timestep);
    }

    public String getName() {
        return name;
    }

    public ConstraintKind getKind() {
        return kind;
    }

    public List<LinearTerm> getTerms() {
        return terms;
    }

    public ConstraintSense getSense() {
        return sense;
    }

    public double getRhs() {
        return rhs;
    }

    public int getTimestep() {
        return timestep;
    }

    public Optional<Carrier> getCarrier() {
        return Optional.ofNullable(carrier);
    }

    public Optional<String> getDeviceId() {
        return Optional.ofNullable(deviceId);
    }

    public double evalLhs(ToDoubleFunction<VariableRef> values) {
        double lhs = 0;
        for (LinearTerm term : terms) {
            lhs += term.coefficient() * values.applyAsDouble(term.variable());
        }
        return lhs;
    }

    /**
     * Amount by which the constraint is violated by the given variable values, zero if satisfied.
     */
    public double getViolation(ToDoubleFunction<VariableRef> values) {
        double lhs = evalLhs(values);
        return switch (sense) {
            case LESS_OR_EQUAL -> Math.max(0, lhs - rhs);
            case GREATER_OR_EQUAL -> Math.max(0, rhs - lhs);
            case EQUAL -> Math.abs(lhs - rhs);
        };
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(name).append(": ");
        for (int i = 0; i < terms.size(); i++) {
            LinearTerm term = terms.get(i);
            if (i > 0) {
                builder.append(" + ");
            }
            builder.append(term.coefficient()).append('*').append(term.variable());
        }
        return builder.append(' ').append(sense.getSymbol()).append(' ').append(rhs).toString();
    }

    public static final class Builder {

        private final String name;

        private final ConstraintKind kind;

        private final int timestep;

        private final Map<VariableRef, Double> coefficients = new LinkedHashMap<>();

        private Carrier carrier;

        private String deviceId;

        private Builder(String name, ConstraintKind kind, int timestep) {
            this.name = name;
            this.kind = kind;
            this.timestep = timestep;
        }

        /**
         * Adds a term, summing the coefficients of terms on the same variable.
         */
        public Builder addTerm(VariableRef variable, double coefficient) {
            coefficients.merge(Objects.requireNonNull(variable), coefficient, Double::sum);
            return this;
        }

        public Builder setCarrier(Carrier carrier) {
            this.carrier = carrier;
            return this;
        }

        public Builder setDeviceId(String deviceId) {
            this.deviceId = deviceId;
            return this;
        }

        private LinearConstraint build(ConstraintSense sense, double rhs) {
            List<LinearTerm> terms = new ArrayList<>(coefficients.size());
            coefficients.forEach((variable, coefficient) -> {
                if (coefficient != 0) {
                    terms.add(new LinearTerm(variable, coefficient));
                }
            });
            return new LinearConstraint(name, kind, terms, sense, rhs, timestep, carrier, deviceId);
        }

        public LinearConstraint lessOrEqual(double rhs) {
            return build(ConstraintSense.LESS_OR_EQUAL, rhs);
        }

        public LinearConstraint greaterOrEqual(double rhs) {
            return build(ConstraintSense.GREATER_OR_EQUAL, rhs);
        }

        public LinearConstraint equalTo(double rhs) {
            return build(ConstraintSense.EQUAL, rhs);
        }
    }
}
