/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.openies.opt.CostCategory;
import com.powsybl.openies.opt.CostTerm;
import com.powsybl.openies.opt.DispatchVariableType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A converter withdrawing one input carrier and injecting one or more output carriers at fixed efficiencies.
 * A link may have several operating modes sharing the same capacity; a heat pump has a heating and a cooling mode
 * and its capacity is expressed on the thermal output side.
 *
 * @author Open IES developers
 */
public final class IesLink extends AbstractIesDevice implements IesDevice {

    private final Carrier inputCarrier;

    private final List<LinkMode> modes;

    private final LinkCapacityBasis capacityBasis;

    private final boolean modeExclusive;

    private final HeatPumpFamily heatPumpFamily;

    private IesLink(String id, DeviceType type, Carrier inputCarrier, List<LinkMode> modes, LinkCapacityBasis capacityBasis,
                    boolean modeExclusive, HeatPumpFamily heatPumpFamily, double capacity, double marginalCost, boolean extendable) {
        super(id, type, capacity, marginalCost, extendable);
        this.inputCarrier = Objects.requireNonNull(inputCarrier);
        this.modes = List.copyOf(modes);
        this.capacityBasis = Objects.requireNonNull(capacityBasis);
        this.modeExclusive = modeExclusive;
        this.heatPumpFamily = heatPumpFamily;
        if (this.modes.isEmpty()) {
            throw new IllegalArgumentException("Link '" + id + "' has no operating mode");
        }
    }

    /**
     * Single mode converter whose capacity bounds the input flow.
     */
    public static IesLink createConverter(String id, DeviceType type, Carrier inputCarrier, LinkMode mode, double capacity,
                                          double marginalCost, boolean extendable) {
        return new IesLink(id, type, inputCarrier, List.of(mode), LinkCapacityBasis.INPUT, false, null, capacity,
                marginalCost, extendable);
    }

    public static IesLink createHeatPump(String id, HeatPumpFamily family, double capacity, double cop, double eer,
                                         boolean modeExclusive, double marginalCost, boolean extendable) {
        List<LinkMode> modes = List.of(LinkMode.of(OperatingMode.HEATING, Carrier.HEAT, cop),
                                       LinkMode.of(OperatingMode.COOLING, Carrier.COOLING, eer));
        return new IesLink(id, DeviceType.HEAT_PUMP, Carrier.ELECTRICITY, modes, LinkCapacityBasis.OUTPUT, modeExclusive,
                Objects.requireNonNull(family), capacity, marginalCost, extendable);
    }

    public Carrier getInputCarrier() {
        return inputCarrier;
    }

    public List<LinkMode> getModes() {
        return modes;
    }

    public Optional<LinkMode> getMode(OperatingMode operatingMode) {
        return modes.stream().filter(m -> m.mode() == operatingMode).findFirst();
    }

    public LinkCapacityBasis getCapacityBasis() {
        return capacityBasis;
    }

    /**
     * True if at most one mode may run per timestep, which needs binary indicators.
     */
    public boolean isModeExclusive() {
        return modeExclusive && modes.size() > 1;
    }

    public Optional<HeatPumpFamily> getHeatPumpFamily() {
        return Optional.ofNullable(heatPumpFamily);
    }

    /**
     * Amount of capacity consumed per unit of input flow of the given mode.
     */
    public double getCapacityFactor(LinkMode mode) {
        return capacityBasis == LinkCapacityBasis.INPUT ? 1 : mode.getTotalEfficiency();
    }

    @Override
    public Set<Carrier> getCarriers() {
        Set<Carrier> carriers = EnumSet.of(inputCarrier);
        for (LinkMode mode : modes) {
            carriers.addAll(mode.efficiencies().keySet());
        }
        return Collections.unmodifiableSet(carriers);
    }

    @Override
    public List<DispatchVariableType> getVariableTypes() {
        List<DispatchVariableType> variableTypes = new ArrayList<>();
        for (LinkMode mode : modes) {
            variableTypes.add(mode.mode().getInputVariableType());
        }
        if (isModeExclusive()) {
            for (LinkMode mode : modes) {
                mode.mode().getIndicatorVariableType().ifPresent(variableTypes::add);
            }
        }
        return variableTypes;
    }

    @Override
    public double getMaxValue(DispatchVariableType variableType, int timestep) {
        if (variableType.isBinary()) {
            return 1;
        }
        return modes.stream()
                .filter(m -> m.mode().getInputVariableType() == variableType)
                .findFirst()
                .map(m -> capacity / getCapacityFactor(m))
                .orElseThrow(() -> unknownVariableType(variableType));
    }

    @Override
    public List<BalanceTerm> getBalanceTerms(Carrier carrier) {
        List<BalanceTerm> terms = new ArrayList<>();
        for (LinkMode mode : modes) {
            DispatchVariableType inputType = mode.mode().getInputVariableType();
            if (carrier == inputCarrier) {
                terms.add(new BalanceTerm(inputType, -1));
            }
            double efficiency = mode.getEfficiency(carrier);
            if (efficiency != 0) {
                terms.add(new BalanceTerm(inputType, efficiency));
            }
        }
        return terms;
    }

    @Override
    public List<CostTerm> getCostTerms(int timestep) {
        if (marginalCost == 0) {
            return List.of();
        }
        List<CostTerm> terms = new ArrayList<>(modes.size());
        for (LinkMode mode : modes) {
            terms.add(new CostTerm(variable(mode.mode().getInputVariableType(), timestep), marginalCost, CostCategory.FUEL));
        }
        return terms;
    }
}
