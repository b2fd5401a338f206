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
import com.powsybl.openies.tariff.Price;
import com.powsybl.openies.tariff.TariffSchedule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A generator injecting onto one bus. A grid tie generator imports at the tariff buy price and may also export at
 * the tariff sell price.
 *
 * @author Open IES developers
 */
public final class IesGenerator extends AbstractIesDevice implements IesDevice {

    private final Carrier carrier;

    private final double[] availability;

    private final TariffSchedule tariff;

    private final double exportCapacity;

    private IesGenerator(String id, DeviceType type, Carrier carrier, double capacity, double marginalCost, boolean extendable,
                         double[] availability, TariffSchedule tariff, double exportCapacity) {
        super(id, type, capacity, marginalCost, extendable);
        this.carrier = Objects.requireNonNull(carrier);
        this.availability = availability != null ? availability.clone() : null;
        this.tariff = tariff;
        this.exportCapacity = exportCapacity;
    }

    /**
     * Generator whose output is bounded by {@code capacity * availability[t]}, or by the capacity alone if no
     * availability series is given.
     */
    public static IesGenerator createGenerator(String id, DeviceType type, Carrier carrier, double capacity, double marginalCost,
                                               boolean extendable, double[] availability) {
        return new IesGenerator(id, type, carrier, capacity, marginalCost, extendable, availability, null, 0);
    }

    public static IesGenerator createGridTie(String id, double importCapacity, double exportCapacity, boolean extendable,
                                             TariffSchedule tariff) {
        return new IesGenerator(id, DeviceType.GRID, Carrier.ELECTRICITY, importCapacity, 0, extendable, null,
                Objects.requireNonNull(tariff), exportCapacity);
    }

    public boolean isGridTie() {
        return tariff != null;
    }

    public Carrier getCarrier() {
        return carrier;
    }

    public double getExportCapacity() {
        return exportCapacity;
    }

    public double getAvailability(int timestep) {
        return availability != null ? availability[timestep] : 1;
    }

    @Override
    public Set<Carrier> getCarriers() {
        return Set.of(carrier);
    }

    @Override
    public List<DispatchVariableType> getVariableTypes() {
        return isGridTie()
                ? List.of(DispatchVariableType.GRID_IMPORT, DispatchVariableType.GRID_EXPORT)
                : List.of(DispatchVariableType.GENERATION);
    }

    @Override
    public double getMaxValue(DispatchVariableType variableType, int timestep) {
        return switch (variableType) {
            case GENERATION -> capacity * getAvailability(timestep);
            case GRID_IMPORT -> capacity;
            case GRID_EXPORT -> exportCapacity;
            default -> throw unknownVariableType(variableType);
        };
    }

    @Override
    public List<BalanceTerm> getBalanceTerms(Carrier carrier) {
        if (carrier != this.carrier) {
            return List.of();
        }
        return isGridTie()
                ? List.of(new BalanceTerm(DispatchVariableType.GRID_IMPORT, 1), new BalanceTerm(DispatchVariableType.GRID_EXPORT, -1))
                : List.of(new BalanceTerm(DispatchVariableType.GENERATION, 1));
    }

    @Override
    public List<CostTerm> getCostTerms(int timestep) {
        List<CostTerm> terms = new ArrayList<>(2);
        if (isGridTie()) {
            Price price = tariff.priceAt(timestep);
            if (price.buy() != 0) {
                terms.add(new CostTerm(variable(DispatchVariableType.GRID_IMPORT, timestep), price.buy(), CostCategory.GRID));
            }
            if (price.sell() != 0 && exportCapacity > 0) {
                terms.add(new CostTerm(variable(DispatchVariableType.GRID_EXPORT, timestep), -price.sell(), CostCategory.GRID));
            }
        } else if (marginalCost != 0) {
            terms.add(new CostTerm(variable(DispatchVariableType.GENERATION, timestep), marginalCost, CostCategory.FUEL));
        }
        return terms;
    }
}
