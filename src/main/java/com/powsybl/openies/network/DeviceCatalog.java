/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.commons.parameters.Parameter;
import com.powsybl.commons.parameters.ParameterType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static com.powsybl.openies.network.DeviceParameters.*;

/**
 * Immutable registry of the supported device archetypes and of their parameter schemas. Default values are the
 * ones of a typical district-scale installation.
 *
 * @author Open IES developers
 */
public final class DeviceCatalog {

    public static final double PV_CAPACITY_DEFAULT_VALUE = 100;
    public static final double PV_COST_DEFAULT_VALUE = 0.01;

    public static final double GRID_EXPORT_CAPACITY_DEFAULT_VALUE = 0;

    public static final double ELECTRIC_BOILER_CAPACITY_DEFAULT_VALUE = 20;
    public static final double ELECTRIC_BOILER_EFFICIENCY_DEFAULT_VALUE = 0.98;

    public static final double HEAT_PUMP_CAPACITY_DEFAULT_VALUE = 40;
    public static final HeatPumpFamily HEAT_PUMP_FAMILY_DEFAULT_VALUE = HeatPumpFamily.ASHP;
    public static final boolean HEAT_PUMP_MODE_EXCLUSIVE_DEFAULT_VALUE = true;

    public static final double ELECTROLYZER_CAPACITY_DEFAULT_VALUE = 50;
    public static final double ELECTROLYZER_EFFICIENCY_DEFAULT_VALUE = 0.75;

    public static final double FUEL_CELL_CAPACITY_DEFAULT_VALUE = 50;
    public static final double FUEL_CELL_EFFICIENCY_DEFAULT_VALUE = 0.45;
    public static final double FUEL_CELL_HEAT_EFFICIENCY_DEFAULT_VALUE = 0.40;

    public static final double BATTERY_CAPACITY_DEFAULT_VALUE = 30;
    public static final double BATTERY_MAX_HOURS_DEFAULT_VALUE = 4;
    public static final double BATTERY_EFFICIENCY_DEFAULT_VALUE = 0.9;
    public static final double BATTERY_COST_DEFAULT_VALUE = 0.01;

    public static final double HYDROGEN_STORAGE_CAPACITY_DEFAULT_VALUE = 100;
    public static final double HYDROGEN_STORAGE_MAX_HOURS_DEFAULT_VALUE = 20;
    public static final double HYDROGEN_STORAGE_EFFICIENCY_DEFAULT_VALUE = 0.98;
    public static final double HYDROGEN_STORAGE_COST_DEFAULT_VALUE = 0.005;

    public static final double STANDING_LOSS_DEFAULT_VALUE = 0;
    public static final double MIN_SOC_DEFAULT_VALUE = 0;
    public static final double MAX_SOC_DEFAULT_VALUE = 1;
    public static final double INITIAL_SOC_DEFAULT_VALUE = 0.5;

    /**
     * Default of an optional double parameter that has no value unless the user sets one.
     */
    public static final double UNSET_DEFAULT_VALUE = Double.NaN;

    private static final Map<DeviceType, DeviceArchetype> ARCHETYPES = createArchetypes();

    private DeviceCatalog() {
    }

    public static DeviceArchetype getArchetype(DeviceType type) {
        Objects.requireNonNull(type);
        return ARCHETYPES.get(type);
    }

    public static Collection<DeviceArchetype> getArchetypes() {
        return ARCHETYPES.values();
    }

    public static <E extends Enum<E>> List<Object> getEnumPossibleValues(Class<E> enumClass) {
        return Arrays.stream(enumClass.getEnumConstants()).map(Enum::name).collect(Collectors.toList());
    }

    private static Parameter doubleParameter(String name, String description, double defaultValue) {
        return new Parameter(name, ParameterType.DOUBLE, description, defaultValue);
    }

    private static List<Parameter> withCommonParameters(Parameter... parameters) {
        List<Parameter> all = new ArrayList<>(Arrays.asList(parameters));
        all.add(new Parameter(EXTENDABLE, ParameterType.BOOLEAN, "Capacity is an investment decision (ignored by dispatch)", false));
        return all;
    }

    private static List<Parameter> storageParameters(double capacity, double maxHours, double efficiency, double cost) {
        return withCommonParameters(
                doubleParameter(CAPACITY, "Charge and discharge power capacity", capacity),
                doubleParameter(MAX_HOURS, "Energy capacity in hours at full power", maxHours),
                doubleParameter(CHARGE_EFFICIENCY, "Charge efficiency", efficiency),
                doubleParameter(DISCHARGE_EFFICIENCY, "Discharge efficiency", efficiency),
                doubleParameter(COST, "Cycling penalty per unit of charged or discharged energy", cost),
                doubleParameter(STANDING_LOSS, "Fraction of the state of charge lost per timestep", STANDING_LOSS_DEFAULT_VALUE),
                doubleParameter(MIN_SOC, "Minimum state of charge as a fraction of the energy capacity", MIN_SOC_DEFAULT_VALUE),
                doubleParameter(MAX_SOC, "Maximum state of charge as a fraction of the energy capacity", MAX_SOC_DEFAULT_VALUE),
                doubleParameter(INITIAL_SOC, "Initial state of charge as a fraction of the energy capacity", INITIAL_SOC_DEFAULT_VALUE));
    }

    private static Map<DeviceType, DeviceArchetype> createArchetypes() {
        Map<DeviceType, DeviceArchetype> archetypes = new EnumMap<>(DeviceType.class);
        archetypes.put(DeviceType.PV, new DeviceArchetype(DeviceType.PV, "Photovoltaic plant",
                Set.of(Carrier.ELECTRICITY),
                withCommonParameters(
                        doubleParameter(CAPACITY, "Peak power", PV_CAPACITY_DEFAULT_VALUE),
                        doubleParameter(COST, "Marginal cost", PV_COST_DEFAULT_VALUE))));
        archetypes.put(DeviceType.GRID, new DeviceArchetype(DeviceType.GRID, "Grid connection",
                Set.of(Carrier.ELECTRICITY),
                withCommonParameters(
                        doubleParameter(CAPACITY, "Import capacity, unbounded if not set", UNSET_DEFAULT_VALUE),
                        doubleParameter(EXPORT_CAPACITY, "Export capacity", GRID_EXPORT_CAPACITY_DEFAULT_VALUE))));
        archetypes.put(DeviceType.ELECTRIC_BOILER, new DeviceArchetype(DeviceType.ELECTRIC_BOILER, "Electric boiler",
                Set.of(Carrier.ELECTRICITY, Carrier.HEAT),
                withCommonParameters(
                        doubleParameter(CAPACITY, "Electrical input capacity", ELECTRIC_BOILER_CAPACITY_DEFAULT_VALUE),
                        doubleParameter(EFFICIENCY, "Heat output per unit of electricity", ELECTRIC_BOILER_EFFICIENCY_DEFAULT_VALUE),
                        doubleParameter(COST, "Marginal cost per unit of input", 0.0))));
        archetypes.put(DeviceType.HEAT_PUMP, new DeviceArchetype(DeviceType.HEAT_PUMP, "Reversible heat pump",
                Set.of(Carrier.ELECTRICITY, Carrier.HEAT, Carrier.COOLING),
                withCommonParameters(
                        new Parameter(MODE_FAMILY, ParameterType.STRING, "Heat pump technology", HEAT_PUMP_FAMILY_DEFAULT_VALUE.name(),
                                getEnumPossibleValues(HeatPumpFamily.class)),
                        doubleParameter(CAPACITY, "Thermal output capacity shared by heating and cooling", HEAT_PUMP_CAPACITY_DEFAULT_VALUE),
                        doubleParameter(COP, "Heating coefficient of performance, family default if not set", UNSET_DEFAULT_VALUE),
                        doubleParameter(EER, "Cooling energy efficiency ratio, family default if not set", UNSET_DEFAULT_VALUE),
                        new Parameter(MODE_EXCLUSIVE, ParameterType.BOOLEAN, "Heating and cooling cannot run in the same timestep",
                                HEAT_PUMP_MODE_EXCLUSIVE_DEFAULT_VALUE),
                        doubleParameter(COST, "Marginal cost per unit of input", 0.0))));
        archetypes.put(DeviceType.ELECTROLYZER, new DeviceArchetype(DeviceType.ELECTROLYZER, "Electrolyzer",
                Set.of(Carrier.ELECTRICITY, Carrier.HYDROGEN),
                withCommonParameters(
                        doubleParameter(CAPACITY, "Electrical input capacity", ELECTROLYZER_CAPACITY_DEFAULT_VALUE),
                        doubleParameter(EFFICIENCY, "Hydrogen output per unit of electricity", ELECTROLYZER_EFFICIENCY_DEFAULT_VALUE),
                        doubleParameter(COST, "Marginal cost per unit of input", 0.0))));
        archetypes.put(DeviceType.FUEL_CELL, new DeviceArchetype(DeviceType.FUEL_CELL, "Combined heat and power fuel cell",
                Set.of(Carrier.HYDROGEN, Carrier.ELECTRICITY, Carrier.HEAT),
                withCommonParameters(
                        doubleParameter(CAPACITY, "Hydrogen input capacity", FUEL_CELL_CAPACITY_DEFAULT_VALUE),
                        doubleParameter(EFFICIENCY, "Electricity output per unit of hydrogen", FUEL_CELL_EFFICIENCY_DEFAULT_VALUE),
                        doubleParameter(HEAT_EFFICIENCY, "Heat output per unit of hydrogen", FUEL_CELL_HEAT_EFFICIENCY_DEFAULT_VALUE),
                        doubleParameter(COST, "Marginal cost per unit of input", 0.0))));
        archetypes.put(DeviceType.BATTERY, new DeviceArchetype(DeviceType.BATTERY, "Battery",
                Set.of(Carrier.ELECTRICITY),
                storageParameters(BATTERY_CAPACITY_DEFAULT_VALUE, BATTERY_MAX_HOURS_DEFAULT_VALUE,
                        BATTERY_EFFICIENCY_DEFAULT_VALUE, BATTERY_COST_DEFAULT_VALUE)));
        archetypes.put(DeviceType.HYDROGEN_STORAGE, new DeviceArchetype(DeviceType.HYDROGEN_STORAGE, "Hydrogen tank",
                Set.of(Carrier.HYDROGEN),
                storageParameters(HYDROGEN_STORAGE_CAPACITY_DEFAULT_VALUE, HYDROGEN_STORAGE_MAX_HOURS_DEFAULT_VALUE,
                        HYDROGEN_STORAGE_EFFICIENCY_DEFAULT_VALUE, HYDROGEN_STORAGE_COST_DEFAULT_VALUE)));
        return Collections.unmodifiableMap(archetypes);
    }
}
