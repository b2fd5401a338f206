/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.tariff.TariffSchedule;
import com.powsybl.openies.util.Reports;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.powsybl.openies.network.DeviceParameters.*;

/**
 * Builds the network of a dispatch run: validates the device parameters against the catalog, creates one bus per
 * carrier in use and attaches every device to the buses of its carriers.
 *
 * @author Open IES developers
 */
public final class IesNetworkBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(IesNetworkBuilder.class);

    private IesNetworkBuilder() {
    }

    public static IesNetwork build(List<DeviceSpec> specs, Scenario scenario) {
        return build(specs, scenario, ReportNode.NO_OP);
    }

    public static IesNetwork build(List<DeviceSpec> specs, Scenario scenario, ReportNode reportNode) {
        Objects.requireNonNull(specs);
        Objects.requireNonNull(scenario);
        Objects.requireNonNull(reportNode);

        checkIds(specs);
        List<AbstractIesDevice> devices = new ArrayList<>(specs.size());
        for (DeviceSpec spec : specs) {
            devices.add(createDevice(spec, scenario));
        }

        Set<Carrier> carriers = EnumSet.noneOf(Carrier.class);
        carriers.addAll(scenario.getDemandCarriers());
        for (AbstractIesDevice device : devices) {
            carriers.addAll(((IesDevice) device).getCarriers());
        }

        IesNetwork network = new IesNetwork(scenario);
        for (Carrier carrier : carriers) {
            network.createBus(carrier);
        }
        for (AbstractIesDevice device : devices) {
            network.addDevice(device);
        }
        for (IesBus bus : network.getBuses()) {
            checkBusContext(bus);
        }

        LOGGER.info("Network has {} buses and {} devices over {} timesteps", network.getBuses().size(),
                network.getDevices().size(), scenario.getHorizon());
        Reports.reportNetworkSize(reportNode, network.getBuses().size(), network.getDevices().size());
        return network;
    }

    private static void checkIds(List<DeviceSpec> specs) {
        Set<String> ids = new HashSet<>();
        for (DeviceSpec spec : specs) {
            if (StringUtils.isBlank(spec.getId())) {
                throw new ConfigurationException(spec.getId(), "Device of type " + spec.getType() + " has a blank id");
            }
            if (!ids.add(spec.getId())) {
                throw new ConfigurationException(spec.getId(), "Duplicate device id '" + spec.getId() + "'");
            }
        }
    }

    /**
     * A bus without demand must be able to both receive and deliver energy, otherwise its devices are dangling.
     */
    private static void checkBusContext(IesBus bus) {
        if (bus.hasDemand()) {
            return;
        }
        boolean injection = false;
        boolean withdrawal = false;
        for (IesDevice device : bus.getDevices()) {
            for (BalanceTerm term : device.getBalanceTerms(bus.getCarrier())) {
                if (term.isInjection()) {
                    injection = true;
                } else {
                    withdrawal = true;
                }
            }
        }
        if (injection != withdrawal) {
            String deviceId = bus.getDevices().get(0).getId();
            throw new ConfigurationException(deviceId,
                    "Carrier " + bus.getCarrier() + " has no demand and its devices can only "
                            + (injection ? "inject" : "withdraw") + ": add a " + Scenario.getDemandParameterName(bus.getCarrier())
                            + " series (all zeros is enough) or a device on the other side");
        }
    }

    private static AbstractIesDevice createDevice(DeviceSpec spec, Scenario scenario) {
        DeviceParameterReader reader = new DeviceParameterReader(spec);
        String id = spec.getId();
        boolean extendable = reader.readBoolean(EXTENDABLE);
        return switch (spec.getType()) {
            case PV -> createPv(spec, reader, scenario, extendable);
            case GRID -> createGridTie(spec, reader, scenario, extendable);
            case ELECTRIC_BOILER -> IesLink.createConverter(id, DeviceType.ELECTRIC_BOILER, Carrier.ELECTRICITY,
                    LinkMode.of(OperatingMode.CONVERSION, Carrier.HEAT, reader.readEfficiency(EFFICIENCY)),
                    reader.readPositive(CAPACITY), reader.readNonNegative(COST), extendable);
            case ELECTROLYZER -> IesLink.createConverter(id, DeviceType.ELECTROLYZER, Carrier.ELECTRICITY,
                    LinkMode.of(OperatingMode.CONVERSION, Carrier.HYDROGEN, reader.readEfficiency(EFFICIENCY)),
                    reader.readPositive(CAPACITY), reader.readNonNegative(COST), extendable);
            case FUEL_CELL -> createFuelCell(spec, reader, extendable);
            case HEAT_PUMP -> createHeatPump(spec, reader, extendable);
            case BATTERY -> createStorageUnit(spec, reader, Carrier.ELECTRICITY, extendable);
            case HYDROGEN_STORAGE -> createStorageUnit(spec, reader, Carrier.HYDROGEN, extendable);
        };
    }

    private static IesGenerator createPv(DeviceSpec spec, DeviceParameterReader reader, Scenario scenario, boolean extendable) {
        double[] availability = scenario.getPvAvailability()
                .orElseThrow(() -> new ConfigurationException(spec.getId(), Scenario.PV_AVAILABILITY_PARAM_NAME,
                        "PV device '" + spec.getId() + "' needs a PV availability series in the scenario"));
        return IesGenerator.createGenerator(spec.getId(), DeviceType.PV, Carrier.ELECTRICITY, reader.readPositive(CAPACITY),
                reader.readNonNegative(COST), extendable, availability);
    }

    private static IesGenerator createGridTie(DeviceSpec spec, DeviceParameterReader reader, Scenario scenario, boolean extendable) {
        TariffSchedule tariff = scenario.getTariff()
                .orElseThrow(() -> new ConfigurationException(spec.getId(), "Grid device '" + spec.getId() + "' needs a tariff in the scenario"));
        Double importCapacity = reader.readOptionalDouble(CAPACITY);
        if (importCapacity != null && (!(importCapacity > 0) || Double.isInfinite(importCapacity))) {
            throw ConfigurationException.invalidParameter(spec.getId(), CAPACITY, importCapacity, "a finite positive value");
        }
        return IesGenerator.createGridTie(spec.getId(), importCapacity != null ? importCapacity : Double.POSITIVE_INFINITY,
                reader.readNonNegative(EXPORT_CAPACITY), extendable, tariff);
    }

    private static IesLink createFuelCell(DeviceSpec spec, DeviceParameterReader reader, boolean extendable) {
        double electricalEfficiency = reader.readEfficiency(EFFICIENCY);
        double heatEfficiency = reader.readEfficiency(HEAT_EFFICIENCY);
        if (electricalEfficiency + heatEfficiency > 1) {
            throw new ConfigurationException(spec.getId(), HEAT_EFFICIENCY,
                    "Total efficiency of fuel cell '" + spec.getId() + "' is greater than 1: " + electricalEfficiency + " + " + heatEfficiency);
        }
        return IesLink.createConverter(spec.getId(), DeviceType.FUEL_CELL, Carrier.HYDROGEN,
                new LinkMode(OperatingMode.CONVERSION, Map.of(Carrier.ELECTRICITY, electricalEfficiency, Carrier.HEAT, heatEfficiency)),
                reader.readPositive(CAPACITY), reader.readNonNegative(COST), extendable);
    }

    private static IesLink createHeatPump(DeviceSpec spec, DeviceParameterReader reader, boolean extendable) {
        HeatPumpFamily family = reader.readEnum(MODE_FAMILY, HeatPumpFamily.class);
        Double cop = reader.readOptionalDouble(COP);
        Double eer = reader.readOptionalDouble(EER);
        double heatingEfficiency = cop != null ? cop : family.getDefaultCop();
        double coolingEfficiency = eer != null ? eer : family.getDefaultEer();
        if (!(heatingEfficiency > 0) || Double.isInfinite(heatingEfficiency)) {
            throw ConfigurationException.invalidParameter(spec.getId(), COP, heatingEfficiency, "a finite positive value");
        }
        if (!(coolingEfficiency > 0) || Double.isInfinite(coolingEfficiency)) {
            throw ConfigurationException.invalidParameter(spec.getId(), EER, coolingEfficiency, "a finite positive value");
        }
        return IesLink.createHeatPump(spec.getId(), family, reader.readPositive(CAPACITY), heatingEfficiency, coolingEfficiency,
                reader.readBoolean(MODE_EXCLUSIVE), reader.readNonNegative(COST), extendable);
    }

    private static IesStorageUnit createStorageUnit(DeviceSpec spec, DeviceParameterReader reader, Carrier carrier, boolean extendable) {
        double capacity = reader.readPositive(CAPACITY);
        double maxHours = reader.readPositive(MAX_HOURS);
        double standingLoss = reader.readFraction(STANDING_LOSS);
        if (standingLoss >= 1) {
            throw ConfigurationException.invalidParameter(spec.getId(), STANDING_LOSS, standingLoss, "a value in [0, 1)");
        }
        double minSoc = reader.readFraction(MIN_SOC);
        double maxSoc = reader.readFraction(MAX_SOC);
        if (minSoc > maxSoc) {
            throw new ConfigurationException(spec.getId(), MIN_SOC,
                    "Minimum state of charge " + minSoc + " of '" + spec.getId() + "' is greater than maximum " + maxSoc);
        }
        double initialSoc = reader.readFraction(INITIAL_SOC);
        if (initialSoc < minSoc || initialSoc > maxSoc) {
            throw ConfigurationException.invalidParameter(spec.getId(), INITIAL_SOC, initialSoc, "a value in [" + minSoc + ", " + maxSoc + "]");
        }
        return new IesStorageUnit(spec.getId(), spec.getType(), carrier, capacity, maxHours,
                reader.readEfficiency(CHARGE_EFFICIENCY), reader.readEfficiency(DISCHARGE_EFFICIENCY), standingLoss,
                minSoc, maxSoc, initialSoc, reader.readNonNegative(COST), extendable);
    }
}
