/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.tariff.TouTariff;
import com.powsybl.openies.util.DispatchAssert;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open IES developers
 */
class IesNetworkBuilderTest {

    private static Scenario createScenario() {
        return Scenario.builder(2)
                .setElectricalLoad(10, 10)
                .setHeatLoad(3, 0)
                .setCoolingLoad(0, 3)
                .setTariff(TouTariff.flat(1, 0))
                .build();
    }

    @Test
    void testBusesAndWiring() {
        List<DeviceSpec> specs = List.of(IesScenarioFactory.createGrid(),
                                         IesScenarioFactory.createHeatPump("hp", HeatPumpFamily.GSHP_SHALLOW, 5));
        ReportNode reportNode = DispatchAssert.createTestReportNode();
        IesNetwork network = IesNetworkBuilder.build(specs, createScenario(), reportNode);

        assertEquals(3, network.getBuses().size());
        IesBus elec = network.getBus(Carrier.ELECTRICITY).orElseThrow();
        IesBus heat = network.getBus(Carrier.HEAT).orElseThrow();
        IesBus cool = network.getBus(Carrier.COOLING).orElseThrow();
        assertTrue(network.getBus(Carrier.HYDROGEN).isEmpty());
        assertEquals(2, elec.getDevices().size());
        assertEquals(1, heat.getDevices().size());
        assertEquals(1, cool.getDevices().size());
        assertEquals(3, heat.getDemand(0));
        assertSame(heat, network.getBusByNum(heat.getNum()));

        IesLink hp = (IesLink) network.getDeviceById("hp");
        assertEquals(1, hp.getNum());
        assertSame(hp, network.getDevice(1));
        assertEquals(HeatPumpFamily.GSHP_SHALLOW, hp.getHeatPumpFamily().orElseThrow());
        assertEquals(LinkCapacityBasis.OUTPUT, hp.getCapacityBasis());
        assertTrue(hp.isModeExclusive());
        assertTrue(network.hasModeExclusivity());
        assertEquals(4.0, hp.getMode(OperatingMode.HEATING).orElseThrow().getEfficiency(Carrier.HEAT));
        assertEquals(4.5, hp.getMode(OperatingMode.COOLING).orElseThrow().getEfficiency(Carrier.COOLING));
        assertEquals(List.of(DispatchVariableType.HEATING_INPUT, DispatchVariableType.COOLING_INPUT,
                             DispatchVariableType.HEATING_ON, DispatchVariableType.COOLING_ON), hp.getVariableTypes());
        // capacity on the thermal side
        assertEquals(5 / 4.0, hp.getMaxValue(DispatchVariableType.HEATING_INPUT, 0), 1e-12);
        assertEquals(List.of(new BalanceTerm(DispatchVariableType.HEATING_INPUT, -1), new BalanceTerm(DispatchVariableType.COOLING_INPUT, -1)),
                hp.getBalanceTerms(Carrier.ELECTRICITY));
        assertEquals(List.of(new BalanceTerm(DispatchVariableType.COOLING_INPUT, 4.5)), hp.getBalanceTerms(Carrier.COOLING));

        IesGenerator grid = (IesGenerator) network.getDeviceById("grid");
        assertTrue(grid.isGridTie());
        assertEquals(Double.POSITIVE_INFINITY, grid.getMaxValue(DispatchVariableType.GRID_IMPORT, 0));
        assertEquals(0, grid.getMaxValue(DispatchVariableType.GRID_EXPORT, 0));

        assertTrue(DispatchAssert.collectMessages(reportNode).contains("Network has 3 buses and 2 devices"));
    }

    @Test
    void testExplicitCopAndNonExclusive() {
        DeviceSpec spec = DeviceSpec.builder("hp", DeviceType.HEAT_PUMP)
                .setParameter(DeviceParameters.COP, 2.5)
                .setParameter(DeviceParameters.MODE_EXCLUSIVE, false)
                .build();
        IesNetwork network = IesNetworkBuilder.build(List.of(IesScenarioFactory.createGrid(), spec), createScenario());
        IesLink hp = (IesLink) network.getDeviceById("hp");
        assertEquals(2.5, hp.getMode(OperatingMode.HEATING).orElseThrow().getEfficiency(Carrier.HEAT));
        assertEquals(HeatPumpFamily.ASHP.getDefaultEer(), hp.getMode(OperatingMode.COOLING).orElseThrow().getEfficiency(Carrier.COOLING));
        assertEquals(DeviceCatalog.HEAT_PUMP_CAPACITY_DEFAULT_VALUE, hp.getCapacity());
        assertFalse(hp.isModeExclusive());
        assertFalse(network.hasModeExclusivity());
        assertEquals(2, hp.getVariableTypes().size());
    }

    @Test
    void testFuelCellAndStorageDefaults() {
        List<DeviceSpec> specs = List.of(IesScenarioFactory.createGrid(),
                                         DeviceSpec.of("fc", DeviceType.FUEL_CELL),
                                         DeviceSpec.of("ely", DeviceType.ELECTROLYZER),
                                         DeviceSpec.builder("tank", DeviceType.HYDROGEN_STORAGE)
                                                 .setParameter(DeviceParameters.INITIAL_SOC, 0.2)
                                                 .build());
        Scenario scenario = Scenario.builder(1)
                .setElectricalLoad(1)
                .setHeatLoad(1)
                .setTariff(TouTariff.flat(1, 0))
                .build();
        IesNetwork network = IesNetworkBuilder.build(specs, scenario);
        IesLink fc = (IesLink) network.getDeviceById("fc");
        assertEquals(Carrier.HYDROGEN, fc.getInputCarrier());
        assertEquals(0.85, fc.getModes().get(0).getTotalEfficiency(), 1e-12);
        assertEquals(List.of(new BalanceTerm(DispatchVariableType.LINK_INPUT, 0.4)), fc.getBalanceTerms(Carrier.HEAT));

        IesStorageUnit tank = (IesStorageUnit) network.getDeviceById("tank");
        assertEquals(2000, tank.getEnergyCapacity(), 1e-12);
        assertEquals(400, tank.getInitialEnergy(), 1e-12);
        assertEquals(0.98, tank.getChargeEfficiency());
        assertEquals(List.of(tank), network.getDevices(IesStorageUnit.class));
    }

    private static ConfigurationException assertConfigurationError(List<DeviceSpec> specs, Scenario scenario) {
        return assertThrows(ConfigurationException.class, () -> IesNetworkBuilder.build(specs, scenario));
    }

    private static ConfigurationException assertConfigurationError(DeviceSpec spec) {
        return assertConfigurationError(List.of(IesScenarioFactory.createGrid(), spec), createScenario());
    }

    @Test
    void testInvalidParameters() {
        ConfigurationException e = assertConfigurationError(DeviceSpec.of("eb", DeviceType.ELECTRIC_BOILER, Map.of("power", "10")));
        assertEquals("eb", e.getEntityId());
        assertEquals("power", e.getParameterName().orElseThrow());
        assertEquals("Unknown parameter 'power' for device 'eb' of type ELECTRIC_BOILER", e.getMessage());

        e = assertConfigurationError(DeviceSpec.of("eb", DeviceType.ELECTRIC_BOILER, Map.of(DeviceParameters.CAPACITY, "ten")));
        assertEquals("Invalid value for parameter 'capacity' of 'eb': ten (expected a number)", e.getMessage());

        e = assertConfigurationError(DeviceSpec.of("eb", DeviceType.ELECTRIC_BOILER, Map.of(DeviceParameters.CAPACITY, "0")));
        assertEquals(DeviceParameters.CAPACITY, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("eb", DeviceType.ELECTRIC_BOILER, Map.of(DeviceParameters.CAPACITY, "NaN")));
        assertEquals(DeviceParameters.CAPACITY, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("eb", DeviceType.ELECTRIC_BOILER, Map.of(DeviceParameters.EFFICIENCY, "1.2")));
        assertEquals("Invalid value for parameter 'efficiency' of 'eb': 1.2 (expected a value in (0, 1])", e.getMessage());

        e = assertConfigurationError(DeviceSpec.of("eb", DeviceType.ELECTRIC_BOILER, Map.of(DeviceParameters.COST, "-1")));
        assertEquals(DeviceParameters.COST, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("hp", DeviceType.HEAT_PUMP, Map.of(DeviceParameters.MODE_FAMILY, "WSHP")));
        assertEquals(DeviceParameters.MODE_FAMILY, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("hp", DeviceType.HEAT_PUMP, Map.of(DeviceParameters.EER, "0")));
        assertEquals(DeviceParameters.EER, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("hp", DeviceType.HEAT_PUMP, Map.of(DeviceParameters.MODE_EXCLUSIVE, "yes")));
        assertEquals("Invalid value for parameter 'modeExclusive' of 'hp': yes (expected true or false)", e.getMessage());

        e = assertConfigurationError(DeviceSpec.of("grid2", DeviceType.GRID, Map.of(DeviceParameters.EXPORT_CAPACITY, "-5")));
        assertEquals(DeviceParameters.EXPORT_CAPACITY, e.getParameterName().orElseThrow());
    }

    @Test
    void testNonFiniteCapacity() {
        ConfigurationException e = assertConfigurationError(DeviceSpec.of("hp", DeviceType.HEAT_PUMP, Map.of(DeviceParameters.CAPACITY, "Infinity")));
        assertEquals("Invalid value for parameter 'capacity' of 'hp': Infinity (expected a finite positive value)", e.getMessage());

        e = assertConfigurationError(DeviceSpec.of("grid2", DeviceType.GRID, Map.of(DeviceParameters.CAPACITY, "Infinity")));
        assertEquals(DeviceParameters.CAPACITY, e.getParameterName().orElseThrow());

        Scenario scenario = Scenario.builder(2)
                .setElectricalLoad(1, 0)
                .setPvAvailability(1, 0)
                .build();
        e = assertConfigurationError(List.of(DeviceSpec.of("pv", DeviceType.PV, Map.of(DeviceParameters.CAPACITY, "Infinity"))), scenario);
        assertEquals("pv", e.getEntityId());
        assertEquals(DeviceParameters.CAPACITY, e.getParameterName().orElseThrow());

        // an unset grid import capacity stays unbounded
        IesNetwork network = IesNetworkBuilder.build(List.of(IesScenarioFactory.createGrid()), createScenarioWithoutHeatPump());
        assertEquals(Double.POSITIVE_INFINITY, network.getDeviceById("grid").getCapacity());
    }

    private static Scenario createScenarioWithoutHeatPump() {
        return Scenario.builder(1)
                .setElectricalLoad(1)
                .setTariff(TouTariff.flat(1, 0))
                .build();
    }

    @Test
    void testFuelCellTotalEfficiency() {
        ConfigurationException e = assertConfigurationError(DeviceSpec.of("fc", DeviceType.FUEL_CELL,
                Map.of(DeviceParameters.EFFICIENCY, "0.9", DeviceParameters.HEAT_EFFICIENCY, "0.9")));
        assertEquals("fc", e.getEntityId());
        assertEquals(DeviceParameters.HEAT_EFFICIENCY, e.getParameterName().orElseThrow());
        assertEquals("Total efficiency of fuel cell 'fc' is greater than 1: 0.9 + 0.9", e.getMessage());
    }

    @Test
    void testInvalidStorageParameters() {
        ConfigurationException e = assertConfigurationError(DeviceSpec.of("bat", DeviceType.BATTERY,
                Map.of(DeviceParameters.MIN_SOC, "0.6", DeviceParameters.MAX_SOC, "0.4")));
        assertEquals(DeviceParameters.MIN_SOC, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("bat", DeviceType.BATTERY, Map.of(DeviceParameters.INITIAL_SOC, "0.05",
                DeviceParameters.MIN_SOC, "0.1")));
        assertEquals(DeviceParameters.INITIAL_SOC, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("bat", DeviceType.BATTERY, Map.of(DeviceParameters.STANDING_LOSS, "1")));
        assertEquals(DeviceParameters.STANDING_LOSS, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("bat", DeviceType.BATTERY, Map.of(DeviceParameters.MAX_HOURS, "0")));
        assertEquals(DeviceParameters.MAX_HOURS, e.getParameterName().orElseThrow());

        e = assertConfigurationError(DeviceSpec.of("bat", DeviceType.BATTERY, Map.of(DeviceParameters.DISCHARGE_EFFICIENCY, "0")));
        assertEquals(DeviceParameters.DISCHARGE_EFFICIENCY, e.getParameterName().orElseThrow());
    }

    @Test
    void testInvalidIds() {
        Scenario scenario = createScenario();
        List<DeviceSpec> duplicates = List.of(IesScenarioFactory.createGrid(), IesScenarioFactory.createGrid());
        ConfigurationException e = assertConfigurationError(duplicates, scenario);
        assertEquals("Duplicate device id 'grid'", e.getMessage());

        List<DeviceSpec> blank = List.of(DeviceSpec.of(" ", DeviceType.GRID));
        assertConfigurationError(blank, scenario);
    }

    @Test
    void testMissingScenarioSeries() {
        Scenario noTariff = Scenario.builder(1).setElectricalLoad(1).setPvAvailability(1).build();
        ConfigurationException e = assertConfigurationError(List.of(IesScenarioFactory.createGrid()), noTariff);
        assertEquals("Grid device 'grid' needs a tariff in the scenario", e.getMessage());

        Scenario noPv = Scenario.builder(1).setElectricalLoad(1).build();
        e = assertConfigurationError(List.of(DeviceSpec.of("pv", DeviceType.PV)), noPv);
        assertEquals(Scenario.PV_AVAILABILITY_PARAM_NAME, e.getParameterName().orElseThrow());
    }

    @Test
    void testDanglingCarrier() {
        Scenario scenario = Scenario.builder(1)
                .setElectricalLoad(1)
                .setTariff(TouTariff.flat(1, 0))
                .build();
        List<DeviceSpec> specs = List.of(IesScenarioFactory.createGrid(), DeviceSpec.of("ely", DeviceType.ELECTROLYZER));
        ConfigurationException e = assertConfigurationError(specs, scenario);
        assertEquals("ely", e.getEntityId());
        assertEquals("Carrier HYDROGEN has no demand and its devices can only inject: add a h2Demand series (all zeros is enough) or a device on the other side",
                e.getMessage());

        // a hydrogen tank gives the electrolyzer output somewhere to go
        List<DeviceSpec> withStorage = List.of(IesScenarioFactory.createGrid(), DeviceSpec.of("ely", DeviceType.ELECTROLYZER),
                                               DeviceSpec.of("tank", DeviceType.HYDROGEN_STORAGE));
        assertEquals(2, IesNetworkBuilder.build(withStorage, scenario).getBuses().size());
    }
}
