/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.network.*;
import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.opt.ProblemType;
import com.powsybl.openies.opt.SolveMode;
import com.powsybl.openies.opt.StorageBoundaryPolicy;
import com.powsybl.openies.result.DeviceResult;
import com.powsybl.openies.result.DispatchResult;
import com.powsybl.openies.solver.BalanceViolation;
import com.powsybl.openies.solver.SolveFailure;
import com.powsybl.openies.solver.SolveFailureKind;
import com.powsybl.openies.tariff.TouBand;
import com.powsybl.openies.tariff.TouPeriod;
import com.powsybl.openies.tariff.TouTariff;
import com.powsybl.openies.util.DispatchAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.powsybl.openies.util.DispatchAssert.DELTA_COST;
import static com.powsybl.openies.util.DispatchAssert.DELTA_ENERGY;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open IES developers
 */
class OpenIesDispatchTest {

    private OpenIesDispatch dispatch;

    private OpenIesParameters parameters;

    @BeforeEach
    void setUp() {
        dispatch = new OpenIesDispatch();
        parameters = new OpenIesParameters();
    }

    private DispatchResult run(List<DeviceSpec> devices, Scenario scenario) {
        return dispatch.run(devices, scenario, parameters, ReportNode.NO_OP);
    }

    private static Scenario createGridOnlyScenario(TouTariff tariff) {
        return Scenario.builder(24)
                .setElectricalLoad(DispatchAssert.constant(24, 10))
                .setTariff(tariff)
                .build();
    }

    @Test
    void testGridOnly() {
        Scenario scenario = createGridOnlyScenario(IesScenarioFactory.createValleyPeakTariff());
        ReportNode reportNode = DispatchAssert.createTestReportNode();
        DispatchResult result = dispatch.run(List.of(IesScenarioFactory.createGrid()), scenario, parameters, reportNode);

        assertTrue(result.isOptimal());
        assertEquals(ProblemType.LP, result.getProblemType());
        // 8 valley hours at 0.5 and 16 peak hours at 1.5
        assertEquals(280, result.getTotalCost(), DELTA_COST);
        assertEquals(280, result.getCostBreakdown().gridCost(), DELTA_COST);
        assertEquals(result.getTotalCost(), result.getObjectiveValue(), DELTA_COST);
        DeviceResult grid = result.getDeviceResult("grid");
        for (int t = 0; t < 24; t++) {
            assertEquals(10, grid.getValue(DispatchVariableType.GRID_IMPORT, t), DELTA_ENERGY);
            assertEquals(0, grid.getValue(DispatchVariableType.GRID_EXPORT, t), DELTA_ENERGY);
        }
        DispatchAssert.assertBalanced(result, scenario, List.of(Carrier.ELECTRICITY));

        List<String> messages = DispatchAssert.collectMessages(reportNode);
        assertTrue(messages.contains("Dispatch over 24 timesteps"));
        assertTrue(messages.contains("Network has 1 buses and 1 devices"));
        assertTrue(messages.contains("LP problem has 48 variables (0 binary) and 24 constraints"));
        assertTrue(messages.contains("Solver 'highs' returned status OPTIMAL"));
    }

    @Test
    void testFlatTariffEqualsUniformTimeOfUse() {
        DispatchResult flat = run(List.of(IesScenarioFactory.createGrid()), createGridOnlyScenario(TouTariff.flat(1, 0)));
        TouTariff uniform = new TouTariff(List.of(new TouBand(0, 12, 1, 0, TouPeriod.VALLEY),
                                                  new TouBand(12, 24, 1, 0, TouPeriod.PEAK)));
        DispatchResult tou = run(List.of(IesScenarioFactory.createGrid()), createGridOnlyScenario(uniform));
        assertEquals(240, flat.getTotalCost(), DELTA_COST);
        assertEquals(flat.getTotalCost(), tou.getTotalCost(), DELTA_COST);
    }

    @Test
    void testBatteryShiftsLoadToValley() {
        Scenario scenario = createGridOnlyScenario(IesScenarioFactory.createValleyPeakTariff());
        List<DeviceSpec> devices = List.of(IesScenarioFactory.createGrid(), DeviceSpec.of("bat", DeviceType.BATTERY));
        DispatchResult result = run(devices, scenario);

        assertTrue(result.isOptimal());
        assertTrue(result.getTotalCost() < 250, () -> "Unexpected cost " + result.getTotalCost());
        assertTrue(result.getCostBreakdown().cyclingCost() > 0);
        DispatchAssert.assertBalanced(result, scenario, List.of(Carrier.ELECTRICITY));

        DeviceResult battery = result.getDeviceResult("bat");
        double[] soc = battery.getStateOfCharge().orElseThrow();
        double energyCapacity = DeviceCatalog.BATTERY_CAPACITY_DEFAULT_VALUE * DeviceCatalog.BATTERY_MAX_HOURS_DEFAULT_VALUE;
        double efficiency = DeviceCatalog.BATTERY_EFFICIENCY_DEFAULT_VALUE;
        for (int t = 0; t < 24; t++) {
            double previous = soc[(t + 23) % 24];
            double expected = previous + efficiency * battery.getValue(DispatchVariableType.CHARGE, t)
                    - battery.getValue(DispatchVariableType.DISCHARGE, t) / efficiency;
            assertEquals(expected, soc[t], DELTA_ENERGY, "State of charge at timestep " + t);
            assertTrue(soc[t] >= -DELTA_ENERGY && soc[t] <= energyCapacity + DELTA_ENERGY);
            assertTrue(battery.getValue(DispatchVariableType.CHARGE, t) <= DeviceCatalog.BATTERY_CAPACITY_DEFAULT_VALUE + DELTA_ENERGY);
        }
        // charged in the valley only
        for (int t = 8; t < 24; t++) {
            assertEquals(0, battery.getValue(DispatchVariableType.CHARGE, t), DELTA_ENERGY);
        }
    }

    @Test
    void testFixedInitialStateOfCharge() {
        parameters.setStorageBoundaryPolicy(StorageBoundaryPolicy.FIXED_INITIAL);
        Scenario scenario = Scenario.builder(2)
                .setElectricalLoad(10, 10)
                .setTariff(TouTariff.flat(1, 0))
                .build();
        DeviceSpec battery = DeviceSpec.builder("bat", DeviceType.BATTERY)
                .setParameter(DeviceParameters.CAPACITY, 10)
                .setParameter(DeviceParameters.MAX_HOURS, 2)
                .setParameter(DeviceParameters.CHARGE_EFFICIENCY, 1)
                .setParameter(DeviceParameters.DISCHARGE_EFFICIENCY, 1)
                .setParameter(DeviceParameters.COST, 0)
                .build();
        DispatchResult result = run(List.of(IesScenarioFactory.createGrid(), battery), scenario);

        // the initial 10 units stored are free energy, not to be restored at the end
        assertTrue(result.isOptimal());
        assertEquals(10, result.getTotalCost(), DELTA_COST);
        assertEquals(0, result.getDeviceResult("bat").getStateOfCharge().orElseThrow()[1], DELTA_ENERGY);
    }

    @Test
    void testHeatPumpModeSwitch() {
        Scenario scenario = Scenario.builder(2)
                .setHeatLoad(3, 0)
                .setCoolingLoad(0, 3)
                .setTariff(TouTariff.flat(1, 0))
                .build();
        List<DeviceSpec> devices = List.of(IesScenarioFactory.createGrid(),
                                           IesScenarioFactory.createHeatPump("hp", HeatPumpFamily.ASHP, 5));
        DispatchResult result = run(devices, scenario);

        assertTrue(result.isOptimal());
        assertEquals(ProblemType.MILP, result.getProblemType());
        assertEquals(OpenIesParameters.MILP_SOLVER_NAME_DEFAULT_VALUE, result.getSolverName());
        DeviceResult hp = result.getDeviceResult("hp");
        assertEquals(1, hp.getValue(DispatchVariableType.HEATING_ON, 0), DELTA_ENERGY);
        assertEquals(0, hp.getValue(DispatchVariableType.COOLING_ON, 0), DELTA_ENERGY);
        assertEquals(0, hp.getValue(DispatchVariableType.HEATING_ON, 1), DELTA_ENERGY);
        assertEquals(1, hp.getValue(DispatchVariableType.COOLING_ON, 1), DELTA_ENERGY);
        assertEquals(1, hp.getValue(DispatchVariableType.HEATING_INPUT, 0), DELTA_ENERGY);
        assertEquals(3 / 3.5, hp.getValue(DispatchVariableType.COOLING_INPUT, 1), DELTA_ENERGY);
        assertEquals(1 + 3 / 3.5, result.getTotalCost(), DELTA_COST);
        DispatchAssert.assertModeExclusive(hp, 2);
        DispatchAssert.assertBalanced(result, scenario, List.of(Carrier.ELECTRICITY, Carrier.HEAT, Carrier.COOLING));
    }

    @Test
    void testSimultaneousHeatingAndCoolingIsInfeasible() {
        Scenario scenario = Scenario.builder(1)
                .setHeatLoad(3)
                .setCoolingLoad(3)
                .setTariff(TouTariff.flat(1, 0))
                .build();
        List<DeviceSpec> devices = List.of(IesScenarioFactory.createGrid(),
                                           IesScenarioFactory.createHeatPump("hp", HeatPumpFamily.ASHP, 10));
        DispatchResult result = run(devices, scenario);

        assertFalse(result.isOptimal());
        SolveFailure failure = result.getFailure().orElseThrow();
        assertEquals(SolveFailureKind.INFEASIBLE, failure.kind());
        assertEquals(1, failure.violations().size());
        BalanceViolation violation = failure.violations().get(0);
        assertEquals(0, violation.timestep());
        assertEquals(3, violation.getAmount(), DELTA_ENERGY);

        // without exclusivity both modes share the capacity
        DeviceSpec nonExclusive = DeviceSpec.builder("hp", DeviceType.HEAT_PUMP)
                .setParameter(DeviceParameters.CAPACITY, 10)
                .setParameter(DeviceParameters.MODE_EXCLUSIVE, false)
                .build();
        DispatchResult relaxed = run(List.of(IesScenarioFactory.createGrid(), nonExclusive), scenario);
        assertTrue(relaxed.isOptimal());
        assertEquals(ProblemType.LP, relaxed.getProblemType());
        assertEquals(1 + 3 / 3.5, relaxed.getTotalCost(), DELTA_COST);
    }

    @Test
    void testUndersizedPvIsInfeasible() {
        Scenario scenario = Scenario.builder(24)
                .setElectricalLoad(DispatchAssert.constant(24, 100))
                .setPvAvailability(DispatchAssert.constant(24, 1))
                .build();
        DeviceSpec pv = DeviceSpec.builder("pv", DeviceType.PV).setParameter(DeviceParameters.CAPACITY, 10).build();
        ReportNode reportNode = DispatchAssert.createTestReportNode();
        DispatchResult result = dispatch.run(List.of(pv), scenario, parameters, reportNode);

        SolveFailure failure = result.getFailure().orElseThrow();
        assertEquals(SolveFailureKind.INFEASIBLE, failure.kind());
        assertEquals(24, failure.violations().size());
        for (BalanceViolation violation : failure.violations()) {
            assertEquals(Carrier.ELECTRICITY, violation.carrier());
            assertEquals(90, violation.shortfall(), DELTA_ENERGY);
        }
        assertTrue(result.getDeviceResults().isEmpty());
        assertTrue(DispatchAssert.collectMessages(reportNode).stream().anyMatch(m -> m.startsWith("Balance of bus 'elec' cannot be met at timestep 0")));
    }

    @Test
    void testLpPromotedToMilp() {
        parameters.setSolveMode(SolveMode.LP);
        Scenario scenario = Scenario.builder(1)
                .setHeatLoad(3)
                .setCoolingLoad(0)
                .setTariff(TouTariff.flat(1, 0))
                .build();
        ReportNode reportNode = DispatchAssert.createTestReportNode();
        DispatchResult result = dispatch.run(List.of(IesScenarioFactory.createGrid(), DeviceSpec.of("hp", DeviceType.HEAT_PUMP)),
                scenario, parameters, reportNode);

        assertTrue(result.isOptimal());
        assertEquals(ProblemType.MILP, result.getProblemType());
        assertEquals(1, result.getTotalCost(), DELTA_COST);
        assertTrue(DispatchAssert.collectMessages(reportNode).contains("LP requested but 1 device(s) need mode exclusivity, solving as MILP"));
    }

    @Test
    void testConfigurationErrorIsThrown() {
        Scenario scenario = createGridOnlyScenario(TouTariff.flat(1, 0));
        List<DeviceSpec> devices = List.of(DeviceSpec.builder("grid", DeviceType.GRID).setParameter("voltage", 400).build());
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> run(devices, scenario));
        assertEquals("grid", e.getEntityId());
    }

    @Test
    void testIdempotence() {
        Scenario scenario = createGridOnlyScenario(IesScenarioFactory.createValleyPeakTariff());
        List<DeviceSpec> devices = List.of(IesScenarioFactory.createGrid(), DeviceSpec.of("bat", DeviceType.BATTERY));
        DispatchResult first = run(devices, scenario);
        DispatchResult second = run(devices, scenario);
        assertEquals(first.getTotalCost(), second.getTotalCost(), DELTA_COST);
        assertArrayEquals(first.getDeviceResult("grid").getSeries(DispatchVariableType.GRID_IMPORT).orElseThrow(),
                          second.getDeviceResult("grid").getSeries(DispatchVariableType.GRID_IMPORT).orElseThrow(), DELTA_ENERGY);
    }

    @Test
    void testParallelRuns() throws Exception {
        Scenario scenario = createGridOnlyScenario(IesScenarioFactory.createValleyPeakTariff());
        List<DeviceSpec> devices = List.of(IesScenarioFactory.createGrid());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<DispatchResult>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(dispatch.runAsync(devices, scenario, parameters, ReportNode.NO_OP, executor));
            }
            for (CompletableFuture<DispatchResult> future : futures) {
                DispatchResult result = future.get(60, TimeUnit.SECONDS);
                assertTrue(result.isOptimal());
                assertEquals(280, result.getTotalCost(), DELTA_COST);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testDistrict() {
        Scenario scenario = IesScenarioFactory.createDistrictScenario();
        DispatchResult result = run(IesScenarioFactory.createDistrictDevices(), scenario);

        assertTrue(result.isOptimal(), () -> "District dispatch failed: " + result);
        assertEquals(ProblemType.MILP, result.getProblemType());
        assertEquals(10, result.getDeviceResults().size());
        DispatchAssert.assertBalanced(result, scenario, List.of(Carrier.ELECTRICITY, Carrier.HEAT, Carrier.COOLING, Carrier.HYDROGEN));
        for (String heatPumpId : List.of("ashp", "gshp_shallow", "gshp_deep")) {
            DispatchAssert.assertModeExclusive(result.getDeviceResult(heatPumpId), 24);
        }
        assertTrue(result.getTotalCost() > 0);
        assertEquals(result.getTotalCost(), result.getObjectiveValue(), 1e-6 * result.getTotalCost());
        assertTrue(result.getMaxBalanceMismatch() <= parameters.getBalanceTolerance());
    }
}
