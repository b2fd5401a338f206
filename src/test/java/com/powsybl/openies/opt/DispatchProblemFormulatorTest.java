/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.opt;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.OpenIesParameters;
import com.powsybl.openies.constraints.ConstraintGenerator;
import com.powsybl.openies.network.*;
import com.powsybl.openies.tariff.TouTariff;
import com.powsybl.openies.util.DispatchAssert;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Open IES developers
 */
class DispatchProblemFormulatorTest {

    private static IesNetwork createNetwork(boolean modeExclusive) {
        List<DeviceSpec> specs = List.of(IesScenarioFactory.createGrid(),
                                         DeviceSpec.builder("hp", DeviceType.HEAT_PUMP)
                                                 .setParameter(DeviceParameters.CAPACITY, 5)
                                                 .setParameter(DeviceParameters.MODE_EXCLUSIVE, modeExclusive)
                                                 .build());
        Scenario scenario = Scenario.builder(2)
                .setElectricalLoad(1, 1)
                .setHeatLoad(3, 0)
                .setCoolingLoad(0, 3)
                .setTariff(TouTariff.flat(2, 0))
                .build();
        return IesNetworkBuilder.build(specs, scenario);
    }

    @Test
    void testProblemType() {
        IesNetwork exclusive = createNetwork(true);
        IesNetwork nonExclusive = createNetwork(false);
        assertEquals(ProblemType.MILP, DispatchProblemFormulator.getProblemType(SolveMode.AUTO, exclusive, ReportNode.NO_OP));
        assertEquals(ProblemType.LP, DispatchProblemFormulator.getProblemType(SolveMode.AUTO, nonExclusive, ReportNode.NO_OP));
        assertEquals(ProblemType.MILP, DispatchProblemFormulator.getProblemType(SolveMode.MILP, nonExclusive, ReportNode.NO_OP));
        assertEquals(ProblemType.LP, DispatchProblemFormulator.getProblemType(SolveMode.LP, nonExclusive, ReportNode.NO_OP));
    }

    @Test
    void testLpPromotedToMilp() {
        ReportNode reportNode = DispatchAssert.createTestReportNode();
        assertEquals(ProblemType.MILP, DispatchProblemFormulator.getProblemType(SolveMode.LP, createNetwork(true), reportNode));
        assertTrue(DispatchAssert.collectMessages(reportNode)
                .contains("LP requested but 1 device(s) need mode exclusivity, solving as MILP"));
    }

    @Test
    void testFormulate() {
        IesNetwork network = createNetwork(true);
        ReportNode reportNode = DispatchAssert.createTestReportNode();
        DispatchProblem problem = new DispatchProblemFormulator(new OpenIesParameters()).formulate(network, reportNode);

        assertEquals(ProblemType.MILP, problem.getProblemType());
        assertFalse(problem.isElastic());
        assertSame(network, problem.getNetwork());
        // grid import and export, heat pump inputs and indicators, over 2 timesteps
        assertEquals(12, problem.getVariableCount());
        assertEquals(4, problem.getBinaryVariableCount());
        // 6 balances, 2 shared capacities, 2 exclusivities and 4 mode capacities
        assertEquals(14, problem.getConstraints().size());
        assertEquals(2, problem.getCostTerms().size());
        CostTerm importCost = problem.getCostTerms().get(0);
        assertEquals(DispatchVariableType.GRID_IMPORT, importCost.variable().type());
        assertEquals(2, importCost.coefficient());
        assertEquals(CostCategory.GRID, importCost.category());

        int hpNum = network.getDeviceById("hp").getNum();
        assertTrue(problem.hasVariable(new VariableRef(hpNum, DispatchVariableType.COOLING_ON, 1)));
        assertNotNull(problem.getVariable(new VariableRef(hpNum, DispatchVariableType.COOLING_ON, 1)));
        VariableRef missing = new VariableRef(hpNum, DispatchVariableType.CHARGE, 0);
        assertFalse(problem.hasVariable(missing));
        assertThrows(IllegalArgumentException.class, () -> problem.getVariable(missing));

        assertTrue(DispatchAssert.collectMessages(reportNode).contains("MILP problem has 12 variables (4 binary) and 14 constraints"));
    }

    @Test
    void testFormulateWithoutExclusivity() {
        DispatchProblem problem = new DispatchProblemFormulator(new OpenIesParameters()).formulate(createNetwork(false));
        assertEquals(ProblemType.LP, problem.getProblemType());
        assertEquals(8, problem.getVariableCount());
        assertEquals(0, problem.getBinaryVariableCount());
        // balances and shared capacities only
        assertEquals(8, problem.getConstraints().size());
    }

    @Test
    void testFormulateElastic() {
        IesNetwork network = createNetwork(true);
        DispatchProblem problem = new DispatchProblemFormulator(new OpenIesParameters()).formulateElastic(network);
        assertTrue(problem.isElastic());
        assertEquals(ProblemType.MILP, problem.getProblemType());
        // a shortfall and a surplus per bus and timestep on top of the device variables
        assertEquals(24, problem.getVariableCount());
        assertTrue(problem.getCostTerms().isEmpty());
        int heatBusNum = network.getBus(Carrier.HEAT).orElseThrow().getNum();
        assertTrue(problem.hasVariable(new VariableRef(heatBusNum, DispatchVariableType.BALANCE_SHORTFALL, 1)));
        assertTrue(problem.hasVariable(new VariableRef(heatBusNum, DispatchVariableType.BALANCE_SURPLUS, 0)));
    }

    @Test
    void testConstraintGenerators() {
        List<String> names = new DispatchProblemFormulator(new OpenIesParameters()).createConstraintGenerators().stream()
                .map(ConstraintGenerator::getName)
                .toList();
        assertEquals(List.of("BusBalance", "StorageStateOfCharge", "LinkCapacity", "ModeExclusivity"), names);
    }
}
