/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;

/**
 * Functional reports of a dispatch run.
 *
 * @author Open IES developers
 */
public final class Reports {

    private static final String CARRIER = "carrier";
    private static final String TIMESTEP = "timestep";

    private Reports() {
    }

    public static ReportNode createDispatchReporter(ReportNode reportNode, int horizon) {
        return reportNode.newReportNode()
                .withMessageTemplate("ies.dispatch")
                .withUntypedValue("horizon", horizon)
                .add();
    }

    public static void reportNetworkSize(ReportNode reportNode, int busCount, int deviceCount) {
        reportNode.newReportNode()
                .withMessageTemplate("ies.networkSize")
                .withUntypedValue("busCount", busCount)
                .withUntypedValue("deviceCount", deviceCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportProblemSize(ReportNode reportNode, String problemType, int variableCount, int binaryVariableCount,
                                         int constraintCount) {
        reportNode.newReportNode()
                .withMessageTemplate("ies.problemSize")
                .withUntypedValue("problemType", problemType)
                .withUntypedValue("variableCount", variableCount)
                .withUntypedValue("binaryVariableCount", binaryVariableCount)
                .withUntypedValue("constraintCount", constraintCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportMilpPromotion(ReportNode reportNode, int exclusiveLinkCount) {
        reportNode.newReportNode()
                .withMessageTemplate("ies.milpPromoted")
                .withUntypedValue("exclusiveLinkCount", exclusiveLinkCount)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportSolveStatus(ReportNode reportNode, String solverName, String status) {
        reportNode.newReportNode()
                .withMessageTemplate("ies.solveStatus")
                .withUntypedValue("solverName", solverName)
                .withUntypedValue("status", status)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportSolveFailure(ReportNode reportNode, String kind, String reason) {
        reportNode.newReportNode()
                .withMessageTemplate("ies.solveFailure")
                .withUntypedValue("kind", kind)
                .withUntypedValue("reason", reason)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportInfeasibleBalance(ReportNode reportNode, String carrier, int timestep, double shortfall, double surplus) {
        reportNode.newReportNode()
                .withMessageTemplate("ies.infeasibleBalance")
                .withUntypedValue(CARRIER, carrier)
                .withUntypedValue(TIMESTEP, timestep)
                .withUntypedValue("shortfall", shortfall)
                .withUntypedValue("surplus", surplus)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportBalanceMismatch(ReportNode reportNode, String carrier, int timestep, double mismatch) {
        reportNode.newReportNode()
                .withMessageTemplate("ies.balanceMismatch")
                .withUntypedValue(CARRIER, carrier)
                .withUntypedValue(TIMESTEP, timestep)
                .withUntypedValue("mismatch", mismatch)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportTotalCost(ReportNode reportNode, double totalCost, double fuelCost, double gridCost, double cyclingCost) {
        reportNode.newReportNode()
                .withMessageTemplate("ies.totalCost")
                .withUntypedValue("totalCost", totalCost)
                .withUntypedValue("fuelCost", fuelCost)
                .withUntypedValue("gridCost", gridCost)
                .withUntypedValue("cyclingCost", cyclingCost)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }
}
