/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.solver;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openies.opt.DispatchProblem;

/**
 * Solves a formulated dispatch problem. Failures are returned, not thrown.
 *
 * @author Open IES developers
 */
public interface DispatchSolver {

    String getName();

    SolverResult solve(DispatchProblem problem, ReportNode reportNode);
}
