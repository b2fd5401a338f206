/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.solver;

import java.util.List;
import java.util.Objects;

/**
 * Why a dispatch problem could not be solved. Infeasibilities carry the balance violations located by the
 * diagnosis, when enabled and determinable.
 *
 * @author Open IES developers
 */
public record SolveFailure(SolveFailureKind kind, String reason, List<BalanceViolation> violations) {

    public static final String TIMEOUT_REASON = "timeout";

    public SolveFailure {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(reason);
        violations = List.copyOf(violations);
    }

    public SolveFailure(SolveFailureKind kind, String reason) {
        this(kind, reason, List.of());
    }

    public static SolveFailure timeout() {
        return new SolveFailure(SolveFailureKind.SOLVER_ERROR, TIMEOUT_REASON);
    }

    public boolean isTimeout() {
        return kind == SolveFailureKind.SOLVER_ERROR && reason.equals(TIMEOUT_REASON);
    }
}
