/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.opt;

import java.util.Objects;

/**
 * One term of the objective: {@code coefficient * variable}, accounted in a cost category.
 *
 * @author Open IES developers
 */
public record CostTerm(VariableRef variable, double coefficient, CostCategory category) {

    public CostTerm {
        Objects.requireNonNull(variable);
        Objects.requireNonNull(category);
    }
}
