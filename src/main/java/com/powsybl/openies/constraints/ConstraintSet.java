/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.constraints;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of the constraints of a dispatch problem.
 *
 * @author Open IES developers
 */
public class ConstraintSet {

    private final List<LinearConstraint> constraints = new ArrayList<>();

    public void add(LinearConstraint constraint) {
        constraints.add(Objects.requireNonNull(constraint));
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public List<LinearConstraint> getConstraints(ConstraintKind kind) {
        return constraints.stream().filter(c -> c.getKind() == kind).toList();
    }

    public int size() {
        return constraints.size();
    }
}
