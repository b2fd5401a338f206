/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.constraints;

import com.powsybl.openies.network.IesNetwork;

/**
 * Appends to a constraint set the constraints of one physical rule over the whole horizon. Implementations are
 * stateless.
 *
 * @author Open IES developers
 */
public interface ConstraintGenerator {

    String getName();

    void generate(IesNetwork network, ConstraintSet constraints);
}
