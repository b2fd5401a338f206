/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.commons.parameters.Parameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A device archetype: its type, the carriers it touches and its parameter schema.
 *
 * @author Open IES developers
 */
public final class DeviceArchetype {

    private final DeviceType type;

    private final String description;

    private final Set<Carrier> carriers;

    private final Map<String, Parameter> parametersByName = new LinkedHashMap<>();

    DeviceArchetype(DeviceType type, String description, Set<Carrier> carriers, List<Parameter> parameters) {
        this.type = Objects.requireNonNull(type);
        this.description = Objects.requireNonNull(description);
        this.carriers = Set.copyOf(carriers);
        for (Parameter parameter : parameters) {
            parametersByName.put(parameter.getName(), parameter);
        }
    }

    public DeviceType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public Set<Carrier> getCarriers() {
        return carriers;
    }

    public List<Parameter> getParameters() {
        return List.copyOf(parametersByName.values());
    }

    public Optional<Parameter> getParameter(String name) {
        return Optional.ofNullable(parametersByName.get(name));
    }

    @Override
    public String toString() {
        return type.name();
    }
}
