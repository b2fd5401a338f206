/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A device selected by the user: an id, an archetype and the raw parameter values overriding the catalog defaults.
 *
 * @author Open IES developers
 */
public final class DeviceSpec {

    private final String id;

    private final DeviceType type;

    private final Map<String, String> parameters;

    private DeviceSpec(String id, DeviceType type, Map<String, String> parameters) {
        this.id = Objects.requireNonNull(id);
        this.type = Objects.requireNonNull(type);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static DeviceSpec of(String id, DeviceType type, Map<String, String> parameters) {
        return new DeviceSpec(id, type, Objects.requireNonNull(parameters));
    }

    public static DeviceSpec of(String id, DeviceType type) {
        return new DeviceSpec(id, type, Collections.emptyMap());
    }

    public static Builder builder(String id, DeviceType type) {
        return new Builder(id, type);
    }

    public String getId() {
        return id;
    }

    public DeviceType getType() {
        return type;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "DeviceSpec(id=" + id + ", type=" + type + ", parameters=" + parameters + ")";
    }

    public static final class Builder {

        private final String id;

        private final DeviceType type;

        private final Map<String, String> parameters = new LinkedHashMap<>();

        private Builder(String id, DeviceType type) {
            this.id = id;
            this.type = type;
        }

        public Builder setParameter(String name, Object value) {
            parameters.put(Objects.requireNonNull(name), String.valueOf(Objects.requireNonNull(value)));
            return this;
        }

        public DeviceSpec build() {
            return new DeviceSpec(id, type, parameters);
        }
    }
}
