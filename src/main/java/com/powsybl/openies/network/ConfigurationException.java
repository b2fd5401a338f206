/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.commons.PowsyblException;

import java.util.Optional;

/**
 * Invalid device selection, device parameter or scenario. The input has to be fixed before another solve is
 * requested.
 *
 * @author Open IES developers
 */
public class ConfigurationException extends PowsyblException {

    private final String entityId;

    private final String parameterName;

    public ConfigurationException(String entityId, String parameterName, String message) {
        super(message);
        this.entityId = entityId;
        this.parameterName = parameterName;
    }

    public ConfigurationException(String entityId, String message) {
        this(entityId, null, message);
    }

    public static ConfigurationException invalidParameter(String entityId, String parameterName, Object value, String expected) {
        return new ConfigurationException(entityId, parameterName,
                "Invalid value for parameter '" + parameterName + "' of '" + entityId + "': " + value + " (expected " + expected + ")");
    }

    /**
     * Id of the device or scenario element at fault.
     */
    public String getEntityId() {
        return entityId;
    }

    public Optional<String> getParameterName() {
        return Optional.ofNullable(parameterName);
    }
}
