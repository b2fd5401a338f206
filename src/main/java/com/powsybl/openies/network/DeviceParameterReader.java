/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.commons.parameters.Parameter;

import java.util.Locale;
import java.util.Objects;

/**
 * Typed access to the raw parameter values of a device, falling back to the catalog defaults.
 *
 * @author Open IES developers
 */
final class DeviceParameterReader {

    private final DeviceSpec spec;

    private final DeviceArchetype archetype;

    DeviceParameterReader(DeviceSpec spec) {
        this.spec = Objects.requireNonNull(spec);
        this.archetype = DeviceCatalog.getArchetype(spec.getType());
        for (String name : spec.getParameters().keySet()) {
            if (archetype.getParameter(name).isEmpty()) {
                throw new ConfigurationException(spec.getId(), name,
                        "Unknown parameter '" + name + "' for device '" + spec.getId() + "' of type " + spec.getType());
            }
        }
    }

    private Parameter getParameter(String name) {
        return archetype.getParameter(name)
                .orElseThrow(() -> new IllegalStateException("Parameter '" + name + "' not defined for " + archetype));
    }

    private String getRawValue(String name) {
        String value = spec.getParameters().get(name);
        return value != null ? value.trim() : null;
    }

    /**
     * Double value, or the default one, or null if neither the user nor the catalog gives a value.
     */
    Double readOptionalDouble(String name) {
        Parameter parameter = getParameter(name);
        String value = getRawValue(name);
        if (value == null) {
            Double defaultValue = (Double) parameter.getDefaultValue();
            return defaultValue == null || defaultValue.isNaN() ? null : defaultValue;
        }
        double parsedValue;
        try {
            parsedValue = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw ConfigurationException.invalidParameter(spec.getId(), name, value, "a number");
        }
        if (Double.isNaN(parsedValue)) {
            throw ConfigurationException.invalidParameter(spec.getId(), name, value, "a number");
        }
        return parsedValue;
    }

    double readDouble(String name) {
        Double value = readOptionalDouble(name);
        if (value == null) {
            throw new ConfigurationException(spec.getId(), name, "Missing value for parameter '" + name + "' of '" + spec.getId() + "'");
        }
        return value;
    }

    boolean readBoolean(String name) {
        Parameter parameter = getParameter(name);
        String value = getRawValue(name);
        if (value == null) {
            return (Boolean) parameter.getDefaultValue();
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw ConfigurationException.invalidParameter(spec.getId(), name, value, "true or false");
        };
    }

    <E extends Enum<E>> E readEnum(String name, Class<E> enumClass) {
        Parameter parameter = getParameter(name);
        String value = getRawValue(name);
        if (value == null) {
            return Enum.valueOf(enumClass, (String) parameter.getDefaultValue());
        }
        if (parameter.getPossibleValues() != null && !parameter.getPossibleValues().contains(value)) {
            throw ConfigurationException.invalidParameter(spec.getId(), name, value, "one of " + parameter.getPossibleValues());
        }
        return Enum.valueOf(enumClass, value);
    }

    double readPositive(String name) {
        double value = readDouble(name);
        if (!(value > 0) || Double.isInfinite(value)) {
            throw ConfigurationException.invalidParameter(spec.getId(), name, value, "a finite positive value");
        }
        return value;
    }

    double readNonNegative(String name) {
        double value = readDouble(name);
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw ConfigurationException.invalidParameter(spec.getId(), name, value, "a finite non-negative value");
        }
        return value;
    }

    /**
     * Efficiency in (0, 1].
     */
    double readEfficiency(String name) {
        double value = readDouble(name);
        if (!(value > 0 && value <= 1)) {
            throw ConfigurationException.invalidParameter(spec.getId(), name, value, "a value in (0, 1]");
        }
        return value;
    }

    /**
     * Fraction in [0, 1].
     */
    double readFraction(String name) {
        double value = readDouble(name);
        if (!(value >= 0 && value <= 1)) {
            throw ConfigurationException.invalidParameter(spec.getId(), name, value, "a value in [0, 1]");
        }
        return value;
    }
}
