/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.result;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.powsybl.openies.network.Carrier;
import com.powsybl.openies.opt.DispatchVariableType;
import com.powsybl.openies.solver.BalanceViolation;
import com.powsybl.openies.solver.SolveFailure;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a dispatch result as JSON for result viewers.
 *
 * @author Open IES developers
 */
public final class DispatchResultJsonWriter {

    private DispatchResultJsonWriter() {
    }

    public static void write(DispatchResult result, Path file) {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(result, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(DispatchResult result, Writer writer) {
        Objects.requireNonNull(result);
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("status", result.getStatus().name());
            jsonGenerator.writeStringField("problemType", result.getProblemType().name());
            jsonGenerator.writeStringField("solver", result.getSolverName());
            jsonGenerator.writeNumberField("horizon", result.getHorizon());

            if (result.isOptimal()) {
                writeCosts(result.getCostBreakdown(), jsonGenerator);

                jsonGenerator.writeFieldName("devices");
                jsonGenerator.writeStartArray();
                for (DeviceResult deviceResult : result.getDeviceResults().values()) {
                    writeDevice(deviceResult, jsonGenerator);
                }
                jsonGenerator.writeEndArray();
            }

            result.getFailure().ifPresent(failure -> {
                try {
                    writeFailure(failure, jsonGenerator);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });

            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeCosts(CostBreakdown costBreakdown, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName("cost");
        jsonGenerator.writeStartObject();
        jsonGenerator.writeNumberField("total", costBreakdown.getTotalCost());
        jsonGenerator.writeNumberField("fuel", costBreakdown.fuelCost());
        jsonGenerator.writeNumberField("grid", costBreakdown.gridCost());
        jsonGenerator.writeNumberField("cycling", costBreakdown.cyclingCost());
        jsonGenerator.writeEndObject();
    }

    private static void writeSeries(String name, double[] values, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName(name);
        jsonGenerator.writeArray(values, 0, values.length);
    }

    private static void writeDevice(DeviceResult deviceResult, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("id", deviceResult.getDeviceId());
        jsonGenerator.writeStringField("type", deviceResult.getType().name());

        jsonGenerator.writeFieldName("variables");
        jsonGenerator.writeStartObject();
        for (DispatchVariableType type : deviceResult.getVariableTypes()) {
            writeSeries(type.getSymbol(), deviceResult.getSeries(type).orElseThrow(), jsonGenerator);
        }
        jsonGenerator.writeEndObject();

        jsonGenerator.writeFieldName("injections");
        jsonGenerator.writeStartObject();
        for (Carrier carrier : deviceResult.getCarriers()) {
            writeSeries(carrier.getSymbol(), deviceResult.getInjectionSeries(carrier).orElseThrow(), jsonGenerator);
        }
        jsonGenerator.writeEndObject();

        jsonGenerator.writeEndObject();
    }

    private static void writeFailure(SolveFailure failure, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName("failure");
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("kind", failure.kind().name());
        jsonGenerator.writeStringField("reason", failure.reason());
        jsonGenerator.writeFieldName("violations");
        jsonGenerator.writeStartArray();
        for (BalanceViolation violation : failure.violations()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("carrier", violation.carrier().getSymbol());
            jsonGenerator.writeNumberField("timestep", violation.timestep());
            jsonGenerator.writeNumberField("shortfall", violation.shortfall());
            jsonGenerator.writeNumberField("surplus", violation.surplus());
            jsonGenerator.writeEndObject();
        }
        jsonGenerator.writeEndArray();
        jsonGenerator.writeEndObject();
    }
}
