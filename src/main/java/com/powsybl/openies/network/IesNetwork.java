/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Buses and devices of one dispatch run, built from a device selection and a scenario.
 *
 * @author Open IES developers
 */
public class IesNetwork {

    private final Scenario scenario;

    private final Map<Carrier, IesBus> busesByCarrier = new EnumMap<>(Carrier.class);

    private final List<IesDevice> devices = new ArrayList<>();

    private final Map<String, IesDevice> devicesById = new HashMap<>();

    IesNetwork(Scenario scenario) {
        this.scenario = Objects.requireNonNull(scenario);
    }

    public Scenario getScenario() {
        return scenario;
    }

    public int getHorizon() {
        return scenario.getHorizon();
    }

    IesBus createBus(Carrier carrier) {
        double[] demand = scenario.getDemandSeries(carrier).orElse(null);
        IesBus bus = new IesBus(carrier, busesByCarrier.size(), demand);
        busesByCarrier.put(carrier, bus);
        return bus;
    }

    void addDevice(AbstractIesDevice device) {
        device.setNum(devices.size());
        IesDevice iesDevice = (IesDevice) device;
        devices.add(iesDevice);
        devicesById.put(device.getId(), iesDevice);
        for (Carrier carrier : iesDevice.getCarriers()) {
            IesBus bus = busesByCarrier.get(carrier);
            if (bus == null) {
                throw new IllegalStateException("No bus for carrier " + carrier + " of device '" + device.getId() + "'");
            }
            bus.addDevice(iesDevice);
        }
    }

    public Collection<IesBus> getBuses() {
        return Collections.unmodifiableCollection(busesByCarrier.values());
    }

    public Optional<IesBus> getBus(Carrier carrier) {
        return Optional.ofNullable(busesByCarrier.get(carrier));
    }

    public IesBus getBusByNum(int num) {
        return busesByCarrier.values().stream()
                .filter(bus -> bus.getNum() == num)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Bus " + num + " not found"));
    }

    public List<IesDevice> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    public IesDevice getDevice(int num) {
        return devices.get(num);
    }

    public IesDevice getDeviceById(String id) {
        return devicesById.get(id);
    }

    public <T extends IesDevice> List<T> getDevices(Class<T> deviceClass) {
        return devices.stream().filter(deviceClass::isInstance).map(deviceClass::cast).toList();
    }

    public List<IesLink> getExclusiveLinks() {
        return getDevices(IesLink.class).stream().filter(IesLink::isModeExclusive).toList();
    }

    public boolean hasModeExclusivity() {
        return !getExclusiveLinks().isEmpty();
    }

    @Override
    public String toString() {
        return "IesNetwork(buses=" + busesByCarrier.size() + ", devices=" + devices.size() + ", horizon=" + getHorizon() + ")";
    }
}
