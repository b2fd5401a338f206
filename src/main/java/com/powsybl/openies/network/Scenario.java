/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.network;

import com.powsybl.openies.tariff.TariffSchedule;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Time series of a dispatch run: horizon length in hourly steps, demand per carrier, PV availability and grid tariff.
 * Immutable once built.
 *
 * @author Open IES developers
 */
public final class Scenario {

    public static final String SCENARIO_ID = "scenario";

    public static final String HORIZON_PARAM_NAME = "horizon";

    public static final String PV_AVAILABILITY_PARAM_NAME = "pvAvailability";

    private final int horizon;

    private final Map<Carrier, double[]> demands;

    private final double[] pvAvailability;

    private final TariffSchedule tariff;

    private Scenario(int horizon, Map<Carrier, double[]> demands, double[] pvAvailability, TariffSchedule tariff) {
        this.horizon = horizon;
        this.demands = demands;
        this.pvAvailability = pvAvailability;
        this.tariff = tariff;
    }

    public static Builder builder(int horizon) {
        return new Builder(horizon);
    }

    public static String getDemandParameterName(Carrier carrier) {
        return carrier.getSymbol() + "Demand";
    }

    public int getHorizon() {
        return horizon;
    }

    public Set<Carrier> getDemandCarriers() {
        return Collections.unmodifiableSet(demands.keySet());
    }

    public boolean hasDemand(Carrier carrier) {
        return demands.containsKey(carrier);
    }

    /**
     * Demand of the carrier at a timestep, zero if the scenario has no demand series for it.
     */
    public double getDemand(Carrier carrier, int timestep) {
        double[] demand = demands.get(carrier);
        return demand != null ? demand[timestep] : 0;
    }

    public Optional<double[]> getDemandSeries(Carrier carrier) {
        return Optional.ofNullable(demands.get(carrier)).map(double[]::clone);
    }

    public boolean hasPvAvailability() {
        return pvAvailability != null;
    }

    public Optional<double[]> getPvAvailability() {
        return Optional.ofNullable(pvAvailability).map(double[]::clone);
    }

    public Optional<TariffSchedule> getTariff() {
        return Optional.ofNullable(tariff);
    }

    public static final class Builder {

        private final int horizon;

        private final Map<Carrier, double[]> demands = new EnumMap<>(Carrier.class);

        private double[] pvAvailability;

        private TariffSchedule tariff;

        private Builder(int horizon) {
            this.horizon = horizon;
        }

        public Builder setDemand(Carrier carrier, double... demand) {
            demands.put(Objects.requireNonNull(carrier), Objects.requireNonNull(demand).clone());
            return this;
        }

        public Builder setElectricalLoad(double... load) {
            return setDemand(Carrier.ELECTRICITY, load);
        }

        public Builder setHeatLoad(double... load) {
            return setDemand(Carrier.HEAT, load);
        }

        public Builder setCoolingLoad(double... load) {
            return setDemand(Carrier.COOLING, load);
        }

        public Builder setHydrogenLoad(double... load) {
            return setDemand(Carrier.HYDROGEN, load);
        }

        public Builder setPvAvailability(double... pvAvailability) {
            this.pvAvailability = Objects.requireNonNull(pvAvailability).clone();
            return this;
        }

        public Builder setTariff(TariffSchedule tariff) {
            this.tariff = Objects.requireNonNull(tariff);
            return this;
        }

        public Scenario build() {
            if (horizon <= 0) {
                throw ConfigurationException.invalidParameter(SCENARIO_ID, HORIZON_PARAM_NAME, horizon, "a positive number of timesteps");
            }
            for (Map.Entry<Carrier, double[]> e : demands.entrySet()) {
                String name = getDemandParameterName(e.getKey());
                double[] demand = e.getValue();
                checkLength(name, demand);
                for (int t = 0; t < horizon; t++) {
                    if (!Double.isFinite(demand[t]) || demand[t] < 0) {
                        throw new ConfigurationException(SCENARIO_ID, name,
                                "Invalid " + name + " at timestep " + t + ": " + demand[t] + " (expected a finite non-negative value)");
                    }
                }
            }
            if (pvAvailability != null) {
                checkLength(PV_AVAILABILITY_PARAM_NAME, pvAvailability);
                for (int t = 0; t < horizon; t++) {
                    if (!(pvAvailability[t] >= 0 && pvAvailability[t] <= 1)) {
                        throw new ConfigurationException(SCENARIO_ID, PV_AVAILABILITY_PARAM_NAME,
                                "Invalid PV availability at timestep " + t + ": " + pvAvailability[t] + " (expected a value in [0, 1])");
                    }
                }
            }
            return new Scenario(horizon, new EnumMap<>(demands), pvAvailability, tariff);
        }

        private void checkLength(String name, double[] series) {
            if (series.length != horizon) {
                throw new ConfigurationException(SCENARIO_ID, name,
                        "Series " + name + " has " + series.length + " values, expected " + horizon);
            }
        }
    }
}
