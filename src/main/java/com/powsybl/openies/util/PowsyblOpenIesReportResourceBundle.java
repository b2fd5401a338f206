/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openies.util;

import com.google.auto.service.AutoService;
import com.powsybl.commons.report.ReportResourceBundle;

/**
 * @author Open IES developers
 */
@AutoService(ReportResourceBundle.class)
public final class PowsyblOpenIesReportResourceBundle implements ReportResourceBundle {

    public static final String BASE_NAME = "com.powsybl.openies.reports";

    public String getBaseName() {
        return BASE_NAME;
    }
}
