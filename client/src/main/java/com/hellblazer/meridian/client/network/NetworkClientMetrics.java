/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;

/**
 * @author hal.hildebrand
 */
public interface NetworkClientMetrics {

    Timer accountInfo();

    Meter failures();

    Timer fee();

    Timer ledgerSequence();

    Timer submit();

    Timer transactionStatus();
}
