/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import static com.codahale.metrics.MetricRegistry.name;

/**
 * @author hal.hildebrand
 */
public class NetworkClientMetricsImpl implements NetworkClientMetrics {
    private final Timer accountInfo;
    private final Meter failures;
    private final Timer fee;
    private final Timer ledgerSequence;
    private final Timer submit;
    private final Timer transactionStatus;

    public NetworkClientMetricsImpl(String prefix, MetricRegistry registry) {
        accountInfo = registry.timer(name(prefix, "account.info.duration"));
        fee = registry.timer(name(prefix, "fee.duration"));
        ledgerSequence = registry.timer(name(prefix, "ledger.sequence.duration"));
        submit = registry.timer(name(prefix, "submit.duration"));
        transactionStatus = registry.timer(name(prefix, "transaction.status.duration"));
        failures = registry.meter(name(prefix, "failures"));
    }

    @Override
    public Timer accountInfo() {
        return accountInfo;
    }

    @Override
    public Meter failures() {
        return failures;
    }

    @Override
    public Timer fee() {
        return fee;
    }

    @Override
    public Timer ledgerSequence() {
        return ledgerSequence;
    }

    @Override
    public Timer submit() {
        return submit;
    }

    @Override
    public Timer transactionStatus() {
        return transactionStatus;
    }
}
