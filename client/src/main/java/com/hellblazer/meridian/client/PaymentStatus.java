/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

import com.hellblazer.meridian.ledger.proto.TransactionStatus;

/**
 * The fate of a submitted payment, as far as the ledger has decided it
 *
 * @author hal.hildebrand
 */
public enum PaymentStatus {
    FAILED, PENDING, SUCCEEDED, UNKNOWN;

    private static final String SUCCESS_PREFIX = "tes";

    public static PaymentStatus from(TransactionStatus status) {
        if (!status.getValidated()) {
            return PENDING;
        }
        var code = status.getTransactionStatusCode();
        if (code.isEmpty()) {
            return UNKNOWN;
        }
        return code.startsWith(SUCCESS_PREFIX) ? SUCCEEDED : FAILED;
    }
}
