/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

/**
 * Root of the failures surfaced by the ledger client. Unchecked, as these travel through the futures returned by the
 * client and its network backends.
 *
 * @author hal.hildebrand
 */
public class LedgerClientException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LedgerClientException(String message) {
        super(message);
    }

    public LedgerClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
