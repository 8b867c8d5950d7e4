/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

/**
 * @author hal.hildebrand
 */
public class SigningFailureException extends LedgerClientException {

    public static final String SIGNING_FAILURE = "Unable to sign the transaction";

    private static final long serialVersionUID = 1L;

    public SigningFailureException() {
        super(SIGNING_FAILURE);
    }

    public SigningFailureException(Throwable cause) {
        super(cause.getMessage() == null ? SIGNING_FAILURE : SIGNING_FAILURE + ". " + cause.getMessage(), cause);
    }
}
