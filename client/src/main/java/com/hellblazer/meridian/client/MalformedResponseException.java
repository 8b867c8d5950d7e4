/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

/**
 * A backend answered, but the answer lacks a field the pipeline requires
 *
 * @author hal.hildebrand
 */
public class MalformedResponseException extends LedgerClientException {

    public static final String MALFORMED_RESPONSE = "Malformed Response.";

    private static final long serialVersionUID = 1L;
    private final String      missing;

    public MalformedResponseException(String missing) {
        super(MALFORMED_RESPONSE);
        this.missing = missing;
    }

    /**
     * @return the name of the absent field
     */
    public String missing() {
        return missing;
    }
}
