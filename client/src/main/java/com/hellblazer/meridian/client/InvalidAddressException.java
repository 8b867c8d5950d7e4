/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

/**
 * The caller supplied an address that is not a valid X-Address. Always detected before any network call.
 *
 * @author hal.hildebrand
 */
public class InvalidAddressException extends LedgerClientException {

    public static final String X_ADDRESS_REQUIRED = "Please use the X-Address format. See: https://xrpaddress.info/.";

    private static final long serialVersionUID = 1L;
    private final String      address;

    public InvalidAddressException(String address) {
        super(X_ADDRESS_REQUIRED);
        this.address = address;
    }

    public String address() {
        return address;
    }
}
