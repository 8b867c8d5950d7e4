/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.signing;

/**
 * The account that funds and authorizes a payment
 *
 * @author hal.hildebrand
 */
public interface Wallet {

    /**
     * @return the X-Address of the account
     */
    String getAddress();

    byte[] getPublicKey();

    byte[] sign(byte[] message);
}
