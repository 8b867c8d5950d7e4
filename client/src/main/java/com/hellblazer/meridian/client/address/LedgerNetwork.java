/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.address;

/**
 * The ledger networks an X-Address may be bound to
 *
 * @author hal.hildebrand
 */
public enum LedgerNetwork {
    MAIN((byte) 0x05, (byte) 0x44), TEST((byte) 0x04, (byte) 0x93);

    private final byte[] prefix;

    LedgerNetwork(byte... prefix) {
        this.prefix = prefix;
    }

    static LedgerNetwork fromPrefix(byte first, byte second) {
        for (var network : values()) {
            if (network.prefix[0] == first && network.prefix[1] == second) {
                return network;
            }
        }
        return null;
    }

    byte[] prefix() {
        return prefix.clone();
    }
}
