/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

import com.hellblazer.meridian.ledger.proto.XRPDropsAmount;
import org.joou.ULong;

import java.math.BigInteger;

/**
 * Conversion of drop amounts between the API, which never loses precision, and the wire's unsigned 64 bit integers
 *
 * @author hal.hildebrand
 */
public final class Drops {

    private Drops() {
    }

    public static BigInteger fromWire(XRPDropsAmount amount) {
        return ULong.valueOf(amount.getDrops()).toBigInteger();
    }

    /**
     * @throws IllegalArgumentException if the amount is negative or exceeds 64 unsigned bits
     */
    public static XRPDropsAmount toWire(BigInteger amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        try {
            return XRPDropsAmount.newBuilder().setDrops(ULong.valueOf(amount).longValue()).build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Not a valid amount of drops: " + amount, e);
        }
    }
}
