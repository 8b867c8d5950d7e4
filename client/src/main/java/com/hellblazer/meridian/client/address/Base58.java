/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.address;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Base58 over the ledger's alphabet, which differs from the Bitcoin ordering
 *
 * @author hal.hildebrand
 */
final class Base58 {
    private static final char[]     ALPHABET = "rpshnaf39wBUDNEGHJKLM4PQRST7VWXYZ2bcdeCg65jkm8oFqi1tuvAxyz".toCharArray();
    private static final BigInteger BASE     = BigInteger.valueOf(58);
    private static final int[]      INDEXES  = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            INDEXES[ALPHABET[i]] = i;
        }
    }

    private Base58() {
    }

    /**
     * @return the decoded bytes, or null if the input holds a character outside the alphabet
     */
    static byte[] decode(String input) {
        if (input.isEmpty()) {
            return new byte[0];
        }
        var value = BigInteger.ZERO;
        int zeros = 0;
        boolean leading = true;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            int digit = c < 128 ? INDEXES[c] : -1;
            if (digit < 0) {
                return null;
            }
            if (leading && digit == 0) {
                zeros++;
            } else {
                leading = false;
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        byte[] magnitude = value.signum() == 0 ? new byte[0] : stripSign(value.toByteArray());
        byte[] decoded = new byte[zeros + magnitude.length];
        System.arraycopy(magnitude, 0, decoded, zeros, magnitude.length);
        return decoded;
    }

    static String encode(byte[] input) {
        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) {
            zeros++;
        }
        var value = new BigInteger(1, input);
        var encoded = new StringBuilder();
        while (value.signum() > 0) {
            var divmod = value.divideAndRemainder(BASE);
            encoded.append(ALPHABET[divmod[1].intValue()]);
            value = divmod[0];
        }
        for (int i = 0; i < zeros; i++) {
            encoded.append(ALPHABET[0]);
        }
        return encoded.reverse().toString();
    }

    private static byte[] stripSign(byte[] bytes) {
        if (bytes.length > 1 && bytes[0] == 0) {
            return Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return bytes;
    }
}
