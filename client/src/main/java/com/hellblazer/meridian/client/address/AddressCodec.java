/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.address;

import com.google.common.hash.Hashing;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Validation and conversion of ledger account addresses.
 * <p>
 * A classic address is the Base58 check encoding of a version byte of zero followed by the 20 byte account id. An
 * X-Address packs the account id together with an optional 32 bit destination tag and the network the address is
 * meant for:
 *
 * <pre>
 * | network prefix (2) | account id (20) | tag flag (1) | tag, little endian (8) | checksum (4) |
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class AddressCodec {
    private static final int  ACCOUNT_ID_LENGTH     = 20;
    private static final int  CHECKSUM_LENGTH       = 4;
    private static final byte CLASSIC_VERSION       = 0x00;
    private static final int  CLASSIC_LENGTH        = 1 + ACCOUNT_ID_LENGTH + CHECKSUM_LENGTH;
    private static final long MAX_TAG               = 0xFFFF_FFFFL;
    private static final int  X_ADDRESS_LENGTH      = 2 + ACCOUNT_ID_LENGTH + 1 + 8 + CHECKSUM_LENGTH;
    private static final byte TAG_ABSENT            = 0;
    private static final byte TAG_PRESENT           = 1;

    private AddressCodec() {
    }

    public static Optional<ClassicAddress> decodeXAddress(String xAddress) {
        var payload = checked(xAddress, X_ADDRESS_LENGTH);
        if (payload == null) {
            return Optional.empty();
        }
        var network = LedgerNetwork.fromPrefix(payload[0], payload[1]);
        if (network == null) {
            return Optional.empty();
        }
        var accountId = Arrays.copyOfRange(payload, 2, 2 + ACCOUNT_ID_LENGTH);
        byte flag = payload[2 + ACCOUNT_ID_LENGTH];
        long tag = ByteBuffer.wrap(payload, 3 + ACCOUNT_ID_LENGTH, 8).order(ByteOrder.LITTLE_ENDIAN).getLong();
        OptionalLong decodedTag;
        if (flag == TAG_ABSENT && tag == 0) {
            decodedTag = OptionalLong.empty();
        } else if (flag == TAG_PRESENT && tag >= 0 && tag <= MAX_TAG) {
            decodedTag = OptionalLong.of(tag);
        } else {
            return Optional.empty();
        }
        return Optional.of(new ClassicAddress(encodeClassic(accountId), decodedTag, network));
    }

    public static String encodeXAddress(String classicAddress, OptionalLong tag, LedgerNetwork network) {
        var accountId = accountId(classicAddress);
        if (accountId == null) {
            throw new IllegalArgumentException("Invalid classic address: " + classicAddress);
        }
        if (tag.isPresent() && (tag.getAsLong() < 0 || tag.getAsLong() > MAX_TAG)) {
            throw new IllegalArgumentException("Destination tag out of range: " + tag.getAsLong());
        }
        var payload = ByteBuffer.allocate(X_ADDRESS_LENGTH - CHECKSUM_LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        payload.put(network.prefix());
        payload.put(accountId);
        payload.put(tag.isPresent() ? TAG_PRESENT : TAG_ABSENT);
        payload.putLong(tag.orElse(0));
        return withChecksum(payload.array());
    }

    public static boolean isValidClassicAddress(String address) {
        return accountId(address) != null;
    }

    public static boolean isValidXAddress(String address) {
        return decodeXAddress(address).isPresent();
    }

    private static byte[] accountId(String classicAddress) {
        var payload = checked(classicAddress, CLASSIC_LENGTH);
        if (payload == null || payload[0] != CLASSIC_VERSION) {
            return null;
        }
        return Arrays.copyOfRange(payload, 1, 1 + ACCOUNT_ID_LENGTH);
    }

    /**
     * @return the payload without its checksum, or null if the encoding, length or checksum is wrong
     */
    private static byte[] checked(String encoded, int length) {
        if (encoded == null) {
            return null;
        }
        var decoded = Base58.decode(encoded);
        if (decoded == null || decoded.length != length) {
            return null;
        }
        var payload = Arrays.copyOf(decoded, length - CHECKSUM_LENGTH);
        var checksum = Arrays.copyOfRange(decoded, length - CHECKSUM_LENGTH, length);
        return Arrays.equals(checksum(payload), checksum) ? payload : null;
    }

    private static byte[] checksum(byte[] payload) {
        var once = Hashing.sha256().hashBytes(payload).asBytes();
        return Arrays.copyOf(Hashing.sha256().hashBytes(once).asBytes(), CHECKSUM_LENGTH);
    }

    private static String encodeClassic(byte[] accountId) {
        var payload = new byte[1 + ACCOUNT_ID_LENGTH];
        payload[0] = CLASSIC_VERSION;
        System.arraycopy(accountId, 0, payload, 1, ACCOUNT_ID_LENGTH);
        return withChecksum(payload);
    }

    private static String withChecksum(byte[] payload) {
        var full = Arrays.copyOf(payload, payload.length + CHECKSUM_LENGTH);
        System.arraycopy(checksum(payload), 0, full, payload.length, CHECKSUM_LENGTH);
        return Base58.encode(full);
    }
}
