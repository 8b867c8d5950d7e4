/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.signing;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;

/**
 * A wallet holding a JCA key pair. Derivation of the address from the key is out of scope, so the address is supplied
 * by whoever provisioned the keys.
 *
 * @author hal.hildebrand
 */
public class KeyPairWallet implements Wallet {
    public static final String DEFAULT_ALGORITHM = "Ed25519";

    private final String  address;
    private final String  algorithm;
    private final KeyPair keyPair;

    public KeyPairWallet(String address, KeyPair keyPair) {
        this(address, keyPair, DEFAULT_ALGORITHM);
    }

    public KeyPairWallet(String address, KeyPair keyPair, String algorithm) {
        this.address = address;
        this.keyPair = keyPair;
        this.algorithm = algorithm;
    }

    public static KeyPairWallet generate(String address) {
        try {
            return new KeyPairWallet(address, KeyPairGenerator.getInstance(DEFAULT_ALGORITHM).generateKeyPair());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to generate " + DEFAULT_ALGORITHM + " key pair", e);
        }
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public byte[] getPublicKey() {
        return keyPair.getPublic().getEncoded();
    }

    @Override
    public byte[] sign(byte[] message) {
        try {
            var signature = Signature.getInstance(algorithm);
            signature.initSign(keyPair.getPrivate());
            signature.update(message);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to sign with " + algorithm, e);
        }
    }

    public boolean verify(byte[] message, byte[] signed) {
        try {
            var signature = Signature.getInstance(algorithm);
            signature.initVerify(keyPair.getPublic());
            signature.update(message);
            return signature.verify(signed);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return "Wallet[" + address + "]";
    }
}
