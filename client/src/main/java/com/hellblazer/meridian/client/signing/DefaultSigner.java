/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.signing;

import com.google.protobuf.ByteString;
import com.hellblazer.meridian.ledger.proto.SignedTransaction;
import com.hellblazer.meridian.ledger.proto.Transaction;

/**
 * Signs the serialized transaction with the wallet's key
 *
 * @author hal.hildebrand
 */
public class DefaultSigner implements Signer {

    @Override
    public SignedTransaction sign(Transaction transaction, Wallet wallet) {
        if (!transaction.getAccount().getAddress().equals(wallet.getAddress())) {
            throw new IllegalArgumentException(
            "Transaction account: " + transaction.getAccount().getAddress() + " is not the wallet: "
            + wallet.getAddress());
        }
        var signature = wallet.sign(transaction.toByteArray());
        return SignedTransaction.newBuilder()
                                .setTransaction(transaction)
                                .setPublicKey(ByteString.copyFrom(wallet.getPublicKey()))
                                .setSignature(ByteString.copyFrom(signature))
                                .build();
    }
}
