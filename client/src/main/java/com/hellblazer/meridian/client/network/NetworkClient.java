/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network;

import com.hellblazer.meridian.ledger.proto.AccountInfo;
import com.hellblazer.meridian.ledger.proto.Fee;
import com.hellblazer.meridian.ledger.proto.GetAccountInfoRequest;
import com.hellblazer.meridian.ledger.proto.GetFeeRequest;
import com.hellblazer.meridian.ledger.proto.GetLatestValidatedLedgerSequenceRequest;
import com.hellblazer.meridian.ledger.proto.GetTransactionStatusRequest;
import com.hellblazer.meridian.ledger.proto.LedgerSequence;
import com.hellblazer.meridian.ledger.proto.SubmitSignedTransactionRequest;
import com.hellblazer.meridian.ledger.proto.SubmitSignedTransactionResponse;
import com.hellblazer.meridian.ledger.proto.TransactionStatus;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

/**
 * The remote procedures of a ledger node. Every operation completes with the node's response, or fails with a
 * {@link com.hellblazer.meridian.client.NetworkException} if the call failed or the node sent no response.
 * Implementations never retry.
 *
 * @author hal.hildebrand
 */
public interface NetworkClient extends Closeable {

    CompletableFuture<AccountInfo> getAccountInfo(GetAccountInfoRequest request);

    CompletableFuture<Fee> getFee(GetFeeRequest request);

    CompletableFuture<LedgerSequence> getLatestValidatedLedgerSequence(GetLatestValidatedLedgerSequenceRequest request);

    CompletableFuture<TransactionStatus> getTransactionStatus(GetTransactionStatusRequest request);

    /**
     * Broadcast the signed transaction. Completion means the node accepted it for relay, not that it was validated.
     */
    CompletableFuture<SubmitSignedTransactionResponse> submitSignedTransaction(SubmitSignedTransactionRequest request);

    @Override
    void close();
}
