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
import com.hellblazer.meridian.ledger.proto.LedgerApiGrpc;
import com.hellblazer.meridian.ledger.proto.LedgerApiGrpc.LedgerApiStub;
import com.hellblazer.meridian.ledger.proto.LedgerSequence;
import com.hellblazer.meridian.ledger.proto.SubmitSignedTransactionRequest;
import com.hellblazer.meridian.ledger.proto.SubmitSignedTransactionResponse;
import com.hellblazer.meridian.ledger.proto.TransactionStatus;
import io.grpc.ManagedChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Network client speaking the current ledger protocol
 *
 * @author hal.hildebrand
 */
public class GrpcNetworkClient implements NetworkClient {
    public static final String DEFAULT_ENDPOINT                 = "127.0.0.1:3001";
    public static final int    DEFAULT_MAX_INBOUND_MESSAGE_SIZE = 4 * 1024 * 1024;

    private static final Logger log = LoggerFactory.getLogger(GrpcNetworkClient.class);

    private final ManagedChannel       channel;
    private final LedgerApiStub        client;
    private final NetworkClientMetrics metrics;

    public GrpcNetworkClient() {
        this(DEFAULT_ENDPOINT);
    }

    public GrpcNetworkClient(String endpoint) {
        this(endpoint, true, DEFAULT_MAX_INBOUND_MESSAGE_SIZE, null);
    }

    public GrpcNetworkClient(String endpoint, boolean plaintext, int maxInboundMessageSize,
                             NetworkClientMetrics metrics) {
        this(Channels.forEndpoint(endpoint, plaintext, maxInboundMessageSize), metrics);
        log.info("Ledger client for: {} plaintext: {}", endpoint, plaintext && !Channels.isUrl(endpoint));
    }

    public GrpcNetworkClient(ManagedChannel channel, NetworkClientMetrics metrics) {
        this.channel = channel;
        this.metrics = metrics;
        this.client = LedgerApiGrpc.newStub(channel);
    }

    @Override
    public void close() {
        channel.shutdown();
    }

    @Override
    public CompletableFuture<AccountInfo> getAccountInfo(GetAccountInfoRequest request) {
        return UnaryCall.invoke("getAccountInfo", metrics, NetworkClientMetrics::accountInfo,
                                observer -> client.getAccountInfo(request, observer));
    }

    @Override
    public CompletableFuture<Fee> getFee(GetFeeRequest request) {
        return UnaryCall.invoke("getFee", metrics, NetworkClientMetrics::fee,
                                observer -> client.getFee(request, observer));
    }

    @Override
    public CompletableFuture<LedgerSequence> getLatestValidatedLedgerSequence(
    GetLatestValidatedLedgerSequenceRequest request) {
        return UnaryCall.invoke("getLatestValidatedLedgerSequence", metrics, NetworkClientMetrics::ledgerSequence,
                                observer -> client.getLatestValidatedLedgerSequence(request, observer));
    }

    @Override
    public CompletableFuture<TransactionStatus> getTransactionStatus(GetTransactionStatusRequest request) {
        return UnaryCall.invoke("getTransactionStatus", metrics, NetworkClientMetrics::transactionStatus,
                                observer -> client.getTransactionStatus(request, observer));
    }

    @Override
    public CompletableFuture<SubmitSignedTransactionResponse> submitSignedTransaction(
    SubmitSignedTransactionRequest request) {
        return UnaryCall.invoke("submitSignedTransaction", metrics, NetworkClientMetrics::submit,
                                observer -> client.submitSignedTransaction(request, observer));
    }
}
