/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network.legacy;

import com.hellblazer.meridian.client.network.Channels;
import com.hellblazer.meridian.client.network.GrpcNetworkClient;
import com.hellblazer.meridian.client.network.NetworkClient;
import com.hellblazer.meridian.client.network.NetworkClientMetrics;
import com.hellblazer.meridian.client.network.UnaryCall;
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
import com.hellblazer.meridian.legacy.proto.Legacy;
import com.hellblazer.meridian.legacy.proto.XRPLedgerAPIGrpc;
import com.hellblazer.meridian.legacy.proto.XRPLedgerAPIGrpc.XRPLedgerAPIStub;
import io.grpc.ManagedChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

import static com.hellblazer.meridian.client.network.legacy.LegacyTranslation.toLegacy;

/**
 * Network client speaking the legacy ledger protocol, translating its messages to and from those of the current
 * protocol.
 *
 * @author hal.hildebrand
 */
public class LegacyGrpcNetworkClient implements NetworkClient {
    private static final Logger log = LoggerFactory.getLogger(LegacyGrpcNetworkClient.class);

    private final ManagedChannel       channel;
    private final XRPLedgerAPIStub     client;
    private final NetworkClientMetrics metrics;

    public LegacyGrpcNetworkClient(String endpoint) {
        this(endpoint, true, GrpcNetworkClient.DEFAULT_MAX_INBOUND_MESSAGE_SIZE, null);
    }

    public LegacyGrpcNetworkClient(String endpoint, boolean plaintext, int maxInboundMessageSize,
                                   NetworkClientMetrics metrics) {
        this(shimmed(endpoint, plaintext, maxInboundMessageSize), metrics);
        log.info("Legacy ledger client for: {}", endpoint);
    }

    public LegacyGrpcNetworkClient(ManagedChannel channel, NetworkClientMetrics metrics) {
        this.channel = channel;
        this.metrics = metrics;
        this.client = XRPLedgerAPIGrpc.newStub(channel);
    }

    private static ManagedChannel shimmed(String endpoint, boolean plaintext, int maxInboundMessageSize) {
        LegacyTransportShim.install();
        return Channels.forEndpoint(endpoint, plaintext, maxInboundMessageSize);
    }

    @Override
    public void close() {
        channel.shutdown();
    }

    @Override
    public CompletableFuture<AccountInfo> getAccountInfo(GetAccountInfoRequest request) {
        var legacy = toLegacy(request);
        return UnaryCall.<Legacy.AccountInfo>invoke("getAccountInfo", metrics, NetworkClientMetrics::accountInfo,
                                                    observer -> client.getAccountInfo(legacy, observer))
                        .thenApply(LegacyTranslation::fromLegacy);
    }

    @Override
    public CompletableFuture<Fee> getFee(GetFeeRequest request) {
        var legacy = Legacy.GetFeeRequest.getDefaultInstance();
        return UnaryCall.<Legacy.Fee>invoke("getFee", metrics, NetworkClientMetrics::fee,
                                            observer -> client.getFee(legacy, observer))
                        .thenApply(LegacyTranslation::fromLegacy);
    }

    @Override
    public CompletableFuture<LedgerSequence> getLatestValidatedLedgerSequence(
    GetLatestValidatedLedgerSequenceRequest request) {
        var legacy = Legacy.GetLatestValidatedLedgerSequenceRequest.getDefaultInstance();
        return UnaryCall.<Legacy.LedgerSequence>invoke("getLatestValidatedLedgerSequence", metrics,
                                                       NetworkClientMetrics::ledgerSequence,
                                                       observer -> client.getLatestValidatedLedgerSequence(legacy,
                                                                                                           observer))
                        .thenApply(LegacyTranslation::fromLegacy);
    }

    @Override
    public CompletableFuture<TransactionStatus> getTransactionStatus(GetTransactionStatusRequest request) {
        var legacy = toLegacy(request);
        return UnaryCall.<Legacy.TransactionStatus>invoke("getTransactionStatus", metrics,
                                                          NetworkClientMetrics::transactionStatus,
                                                          observer -> client.getTransactionStatus(legacy, observer))
                        .thenApply(LegacyTranslation::fromLegacy);
    }

    @Override
    public CompletableFuture<SubmitSignedTransactionResponse> submitSignedTransaction(
    SubmitSignedTransactionRequest request) {
        var legacy = toLegacy(request);
        return UnaryCall.<Legacy.SubmitSignedTransactionResponse>invoke("submitSignedTransaction", metrics,
                                                                        NetworkClientMetrics::submit,
                                                                        observer -> client.submitSignedTransaction(
                                                                        legacy, observer))
                        .thenApply(LegacyTranslation::fromLegacy);
    }
}
