/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

import com.hellblazer.meridian.client.address.AddressCodec;
import com.hellblazer.meridian.client.network.NetworkClient;
import com.hellblazer.meridian.client.signing.DefaultSigner;
import com.hellblazer.meridian.client.signing.Signer;
import com.hellblazer.meridian.client.signing.Wallet;
import com.hellblazer.meridian.ledger.proto.AccountAddress;
import com.hellblazer.meridian.ledger.proto.AccountInfo;
import com.hellblazer.meridian.ledger.proto.GetAccountInfoRequest;
import com.hellblazer.meridian.ledger.proto.GetFeeRequest;
import com.hellblazer.meridian.ledger.proto.GetLatestValidatedLedgerSequenceRequest;
import com.hellblazer.meridian.ledger.proto.GetTransactionStatusRequest;
import com.hellblazer.meridian.ledger.proto.Memo;
import com.hellblazer.meridian.ledger.proto.Payment;
import com.hellblazer.meridian.ledger.proto.SignedTransaction;
import com.hellblazer.meridian.ledger.proto.SubmitSignedTransactionRequest;
import com.hellblazer.meridian.ledger.proto.SubmitSignedTransactionResponse;
import com.hellblazer.meridian.ledger.proto.Transaction;
import com.hellblazer.meridian.ledger.proto.TransactionStatus;
import com.hellblazer.meridian.ledger.proto.XRPDropsAmount;
import io.grpc.Status;
import org.joou.ULong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Moves payments from intent to a broadcast transaction against a ledger node.
 * <p>
 * A send fetches the minimum fee and the sender's account sequence concurrently, assembles the payment transaction
 * once both arrive, signs it and submits the signed artifact. Nothing is cached between operations and nothing is
 * retried; the first failure of any step fails the returned future. The client holds no mutable state and may be
 * used concurrently.
 *
 * @author hal.hildebrand
 */
public class TransactionSubmissionClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(TransactionSubmissionClient.class);

    private final NetworkClient networkClient;
    private final boolean       owned;
    private final Signer        signer;

    public TransactionSubmissionClient(NetworkClient networkClient) {
        this(networkClient, new DefaultSigner());
    }

    public TransactionSubmissionClient(NetworkClient networkClient, Signer signer) {
        this(networkClient, signer, false);
    }

    private TransactionSubmissionClient(NetworkClient networkClient, Signer signer, boolean owned) {
        this.networkClient = networkClient;
        this.signer = signer;
        this.owned = owned;
    }

    public static TransactionSubmissionClient fromParameters(Parameters parameters) {
        return new TransactionSubmissionClient(parameters.newNetworkClient(), parameters.signer(), true);
    }

    public static TransactionSubmissionClient withEndpoint(String endpoint) {
        return withEndpoint(endpoint, false);
    }

    public static TransactionSubmissionClient withEndpoint(String endpoint, boolean legacy) {
        return fromParameters(Parameters.newBuilder().setEndpoint(endpoint).setLegacy(legacy).build());
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    /**
     * @return true if the ledger knows the account, false if the node reports it as not found
     */
    public CompletableFuture<Boolean> accountExists(String address) {
        return accountInfo(address).thenApply(info -> Boolean.TRUE).exceptionallyCompose(t -> {
            var cause = unwrap(t);
            if (cause instanceof NetworkException network && network.status().getCode() == Status.Code.NOT_FOUND) {
                log.trace("Account: {} not found", address);
                return CompletableFuture.completedFuture(Boolean.FALSE);
            }
            return CompletableFuture.failedFuture(cause);
        });
    }

    /**
     * Closes the network client, if this client created it
     */
    @Override
    public void close() {
        if (owned) {
            networkClient.close();
        }
    }

    /**
     * @return the account's balance in drops
     */
    public CompletableFuture<BigInteger> getBalance(String address) {
        return accountInfo(address).thenApply(info -> {
            if (!info.hasBalance()) {
                throw new MalformedResponseException("balance");
            }
            return Drops.fromWire(info.getBalance());
        });
    }

    public CompletableFuture<ULong> getLatestValidatedLedgerSequence() {
        var request = GetLatestValidatedLedgerSequenceRequest.getDefaultInstance();
        return networkClient.getLatestValidatedLedgerSequence(request)
                            .thenApply(sequence -> ULong.valueOf(sequence.getIndex()));
    }

    public CompletableFuture<PaymentStatus> getPaymentStatus(String transactionHash) {
        return getRawTransactionStatus(transactionHash).thenApply(PaymentStatus::from);
    }

    public CompletableFuture<TransactionStatus> getRawTransactionStatus(String transactionHash) {
        var request = GetTransactionStatusRequest.newBuilder().setTransactionHash(transactionHash).build();
        return networkClient.getTransactionStatus(request);
    }

    public CompletableFuture<SubmitSignedTransactionResponse> send(BigInteger amount, String destination,
                                                                   Wallet sender) {
        return send(amount, destination, sender, Collections.emptyList());
    }

    /**
     * Send drops from the sender's account to the destination, attaching the memos to the transaction.
     *
     * @return the node's verdict on the submission. The caller interprets the engine result; a completed future only
     *         means the transaction was broadcast.
     */
    public CompletableFuture<SubmitSignedTransactionResponse> send(BigInteger amount, String destination, Wallet sender,
                                                                   List<Memo> memos) {
        if (!AddressCodec.isValidXAddress(destination)) {
            return CompletableFuture.failedFuture(new InvalidAddressException(destination));
        }
        if (!AddressCodec.isValidXAddress(sender.getAddress())) {
            return CompletableFuture.failedFuture(new InvalidAddressException(sender.getAddress()));
        }
        final XRPDropsAmount drops;
        try {
            drops = Drops.toWire(amount);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Sending: {} drops from: {} to: {}", amount, sender.getAddress(), destination);

        var fee = minimumFee();
        var sequence = sequence(sender.getAddress());
        var assembled = fee.thenCombine(sequence,
                                        (f, s) -> assemble(sender.getAddress(), f, s, drops, destination, memos));
        failFast(assembled, fee, sequence);

        return assembled.thenApply(transaction -> sign(transaction, sender))
                        .thenCompose(signed -> networkClient.submitSignedTransaction(
                        SubmitSignedTransactionRequest.newBuilder().setSignedTransaction(signed).build()))
                        .whenComplete((result, t) -> {
                            if (t != null) {
                                log.debug("Send from: {} to: {} failed: {}", sender.getAddress(), destination,
                                          unwrap(t).toString());
                            } else {
                                log.debug("Sent from: {} to: {} result: {}", sender.getAddress(), destination,
                                          result.getEngineResult());
                            }
                        });
    }

    private CompletableFuture<AccountInfo> accountInfo(String address) {
        if (!AddressCodec.isValidXAddress(address)) {
            return CompletableFuture.failedFuture(new InvalidAddressException(address));
        }
        return networkClient.getAccountInfo(GetAccountInfoRequest.newBuilder()
                                                                 .setAccount(AccountAddress.newBuilder()
                                                                                           .setAddress(address))
                                                                 .build());
    }

    private Transaction assemble(String account, XRPDropsAmount fee, int sequence, XRPDropsAmount amount,
                                 String destination, List<Memo> memos) {
        var transaction = Transaction.newBuilder()
                                     .setAccount(AccountAddress.newBuilder().setAddress(account))
                                     .setFee(fee)
                                     .setSequence(sequence)
                                     .setPayment(Payment.newBuilder()
                                                        .setAmount(amount)
                                                        .setDestination(
                                                        AccountAddress.newBuilder().setAddress(destination)))
                                     .addAllMemos(memos)
                                     .build();
        log.trace("Assembled: {} fee: {} sequence: {}", account, fee.getDrops(), sequence);
        return transaction;
    }

    /**
     * The join waits for both lookups; a failure of either must end the send without waiting for the other
     */
    private void failFast(CompletableFuture<?> joined, CompletableFuture<?>... sources) {
        for (var source : sources) {
            source.whenComplete((r, t) -> {
                if (t != null) {
                    joined.completeExceptionally(unwrap(t));
                }
            });
        }
    }

    private CompletableFuture<XRPDropsAmount> minimumFee() {
        return networkClient.getFee(GetFeeRequest.getDefaultInstance()).thenApply(fee -> {
            if (!fee.hasMinimumFee()) {
                throw new MalformedResponseException("minimum fee");
            }
            return fee.getMinimumFee();
        });
    }

    private CompletableFuture<Integer> sequence(String address) {
        return accountInfo(address).thenApply(info -> {
            if (!info.hasSequence()) {
                throw new MalformedResponseException("sequence");
            }
            return info.getSequence();
        });
    }

    private SignedTransaction sign(Transaction transaction, Wallet wallet) {
        SignedTransaction signed;
        try {
            signed = signer.sign(transaction, wallet);
        } catch (Throwable e) {
            throw new SigningFailureException(e);
        }
        if (signed == null) {
            throw new SigningFailureException();
        }
        return signed;
    }
}
