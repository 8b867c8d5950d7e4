/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network.fake;

import com.hellblazer.meridian.client.NetworkException;
import com.hellblazer.meridian.client.network.NetworkClient;
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
import com.hellblazer.meridian.ledger.proto.XRPDropsAmount;

import java.util.concurrent.CompletableFuture;

/**
 * A network client answering from pre-programmed responses, without I/O. Each operation kind has its own slot, which
 * holds either a value to complete with or an error to fail with.
 *
 * @author hal.hildebrand
 */
public class FakeNetworkClient implements NetworkClient {

    private final Responses responses;

    public FakeNetworkClient() {
        this(Responses.SUCCESSFUL);
    }

    public FakeNetworkClient(Responses responses) {
        this.responses = responses;
    }

    @Override
    public void close() {
    }

    @Override
    public CompletableFuture<AccountInfo> getAccountInfo(GetAccountInfoRequest request) {
        return responses.accountInfo().toFuture();
    }

    @Override
    public CompletableFuture<Fee> getFee(GetFeeRequest request) {
        return responses.fee().toFuture();
    }

    @Override
    public CompletableFuture<LedgerSequence> getLatestValidatedLedgerSequence(
    GetLatestValidatedLedgerSequenceRequest request) {
        return responses.ledgerSequence().toFuture();
    }

    @Override
    public CompletableFuture<TransactionStatus> getTransactionStatus(GetTransactionStatusRequest request) {
        return responses.transactionStatus().toFuture();
    }

    public Responses getResponses() {
        return responses;
    }

    @Override
    public CompletableFuture<SubmitSignedTransactionResponse> submitSignedTransaction(
    SubmitSignedTransactionRequest request) {
        return responses.submit().toFuture();
    }

    /**
     * The slots of a fake client. Use the {@code with} methods to replace one slot of a preset.
     */
    public record Responses(FakeResponse<AccountInfo> accountInfo, FakeResponse<Fee> fee,
                            FakeResponse<SubmitSignedTransactionResponse> submit,
                            FakeResponse<LedgerSequence> ledgerSequence,
                            FakeResponse<TransactionStatus> transactionStatus) {

        public static final NetworkException DEFAULT_ERROR     = new NetworkException("fake network client failure");
        public static final long             DEFAULT_BALANCE   = 4000;
        public static final long             DEFAULT_FEE       = 10;
        public static final String           DEFAULT_BLOB      = "DEADBEEF";
        public static final int              DEFAULT_SEQUENCE  = 12;
        public static final long             DEFAULT_LEDGER    = 12;
        public static final String           SUCCESS           = "tesSUCCESS";
        public static final String           SUCCESS_MESSAGE   = "The transaction was applied. Only final in a validated ledger.";

        public static final Responses SUCCESSFUL = new Responses(FakeResponse.success(defaultAccountInfo()),
                                                                 FakeResponse.success(defaultFee()),
                                                                 FakeResponse.success(defaultSubmitResponse()),
                                                                 FakeResponse.success(defaultLedgerSequence()),
                                                                 FakeResponse.success(defaultTransactionStatus()));

        public static final Responses FAILING = new Responses(FakeResponse.failure(DEFAULT_ERROR),
                                                              FakeResponse.failure(DEFAULT_ERROR),
                                                              FakeResponse.failure(DEFAULT_ERROR),
                                                              FakeResponse.failure(DEFAULT_ERROR),
                                                              FakeResponse.failure(DEFAULT_ERROR));

        public static AccountInfo defaultAccountInfo() {
            return AccountInfo.newBuilder()
                              .setBalance(XRPDropsAmount.newBuilder().setDrops(DEFAULT_BALANCE))
                              .setSequence(DEFAULT_SEQUENCE)
                              .build();
        }

        public static Fee defaultFee() {
            var drops = XRPDropsAmount.newBuilder().setDrops(DEFAULT_FEE).build();
            return Fee.newBuilder().setMinimumFee(drops).setBaseFee(drops).build();
        }

        public static LedgerSequence defaultLedgerSequence() {
            return LedgerSequence.newBuilder().setIndex(DEFAULT_LEDGER).build();
        }

        public static SubmitSignedTransactionResponse defaultSubmitResponse() {
            return SubmitSignedTransactionResponse.newBuilder()
                                                  .setEngineResult(SUCCESS)
                                                  .setEngineResultCode(0)
                                                  .setEngineResultMessage(SUCCESS_MESSAGE)
                                                  .setTransactionBlob(DEFAULT_BLOB)
                                                  .build();
        }

        public static TransactionStatus defaultTransactionStatus() {
            return TransactionStatus.newBuilder().setValidated(true).setTransactionStatusCode(SUCCESS).build();
        }

        public Responses withAccountInfo(FakeResponse<AccountInfo> accountInfo) {
            return new Responses(accountInfo, fee, submit, ledgerSequence, transactionStatus);
        }

        public Responses withFee(FakeResponse<Fee> fee) {
            return new Responses(accountInfo, fee, submit, ledgerSequence, transactionStatus);
        }

        public Responses withLedgerSequence(FakeResponse<LedgerSequence> ledgerSequence) {
            return new Responses(accountInfo, fee, submit, ledgerSequence, transactionStatus);
        }

        public Responses withSubmit(FakeResponse<SubmitSignedTransactionResponse> submit) {
            return new Responses(accountInfo, fee, submit, ledgerSequence, transactionStatus);
        }

        public Responses withTransactionStatus(FakeResponse<TransactionStatus> transactionStatus) {
            return new Responses(accountInfo, fee, submit, ledgerSequence, transactionStatus);
        }
    }
}
