/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network.legacy;

import com.hellblazer.meridian.client.MalformedResponseException;
import com.hellblazer.meridian.ledger.proto.AccountInfo;
import com.hellblazer.meridian.ledger.proto.Fee;
import com.hellblazer.meridian.ledger.proto.GetAccountInfoRequest;
import com.hellblazer.meridian.ledger.proto.GetTransactionStatusRequest;
import com.hellblazer.meridian.ledger.proto.LedgerSequence;
import com.hellblazer.meridian.ledger.proto.SubmitSignedTransactionRequest;
import com.hellblazer.meridian.ledger.proto.SubmitSignedTransactionResponse;
import com.hellblazer.meridian.ledger.proto.TransactionStatus;
import com.hellblazer.meridian.ledger.proto.XRPDropsAmount;
import com.hellblazer.meridian.legacy.proto.Legacy;
import org.joou.ULong;

/**
 * Conversion between the legacy wire messages and those of the current protocol. Fields absent on the legacy side
 * remain absent after conversion, so the pipeline sees the same malformation either way.
 *
 * @author hal.hildebrand
 */
final class LegacyTranslation {
    private static final long MAX_SEQUENCE = 0xFFFF_FFFFL;

    private LegacyTranslation() {
    }

    static AccountInfo fromLegacy(Legacy.AccountInfo legacy) {
        var builder = AccountInfo.newBuilder().setFlags(legacy.getFlags());
        if (legacy.hasBalance() && !legacy.getBalance().getDrops().isEmpty()) {
            builder.setBalance(drops(legacy.getBalance(), "balance"));
        }
        if (legacy.hasSequence()) {
            var sequence = legacy.getSequence();
            if (sequence < 0 || sequence > MAX_SEQUENCE) {
                throw new MalformedResponseException("sequence");
            }
            builder.setSequence((int) sequence);
        }
        return builder.build();
    }

    static Fee fromLegacy(Legacy.Fee legacy) {
        var builder = Fee.newBuilder();
        if (legacy.hasAmount() && !legacy.getAmount().getDrops().isEmpty()) {
            builder.setMinimumFee(drops(legacy.getAmount(), "fee"));
        }
        return builder.build();
    }

    static LedgerSequence fromLegacy(Legacy.LedgerSequence legacy) {
        return LedgerSequence.newBuilder().setIndex(legacy.getIndex()).build();
    }

    static SubmitSignedTransactionResponse fromLegacy(Legacy.SubmitSignedTransactionResponse legacy) {
        return SubmitSignedTransactionResponse.newBuilder()
                                              .setEngineResult(legacy.getEngineResult())
                                              .setEngineResultCode(engineResultCode(legacy))
                                              .setEngineResultMessage(legacy.getEngineResultMessage())
                                              .setTransactionBlob(legacy.getTransactionBlob())
                                              .build();
    }

    static TransactionStatus fromLegacy(Legacy.TransactionStatus legacy) {
        return TransactionStatus.newBuilder()
                                .setValidated(legacy.getValidated())
                                .setTransactionStatusCode(legacy.getTransactionStatusCode())
                                .build();
    }

    static Legacy.GetAccountInfoRequest toLegacy(GetAccountInfoRequest request) {
        return Legacy.GetAccountInfoRequest.newBuilder().setAddress(request.getAccount().getAddress()).build();
    }

    static Legacy.SubmitSignedTransactionRequest toLegacy(SubmitSignedTransactionRequest request) {
        return Legacy.SubmitSignedTransactionRequest.newBuilder()
                                                    .setSignedTransaction(
                                                    request.getSignedTransaction().toByteString())
                                                    .build();
    }

    static Legacy.GetTransactionStatusRequest toLegacy(GetTransactionStatusRequest request) {
        return Legacy.GetTransactionStatusRequest.newBuilder()
                                                 .setTransactionHash(request.getTransactionHash())
                                                 .build();
    }

    private static int engineResultCode(Legacy.SubmitSignedTransactionResponse legacy) {
        var code = legacy.getEngineResultCode();
        if (code < Integer.MIN_VALUE || code > Integer.MAX_VALUE) {
            throw new MalformedResponseException("engine result code");
        }
        return (int) code;
    }

    private static XRPDropsAmount drops(Legacy.XRPAmount amount, String field) {
        try {
            return XRPDropsAmount.newBuilder().setDrops(ULong.valueOf(amount.getDrops()).longValue()).build();
        } catch (IllegalArgumentException e) {
            throw new MalformedResponseException(field);
        }
    }
}
