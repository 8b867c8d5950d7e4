/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

import com.google.protobuf.ByteString;
import com.hellblazer.meridian.client.network.NetworkClient;
import com.hellblazer.meridian.client.network.fake.FakeNetworkClient;
import com.hellblazer.meridian.client.network.fake.FakeNetworkClient.Responses;
import com.hellblazer.meridian.client.network.fake.FakeResponse;
import com.hellblazer.meridian.client.signing.DefaultSigner;
import com.hellblazer.meridian.client.signing.KeyPairWallet;
import com.hellblazer.meridian.client.signing.Signer;
import com.hellblazer.meridian.client.signing.Wallet;
import com.hellblazer.meridian.ledger.proto.AccountInfo;
import com.hellblazer.meridian.ledger.proto.Fee;
import com.hellblazer.meridian.ledger.proto.Memo;
import com.hellblazer.meridian.ledger.proto.SignedTransaction;
import com.hellblazer.meridian.ledger.proto.Transaction;
import com.hellblazer.meridian.ledger.proto.TransactionStatus;
import com.hellblazer.meridian.ledger.proto.XRPDropsAmount;
import io.grpc.Status;
import org.joou.ULong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author hal.hildebrand
 */
public class TransactionSubmissionClientTest {
    static final String SENDER      = "X7cBcY4bdTTzk3LHmrKAK6GyrirkXfLHGFxzke5zTmYMfw4";
    static final String DESTINATION = "XVYUQ3SdUcVnaTNVanDYo1NamrUukPUPeoGMnmvkEExbtrj";
    static final String CLASSIC     = "rsegqrgSP8XmhCYwL9enkZ9BNDNawfPZnn";
    static final String HASH        = "4CB1D8A3F0B1A9E2C4D6B7F5E3A1C9D7B5F3E1A9C7D5B3F1E9A7C5D3B1F9E7A5";

    private Wallet sender;

    static Throwable failure(CompletableFuture<?> future) throws InterruptedException {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (java.util.concurrent.TimeoutException e) {
            fail("Future did not complete");
        }
        fail("Expected failure");
        return null;
    }

    @BeforeEach
    public void before() {
        sender = KeyPairWallet.generate(SENDER);
    }

    @Test
    public void accountExists() throws Exception {
        var client = new TransactionSubmissionClient(new FakeNetworkClient());
        assertTrue(client.accountExists(DESTINATION).get());
    }

    @Test
    public void accountDoesNotExist() throws Exception {
        var notFound = new NetworkException("getAccountInfo failed", Status.NOT_FOUND.asRuntimeException());
        var responses = Responses.SUCCESSFUL.withAccountInfo(FakeResponse.failure(notFound));
        var client = new TransactionSubmissionClient(new FakeNetworkClient(responses));
        assertFalse(client.accountExists(DESTINATION).get());
    }

    @Test
    public void accountExistsPropagatesOtherFailures() throws Exception {
        var unavailable = new NetworkException("getAccountInfo failed", Status.UNAVAILABLE.asRuntimeException());
        var responses = Responses.SUCCESSFUL.withAccountInfo(FakeResponse.failure(unavailable));
        var client = new TransactionSubmissionClient(new FakeNetworkClient(responses));
        assertSame(unavailable, failure(client.accountExists(DESTINATION)));
    }

    @Test
    public void allFailing() throws Exception {
        var client = new TransactionSubmissionClient(new FakeNetworkClient(Responses.FAILING));

        assertSame(Responses.DEFAULT_ERROR, failure(client.getBalance(SENDER)));
        assertSame(Responses.DEFAULT_ERROR, failure(client.send(BigInteger.ONE, DESTINATION, sender)));
        assertSame(Responses.DEFAULT_ERROR, failure(client.getPaymentStatus(HASH)));
        assertSame(Responses.DEFAULT_ERROR, failure(client.getRawTransactionStatus(HASH)));
        assertSame(Responses.DEFAULT_ERROR, failure(client.getLatestValidatedLedgerSequence()));
        assertSame(Responses.DEFAULT_ERROR, failure(client.accountExists(SENDER)));
    }

    @Test
    public void balance() throws Exception {
        var client = new TransactionSubmissionClient(new FakeNetworkClient());
        assertEquals(BigInteger.valueOf(4000), client.getBalance(SENDER).get());
    }

    @Test
    public void balanceBeyondSignedRange() throws Exception {
        var info = AccountInfo.newBuilder().setBalance(XRPDropsAmount.newBuilder().setDrops(-1L)).build();
        var client = new TransactionSubmissionClient(
        new FakeNetworkClient(Responses.SUCCESSFUL.withAccountInfo(FakeResponse.success(info))));
        assertEquals(new BigInteger("18446744073709551615"), client.getBalance(SENDER).get());
    }

    @Test
    public void balanceMissing() throws Exception {
        var info = AccountInfo.newBuilder().setSequence(12).build();
        var client = new TransactionSubmissionClient(
        new FakeNetworkClient(Responses.SUCCESSFUL.withAccountInfo(FakeResponse.success(info))));
        var failure = failure(client.getBalance(SENDER));
        assertInstanceOf(MalformedResponseException.class, failure);
        assertEquals(MalformedResponseException.MALFORMED_RESPONSE, failure.getMessage());
    }

    @Test
    public void invalidAddressNeverReachesTheNetwork() throws Exception {
        var network = mock(NetworkClient.class);
        var client = new TransactionSubmissionClient(network);

        assertInstanceOf(InvalidAddressException.class, failure(client.getBalance(CLASSIC)));
        assertInstanceOf(InvalidAddressException.class, failure(client.getBalance("not an address")));
        assertInstanceOf(InvalidAddressException.class, failure(client.send(BigInteger.ONE, CLASSIC, sender)));
        assertInstanceOf(InvalidAddressException.class,
                         failure(client.send(BigInteger.ONE, DESTINATION, KeyPairWallet.generate(CLASSIC))));
        assertInstanceOf(InvalidAddressException.class, failure(client.accountExists("")));

        verifyNoInteractions(network);
    }

    @Test
    public void invalidAmountNeverReachesTheNetwork() throws Exception {
        var network = mock(NetworkClient.class);
        var client = new TransactionSubmissionClient(network);

        assertInstanceOf(IllegalArgumentException.class,
                         failure(client.send(BigInteger.valueOf(-1), DESTINATION, sender)));
        assertInstanceOf(IllegalArgumentException.class,
                         failure(client.send(BigInteger.TWO.pow(64), DESTINATION, sender)));

        verifyNoInteractions(network);
    }

    @Test
    public void latestValidatedLedgerSequence() throws Exception {
        var client = new TransactionSubmissionClient(new FakeNetworkClient());
        assertEquals(ULong.valueOf(12), client.getLatestValidatedLedgerSequence().get());
    }

    @Test
    public void missingFee() throws Exception {
        var responses = Responses.SUCCESSFUL.withFee(FakeResponse.success(Fee.getDefaultInstance()));
        var client = new TransactionSubmissionClient(new FakeNetworkClient(responses));
        var failure = failure(client.send(BigInteger.ONE, DESTINATION, sender));
        assertInstanceOf(MalformedResponseException.class, failure);
        assertEquals("minimum fee", ((MalformedResponseException) failure).missing());
    }

    @Test
    public void missingSequence() throws Exception {
        var info = AccountInfo.newBuilder().setBalance(XRPDropsAmount.newBuilder().setDrops(4000)).build();
        var responses = Responses.SUCCESSFUL.withAccountInfo(FakeResponse.success(info));
        var client = new TransactionSubmissionClient(new FakeNetworkClient(responses));
        var failure = failure(client.send(BigInteger.ONE, DESTINATION, sender));
        assertInstanceOf(MalformedResponseException.class, failure);
        assertEquals("sequence", ((MalformedResponseException) failure).missing());
    }

    @Test
    public void paymentStatus() throws Exception {
        var client = new TransactionSubmissionClient(new FakeNetworkClient());
        assertEquals(PaymentStatus.SUCCEEDED, client.getPaymentStatus(HASH).get());

        var pending = TransactionStatus.newBuilder().setValidated(false).build();
        client = new TransactionSubmissionClient(
        new FakeNetworkClient(Responses.SUCCESSFUL.withTransactionStatus(FakeResponse.success(pending))));
        assertEquals(PaymentStatus.PENDING, client.getPaymentStatus(HASH).get());
        assertEquals(pending, client.getRawTransactionStatus(HASH).get());
    }

    @Test
    public void send() throws Exception {
        var signed = new AtomicReference<Transaction>();
        var defaultSigner = new DefaultSigner();
        Signer signer = (transaction, wallet) -> {
            signed.set(transaction);
            return defaultSigner.sign(transaction, wallet);
        };
        var client = new TransactionSubmissionClient(new FakeNetworkClient(), signer);

        var result = client.send(BigInteger.ONE, DESTINATION, sender).get();

        assertEquals("tesSUCCESS", result.getEngineResult());
        assertEquals("DEADBEEF", result.getTransactionBlob());

        var transaction = signed.get();
        assertNotNull(transaction);
        assertEquals(10, transaction.getFee().getDrops());
        assertEquals(12, transaction.getSequence());
        assertEquals(SENDER, transaction.getAccount().getAddress());
        assertEquals(1, transaction.getPayment().getAmount().getDrops());
        assertEquals(DESTINATION, transaction.getPayment().getDestination().getAddress());
        assertEquals(0, transaction.getMemosCount());
    }

    @Test
    public void sendFailsFastWhenFeeLookupFails() throws Exception {
        var network = mock(NetworkClient.class);
        when(network.getFee(any())).thenReturn(CompletableFuture.failedFuture(Responses.DEFAULT_ERROR));
        when(network.getAccountInfo(any())).thenReturn(new CompletableFuture<>());
        var client = new TransactionSubmissionClient(network);

        assertSame(Responses.DEFAULT_ERROR, failure(client.send(BigInteger.ONE, DESTINATION, sender)));
        verify(network, times(0)).submitSignedTransaction(any());
    }

    @Test
    public void sendFailsFastWhenAccountLookupFails() throws Exception {
        var network = mock(NetworkClient.class);
        when(network.getFee(any())).thenReturn(new CompletableFuture<>());
        when(network.getAccountInfo(any())).thenReturn(CompletableFuture.failedFuture(Responses.DEFAULT_ERROR));
        var client = new TransactionSubmissionClient(network);

        assertSame(Responses.DEFAULT_ERROR, failure(client.send(BigInteger.ONE, DESTINATION, sender)));
        verify(network, times(0)).submitSignedTransaction(any());
    }

    @Test
    public void sendIsNotDeduplicated() throws Exception {
        var network = mock(NetworkClient.class);
        var fake = new FakeNetworkClient();
        when(network.getFee(any())).then(invocation -> fake.getFee(invocation.getArgument(0)));
        when(network.getAccountInfo(any())).then(invocation -> fake.getAccountInfo(invocation.getArgument(0)));
        when(network.submitSignedTransaction(any())).then(
        invocation -> fake.submitSignedTransaction(invocation.getArgument(0)));
        var client = new TransactionSubmissionClient(network);

        var first = client.send(BigInteger.ONE, DESTINATION, sender).get();
        var second = client.send(BigInteger.ONE, DESTINATION, sender).get();

        assertEquals("tesSUCCESS", first.getEngineResult());
        assertEquals("tesSUCCESS", second.getEngineResult());
        verify(network, times(2)).getFee(any());
        verify(network, times(2)).getAccountInfo(any());
        verify(network, times(2)).submitSignedTransaction(any());
    }

    @Test
    public void sendPropagatesSubmissionFailure() throws Exception {
        var rejected = new NetworkException("submitSignedTransaction failed");
        var responses = Responses.SUCCESSFUL.withSubmit(FakeResponse.failure(rejected));
        var client = new TransactionSubmissionClient(new FakeNetworkClient(responses));
        assertSame(rejected, failure(client.send(BigInteger.ONE, DESTINATION, sender)));
    }

    @Test
    public void sendWithMemos() throws Exception {
        var signed = new AtomicReference<Transaction>();
        Signer signer = (transaction, wallet) -> {
            signed.set(transaction);
            return SignedTransaction.newBuilder().setTransaction(transaction).build();
        };
        var memos = List.of(Memo.newBuilder()
                                .setData(ByteString.copyFromUtf8("I forgot to pick up Carl..."))
                                .setFormat(ByteString.copyFromUtf8("jaypeg"))
                                .setType(ByteString.copyFromUtf8("meme"))
                                .build(), Memo.newBuilder().setType(ByteString.copyFromUtf8("no data")).build());
        var client = new TransactionSubmissionClient(new FakeNetworkClient(), signer);

        var result = client.send(BigInteger.TEN, DESTINATION, sender, memos).get();

        assertEquals("tesSUCCESS", result.getEngineResult());
        assertEquals(memos, signed.get().getMemosList());
    }

    @Test
    public void signerReturnsNothing() throws Exception {
        var client = new TransactionSubmissionClient(new FakeNetworkClient(), (transaction, wallet) -> null);
        var failure = failure(client.send(BigInteger.ONE, DESTINATION, sender));
        assertInstanceOf(SigningFailureException.class, failure);
        assertEquals(SigningFailureException.SIGNING_FAILURE, failure.getMessage());
    }

    @Test
    public void signerThrowsError() throws Exception {
        Signer signer = (transaction, wallet) -> {
            throw new AssertionError("secure element fault");
        };
        var client = new TransactionSubmissionClient(new FakeNetworkClient(), signer);

        var failure = failure(client.send(BigInteger.ONE, DESTINATION, sender));

        assertInstanceOf(SigningFailureException.class, failure);
        assertInstanceOf(AssertionError.class, failure.getCause());
        assertTrue(failure.getMessage().endsWith("secure element fault"), failure.getMessage());
    }

    @Test
    public void signerThrows() throws Exception {
        Signer signer = (transaction, wallet) -> {
            throw new IllegalStateException("hardware wallet unplugged");
        };
        var network = mock(NetworkClient.class);
        var fake = new FakeNetworkClient();
        when(network.getFee(any())).then(invocation -> fake.getFee(invocation.getArgument(0)));
        when(network.getAccountInfo(any())).then(invocation -> fake.getAccountInfo(invocation.getArgument(0)));
        var client = new TransactionSubmissionClient(network, signer);

        var failure = failure(client.send(BigInteger.ONE, DESTINATION, sender));

        assertInstanceOf(SigningFailureException.class, failure);
        assertTrue(failure.getMessage().contains("hardware wallet unplugged"), failure.getMessage());
        assertInstanceOf(IllegalStateException.class, failure.getCause());
        verify(network, times(0)).submitSignedTransaction(any());
    }
}
