/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network;

import com.codahale.metrics.Timer;
import com.hellblazer.meridian.client.NetworkException;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Adapts a unary call on an async gRPC stub to a {@link CompletableFuture}. A transport error and a call that
 * completes without a response fail the future identically, with a {@link NetworkException}.
 *
 * @author hal.hildebrand
 */
public final class UnaryCall<T> implements StreamObserver<T> {
    private static final Logger log = LoggerFactory.getLogger(UnaryCall.class);

    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final NetworkClientMetrics metrics;
    private final String               method;
    private final Timer.Context        timer;
    private volatile T                 response;

    private UnaryCall(String method, NetworkClientMetrics metrics, Function<NetworkClientMetrics, Timer> timer) {
        this.method = method;
        this.metrics = metrics;
        this.timer = metrics == null ? null : timer.apply(metrics).time();
    }

    /**
     * Issue the call, supplying the observer that completes the returned future
     */
    public static <T> CompletableFuture<T> invoke(String method, NetworkClientMetrics metrics,
                                                  Function<NetworkClientMetrics, Timer> timer,
                                                  Consumer<StreamObserver<T>> call) {
        var observer = new UnaryCall<T>(method, metrics, timer);
        try {
            call.accept(observer);
        } catch (RuntimeException e) {
            observer.onError(e);
        }
        return observer.future;
    }

    @Override
    public void onCompleted() {
        stop();
        var result = response;
        if (result == null) {
            log.debug("{} completed without a response", method);
            failed();
            future.completeExceptionally(new NetworkException(method + " returned no response"));
            return;
        }
        log.trace("{} completed", method);
        future.complete(result);
    }

    @Override
    public void onError(Throwable t) {
        stop();
        failed();
        var status = Status.fromThrowable(t);
        log.debug("{} failed: {}", method, status);
        future.completeExceptionally(new NetworkException(method + " failed: " + status, t));
    }

    @Override
    public void onNext(T value) {
        response = value;
    }

    private void failed() {
        if (metrics != null) {
            metrics.failures().mark();
        }
    }

    private void stop() {
        if (timer != null) {
            timer.stop();
        }
    }
}
