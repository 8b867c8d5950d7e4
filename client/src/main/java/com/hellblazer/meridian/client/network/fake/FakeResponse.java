/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network.fake;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Either the value or the error a fake operation answers with
 *
 * @author hal.hildebrand
 */
public final class FakeResponse<T> {
    private final Throwable error;
    private final T         value;

    private FakeResponse(T value, Throwable error) {
        this.value = value;
        this.error = error;
    }

    public static <T> FakeResponse<T> failure(Throwable error) {
        return new FakeResponse<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> FakeResponse<T> success(T value) {
        return new FakeResponse<>(Objects.requireNonNull(value, "value"), null);
    }

    public boolean isFailure() {
        return error != null;
    }

    CompletableFuture<T> toFuture() {
        return error == null ? CompletableFuture.completedFuture(value) : CompletableFuture.failedFuture(error);
    }

    @Override
    public String toString() {
        return error == null ? "success: " + value : "failure: " + error;
    }
}
