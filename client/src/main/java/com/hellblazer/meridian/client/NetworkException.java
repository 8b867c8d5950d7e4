/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

import io.grpc.Status;

/**
 * A backend's transport call failed, or completed without a response.
 *
 * @author hal.hildebrand
 */
public class NetworkException extends LedgerClientException {

    private static final long serialVersionUID = 1L;

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the gRPC status of the failed call, or UNKNOWN if the failure did not originate in the transport
     */
    public Status status() {
        return getCause() == null ? Status.UNKNOWN : Status.fromThrowable(getCause());
    }
}
