/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client;

import com.hellblazer.meridian.client.network.GrpcNetworkClient;
import com.hellblazer.meridian.client.network.NetworkClient;
import com.hellblazer.meridian.client.network.NetworkClientMetrics;
import com.hellblazer.meridian.client.network.legacy.LegacyGrpcNetworkClient;
import com.hellblazer.meridian.client.signing.DefaultSigner;
import com.hellblazer.meridian.client.signing.Signer;

/**
 * @author hal.hildebrand
 */
public record Parameters(String endpoint, boolean legacy, boolean plaintext, int maxInboundMessageSize,
                         NetworkClientMetrics metrics, Signer signer) {

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * @return a new backend for the configured endpoint and protocol. No connection is made until first use.
     */
    public NetworkClient newNetworkClient() {
        if (legacy) {
            return new LegacyGrpcNetworkClient(endpoint, plaintext, maxInboundMessageSize, metrics);
        }
        return new GrpcNetworkClient(endpoint, plaintext, maxInboundMessageSize, metrics);
    }

    public static class Builder implements Cloneable {
        private String               endpoint              = GrpcNetworkClient.DEFAULT_ENDPOINT;
        private boolean              legacy                = false;
        private int                  maxInboundMessageSize = GrpcNetworkClient.DEFAULT_MAX_INBOUND_MESSAGE_SIZE;
        private NetworkClientMetrics metrics;
        private boolean              plaintext             = true;
        private Signer               signer                = new DefaultSigner();

        public Parameters build() {
            if (endpoint == null || endpoint.isBlank()) {
                throw new IllegalArgumentException("Endpoint is required");
            }
            if (maxInboundMessageSize <= 0) {
                throw new IllegalArgumentException("Max inbound message size must be positive: " + maxInboundMessageSize);
            }
            if (signer == null) {
                throw new IllegalArgumentException("Signer is required");
            }
            return new Parameters(endpoint, legacy, plaintext, maxInboundMessageSize, metrics, signer);
        }

        @Override
        public Builder clone() {
            try {
                return (Builder) super.clone();
            } catch (CloneNotSupportedException e) {
                throw new IllegalStateException(e);
            }
        }

        public String getEndpoint() {
            return endpoint;
        }

        public Builder setEndpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public int getMaxInboundMessageSize() {
            return maxInboundMessageSize;
        }

        public Builder setMaxInboundMessageSize(int maxInboundMessageSize) {
            this.maxInboundMessageSize = maxInboundMessageSize;
            return this;
        }

        public NetworkClientMetrics getMetrics() {
            return metrics;
        }

        public Builder setMetrics(NetworkClientMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Signer getSigner() {
            return signer;
        }

        public Builder setSigner(Signer signer) {
            this.signer = signer;
            return this;
        }

        public boolean isLegacy() {
            return legacy;
        }

        public Builder setLegacy(boolean legacy) {
            this.legacy = legacy;
            return this;
        }

        public boolean isPlaintext() {
            return plaintext;
        }

        public Builder setPlaintext(boolean plaintext) {
            this.plaintext = plaintext;
            return this;
        }
    }
}
