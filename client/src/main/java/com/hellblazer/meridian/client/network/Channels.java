/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network;

import com.google.common.net.HostAndPort;
import io.grpc.ManagedChannel;
import io.grpc.netty.NettyChannelBuilder;

import java.net.URI;

/**
 * Channel construction from the endpoint strings the backends accept: either {@code host[:port]} or a URL such as
 * {@code https://host[:port]}. Building a channel performs no I/O; the connection is established on first use.
 *
 * @author hal.hildebrand
 */
public final class Channels {
    public static final int DEFAULT_PORT       = 3001;
    public static final int DEFAULT_HTTP_PORT  = 80;
    public static final int DEFAULT_HTTPS_PORT = 443;

    private Channels() {
    }

    public static boolean isUrl(String endpoint) {
        return endpoint.contains("://");
    }

    /**
     * @param plaintext whether a {@code host[:port]} endpoint is reached without TLS. URLs decide for themselves:
     *                  {@code https} is always TLS, {@code http} never.
     */
    public static ManagedChannel forEndpoint(String endpoint, boolean plaintext, int maxInboundMessageSize) {
        NettyChannelBuilder builder;
        boolean secure;
        if (isUrl(endpoint)) {
            var uri = URI.create(endpoint);
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("No host in endpoint: " + endpoint);
            }
            secure = "https".equalsIgnoreCase(uri.getScheme());
            var port = uri.getPort() == -1 ? (secure ? DEFAULT_HTTPS_PORT : DEFAULT_HTTP_PORT) : uri.getPort();
            builder = NettyChannelBuilder.forAddress(uri.getHost(), port);
        } else {
            var hnp = HostAndPort.fromString(endpoint).withDefaultPort(DEFAULT_PORT);
            builder = NettyChannelBuilder.forAddress(hnp.getHost(), hnp.getPort());
            secure = !plaintext;
        }
        if (secure) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        return builder.maxInboundMessageSize(maxInboundMessageSize).build();
    }
}
