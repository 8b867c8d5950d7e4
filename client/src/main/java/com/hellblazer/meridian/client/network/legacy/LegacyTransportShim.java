/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.network.legacy;

import com.google.common.net.HostAndPort;
import io.grpc.NameResolver;
import io.grpc.NameResolverProvider;
import io.grpc.NameResolverRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Legacy deployments publish their API as web URLs ({@code https://host[:port]}), for which gRPC has no name
 * resolver. The shim registers, once per process, resolvers for the {@code http} and {@code https} schemes that
 * resolve the URL's host and port through DNS. Endpoints handed to the backends are resolved by {@code Channels}
 * without it; the shim serves channels built directly from URL targets.
 *
 * @author hal.hildebrand
 */
public final class LegacyTransportShim {
    private static final Logger        log       = LoggerFactory.getLogger(LegacyTransportShim.class);
    private static final AtomicBoolean installed = new AtomicBoolean();

    private LegacyTransportShim() {
    }

    /**
     * Install the URL resolvers into the default registry.
     *
     * @return true if this call installed them, false if they were already installed
     */
    public static boolean install() {
        if (!installed.compareAndSet(false, true)) {
            return false;
        }
        var registry = NameResolverRegistry.getDefaultRegistry();
        registry.register(new UrlNameResolverProvider("http", 80));
        registry.register(new UrlNameResolverProvider("https", 443));
        log.info("Installed legacy URL name resolvers for http and https");
        return true;
    }

    public static boolean isInstalled() {
        return installed.get();
    }

    /**
     * @return the DNS target equivalent to the URL, or null if the URL has no host
     */
    static URI dnsTarget(URI url, int defaultPort) {
        if (url.getHost() == null) {
            return null;
        }
        var port = url.getPort() == -1 ? defaultPort : url.getPort();
        return URI.create("dns:///" + HostAndPort.fromParts(url.getHost(), port));
    }

    static final class UrlNameResolverProvider extends NameResolverProvider {
        private final int    defaultPort;
        private final String scheme;

        UrlNameResolverProvider(String scheme, int defaultPort) {
            this.scheme = scheme;
            this.defaultPort = defaultPort;
        }

        @Override
        public String getDefaultScheme() {
            return scheme;
        }

        @Override
        public NameResolver newNameResolver(URI targetUri, NameResolver.Args args) {
            if (!scheme.equalsIgnoreCase(targetUri.getScheme())) {
                return null;
            }
            var target = dnsTarget(targetUri, defaultPort);
            if (target == null) {
                return null;
            }
            log.trace("Resolving: {} as: {}", targetUri, target);
            return NameResolverRegistry.getDefaultRegistry().asFactory().newNameResolver(target, args);
        }

        @Override
        protected boolean isAvailable() {
            return true;
        }

        @Override
        protected int priority() {
            return 5;
        }
    }
}
