/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.address;

import java.util.OptionalLong;

/**
 * A classic (r...) address, with the destination tag and network an X-Address carried alongside it
 *
 * @author hal.hildebrand
 */
public record ClassicAddress(String address, OptionalLong tag, LedgerNetwork network) {
}
