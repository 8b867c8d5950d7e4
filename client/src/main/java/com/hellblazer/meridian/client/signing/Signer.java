/*
 * Copyright (c) 2024, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.hellblazer.meridian.client.signing;

import com.hellblazer.meridian.ledger.proto.SignedTransaction;
import com.hellblazer.meridian.ledger.proto.Transaction;

/**
 * Produces the signed artifact submitted to the ledger. Implementations may throw; the submission pipeline treats any
 * exception, or a null result, as a signing failure.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface Signer {

    SignedTransaction sign(Transaction transaction, Wallet wallet);
}
