/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.hivemind.workflow;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared by every step of one execution.
 * The scheduler raises it on the first step failure or on an explicit cancel;
 * handlers are expected to poll it and stop early. Nothing is interrupted.
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * Requests cancellation. Only the first reason is kept.
     *
     * @return true if this call raised the signal
     */
    public boolean cancel(String cancellationReason) {
        return reason.compareAndSet(null, cancellationReason != null ? cancellationReason : "cancelled");
    }

    public boolean isCancellationRequested() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * @throws CancellationException if cancellation has been requested
     */
    public void throwIfCancellationRequested() {
        String current = reason.get();
        if (current != null) {
            throw new CancellationException(current);
        }
    }
}
