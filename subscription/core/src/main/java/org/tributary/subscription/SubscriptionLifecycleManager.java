/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tributary.subscription;

import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tributary.subscription.api.CancellationSignal;
import org.tributary.subscription.api.LiveConnection;
import org.tributary.subscription.api.PersistentSubscriptionListener;
import org.tributary.subscription.api.PersistentSubscriptionTransport;
import org.tributary.subscription.api.StreamSelector;
import org.tributary.subscription.api.SubscriptionHandle;
import org.tributary.subscription.api.exception.AttachException;
import org.tributary.subscription.api.exception.SubscriptionAlreadyExistsException;
import org.tributary.subscription.api.exception.SubscriptionNotFoundException;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Attaches to the server side cursor of a persistent subscription, creating the cursor when it doesn't exist.
 */
@NullMarked
public class SubscriptionLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionLifecycleManager.class);

    private final String subscriptionId;
    private final StreamSelector selector;
    private final PersistentSubscriptionTransport transport;
    private final SubscriptionOptions options;

    public SubscriptionLifecycleManager(String subscriptionId, StreamSelector selector, PersistentSubscriptionTransport transport, SubscriptionOptions options) {
        this.subscriptionId = requireNonNull(subscriptionId, "subscriptionId cannot be null");
        this.selector = requireNonNull(selector, StreamSelector.class.getSimpleName() + " cannot be null");
        this.transport = requireNonNull(transport, PersistentSubscriptionTransport.class.getSimpleName() + " cannot be null");
        this.options = requireNonNull(options, SubscriptionOptions.class.getSimpleName() + " cannot be null");
    }

    /**
     * Attach to the subscription. If it doesn't exist it's created with the configured settings and attached once more.
     *
     * @param listenerFactory Creates the listener of the new attachment, given the signal that is cancelled when the returned handle is stopped
     * @return A handle to the live attachment
     * @throws AttachException If attaching fails for any other reason than the subscription not being found, or if it's still not found after creating it
     */
    public SubscriptionHandle attach(Function<CancellationSignal, PersistentSubscriptionListener> listenerFactory) {
        requireNonNull(listenerFactory, "listenerFactory cannot be null");
        try {
            return attachToExisting(listenerFactory);
        } catch (SubscriptionNotFoundException e) {
            log.info("Persistent subscription {} on {} doesn't exist, creating it", subscriptionId, selector.name());
        } catch (RuntimeException e) {
            throw attachFailed(e);
        }
        return createAndAttach(listenerFactory);
    }

    /**
     * Create the subscription, ignoring that it may already exist, and attach to it. Used after the subscription was deleted.
     */
    public SubscriptionHandle recreate(Function<CancellationSignal, PersistentSubscriptionListener> listenerFactory) {
        requireNonNull(listenerFactory, "listenerFactory cannot be null");
        log.info("Recreating persistent subscription {} on {}", subscriptionId, selector.name());
        return createAndAttach(listenerFactory);
    }

    private SubscriptionHandle createAndAttach(Function<CancellationSignal, PersistentSubscriptionListener> listenerFactory) {
        try {
            transport.create(selector, subscriptionId, options.settings(), options.credentials());
            log.info("Created persistent subscription {} on {} with {}", subscriptionId, selector.name(), options.settings());
        } catch (SubscriptionAlreadyExistsException e) {
            log.debug("Persistent subscription {} on {} was created by someone else", subscriptionId, selector.name());
        } catch (RuntimeException e) {
            throw attachFailed(e);
        }

        try {
            return attachToExisting(listenerFactory);
        } catch (RuntimeException e) {
            throw attachFailed(e);
        }
    }

    private SubscriptionHandle attachToExisting(Function<CancellationSignal, PersistentSubscriptionListener> listenerFactory) {
        SubscriptionLifetime lifetime = new SubscriptionLifetime();
        PersistentSubscriptionListener listener = listenerFactory.apply(lifetime);
        LiveConnection connection = transport.attach(selector, subscriptionId, listener, options.credentials(), options.bufferSize(), options.autoAck());
        log.info("Attached to persistent subscription {} on {}", subscriptionId, selector.name());
        return new LiveSubscriptionHandle(subscriptionId, connection, lifetime);
    }

    private AttachException attachFailed(RuntimeException e) {
        if (e instanceof AttachException attachException) {
            return attachException;
        }
        return new AttachException(subscriptionId, "Failed to attach to persistent subscription " + subscriptionId + " on " + selector.name(), e);
    }
}
