/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Connection lifecycle for RPC clients.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   transport events ──► ConnectionIdleHandler ──► ConnectionManager ──► ConnectivityStateMonitor
 *                          (one per channel)          │                    │
 *                                                     │                    └──► delegate / one-shot callbacks
 *                                                     └──► ConnectionBackoff (reconnect timing)
 * </pre>
 *
 * <h2>Key Components</h2>
 *
 * <dl>
 *   <dt>{@link io.rpclink.transport.connectivity.ConnectionManagerState}</dt>
 *   <dd>Sealed hierarchy of manager states (Idle → Connecting → Active → Ready, TransientFailure, Shutdown)</dd>
 *
 *   <dt>{@link io.rpclink.transport.connectivity.ConnectionManager}</dt>
 *   <dd>Creates channels on demand and reconnects after failures</dd>
 *
 *   <dt>{@link io.rpclink.transport.connectivity.ConnectionIdleHandler}</dt>
 *   <dd>Pipeline handler counting streams, spotting SETTINGS and GOAWAY, and closing idle connections</dd>
 *
 *   <dt>{@link io.rpclink.transport.connectivity.ConnectivityStateMonitor}</dt>
 *   <dd>Publishes {@link io.rpclink.transport.connectivity.ConnectivityState} changes</dd>
 * </dl>
 *
 * <p>All state in this package is confined to the event loop of the connection it belongs to.</p>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.rpclink.transport.connectivity;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
