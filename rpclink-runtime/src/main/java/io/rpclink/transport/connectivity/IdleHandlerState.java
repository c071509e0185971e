/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.connectivity;

/**
 * Lifecycle of one physical connection as seen by its {@link ConnectionIdleHandler}.
 *
 * <pre>
 *   NotReady ──► Ready ──► Closing ──► Closed
 *      │           │                     ▲
 *      ├───────────┴─────────────────────┘
 *      └──► Closing
 * </pre>
 */
sealed interface IdleHandlerState permits IdleHandlerState.NotReady, IdleHandlerState.Ready, IdleHandlerState.Closing, IdleHandlerState.Closed {

    /**
     * Waiting for the peer's first SETTINGS frame.
     */
    record NotReady() implements IdleHandlerState {
        static final NotReady INSTANCE = new NotReady();

        Ready toReady() {
            return Ready.INSTANCE;
        }

        Closing toClosing() {
            return Closing.INSTANCE;
        }

        Closed toClosed() {
            return Closed.INSTANCE;
        }
    }

    record Ready() implements IdleHandlerState {
        static final Ready INSTANCE = new Ready();

        Closing toClosing() {
            return Closing.INSTANCE;
        }

        Closed toClosed() {
            return Closed.INSTANCE;
        }
    }

    /**
     * The handler has closed the connection without idling it (the peer stopped answering
     * keepalive pings). The transport going down is still reported.
     */
    record Closing() implements IdleHandlerState {
        static final Closing INSTANCE = new Closing();

        Closed toClosed() {
            return Closed.INSTANCE;
        }
    }

    /**
     * Terminal.
     */
    record Closed() implements IdleHandlerState {
        static final Closed INSTANCE = new Closed();
    }
}
