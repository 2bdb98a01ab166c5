package cz.cas.jhinst.qsource3.api;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Lifecycle of the broker session owned by the connection supervisor.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTED → ...
 *                       │
 *                       └──(connect failure)──→ DISCONNECTED
 * </pre>
 *
 * No state is terminal. Publishing is allowed only in {@link #CONNECTED}.
 */
public enum ConnectionState
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
