/**
 * QSource3 Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete MQTT client (the Netty endpoint, or a test double) and
 * the device-state synchronization engine.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used in production, but no Netty type may leak into the engine.
 * Everything above the endpoint sees only:
 * <ul>
 *   <li>Topic strings</li>
 *   <li>Raw payloads as {@code byte[]}</li>
 *   <li>Session lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no payload interpretation)</li>
 *   <li>Not subscribe or publish on their own initiative</li>
 *   <li>Not schedule retries or reconnects</li>
 * </ul>
 */
package cz.cas.jhinst.qsource3.protocol.mqtt.transport;
