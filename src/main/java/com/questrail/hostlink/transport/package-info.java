/**
 * Host Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP in production, a
 * scripted fake in tests) and the host link's framing and dispatch layers.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>outbound payloads as {@code byte[]}</li>
 *   <li>inbound data as {@link com.questrail.hostlink.transport.ReadResult}
 *       values: a chunk of bytes, an orderly close, or a timed-out read</li>
 *   <li>I/O failures as {@link java.io.IOException}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations perform byte I/O only. They never decode documents, never
 * retry, and never reconnect; those decisions belong to the frame reader and
 * the connection manager.
 *
 * <p>The channel is a byte stream: a single host write may arrive split over
 * many reads, and a single read may carry bytes of several host writes.</p>
 */
package com.questrail.hostlink.transport;
