/**
 * Host Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the host link:
 * the rules that turn a {@link com.questrail.hostlink.api.HostCommand} into
 * bytes and turn the host's byte stream back into a
 * {@link com.questrail.hostlink.api.HostResponse}.</p>
 *
 * <h2>Wire format</h2>
 * <ul>
 *   <li>Every message is one UTF-8 JSON document.</li>
 *   <li>Requests are {@code {"type": <string>, "params": <object>}}.</li>
 *   <li>Responses are {@code {"status": "success", "result": <object>}} or
 *       {@code {"status": "error", "message": <string>}}.</li>
 *   <li>There is <strong>no</strong> length prefix and no delimiter. A
 *       response ends exactly when the bytes received so far decode as one
 *       complete document.</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   HostChannel (byte chunks)
 *        → FrameReader           (boundary detection, timeout, close handling)
 *            → Frame             (one complete JSON document)
 *                → ResponseDecoder
 *                    → HostResponse
 * </pre>
 *
 * <p>The frame reader is an interface so that a host speaking a
 * length-prefixed protocol can be supported by a different implementation
 * without touching the dispatcher.</p>
 */
package com.questrail.hostlink.protocol.codec;
