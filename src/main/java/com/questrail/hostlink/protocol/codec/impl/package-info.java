/**
 * Default JSON framing for the host link.
 *
 * <p>{@link com.questrail.hostlink.protocol.codec.impl.JsonDocumentFrameReader}
 * is the only public type; the buffer, probe and decode helpers are
 * implementation details of its boundary detection.</p>
 */
package com.questrail.hostlink.protocol.codec.impl;
