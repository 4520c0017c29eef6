package com.questrail.hostlink.protocol.codec;

import com.questrail.hostlink.api.ConnectionClosedException;
import com.questrail.hostlink.api.IncompleteMessageException;
import com.questrail.hostlink.transport.HostChannel;

import java.io.IOException;
import java.time.Duration;

/**
 * FrameReader
 * -----------------------------------------------------------------------------
 * Inbound boundary between a raw byte stream and one complete document.
 *
 * <p>The reader is responsible only for:</p>
 * <ul>
 *   <li>Accumulating bytes across any number of partial reads</li>
 *   <li>Deciding when one complete document has arrived</li>
 *   <li>Bounding the whole receive by a single timeout</li>
 * </ul>
 *
 * <p>The reader is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Validating the response structure (see {@link ResponseDecoder})</li>
 *   <li>Closing or invalidating the channel on failure</li>
 *   <li>Retrying</li>
 * </ul>
 */
public interface FrameReader
{
    /**
     * Read exactly one complete document from {@code channel}.
     *
     * @param channel an open channel with no unread bytes from an earlier response
     * @param timeout bound on the whole receive
     * @return the decoded document
     * @throws ConnectionClosedException  if the peer closed before sending any byte
     * @throws IncompleteMessageException if no complete document arrived in time,
     *                                    or the peer closed mid-document
     * @throws IOException                if the channel failed
     */
    Frame readFrame(HostChannel channel, Duration timeout) throws IOException;
}
