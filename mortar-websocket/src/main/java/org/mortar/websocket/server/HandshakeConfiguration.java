//
//  ========================================================================
//  Copyright (c) 1995-2020 Mort Bay Consulting Pty Ltd and others.
//  ------------------------------------------------------------------------
//  All rights reserved. This program and the accompanying materials
//  are made available under the terms of the Eclipse Public License v1.0
//  and Apache License v2.0 which accompanies this distribution.
//
//      The Eclipse Public License is available at
//      http://www.eclipse.org/legal/epl-v10.html
//
//      The Apache License v2.0 is available at
//      http://www.opensource.org/licenses/apache2.0.php
//
//  You may elect to redistribute this code under either of these licenses.
//  ========================================================================
//

package org.mortar.websocket.server;

import java.util.Objects;

/**
 * Settings applied by every handshake created from a {@link WebSocketHandshakerFactory}.
 */
public class HandshakeConfiguration
{
    public static final int DEFAULT_MAX_LINE_LENGTH = 8192;
    public static final int DEFAULT_MAX_HEADER_COUNT = 100;

    private int _maxLineLength = DEFAULT_MAX_LINE_LENGTH;
    private int _maxHeaderCount = DEFAULT_MAX_HEADER_COUNT;
    private DuplicateHeaderPolicy _duplicateHeaderPolicy = DuplicateHeaderPolicy.REJECT;

    public HandshakeConfiguration()
    {
    }

    public HandshakeConfiguration(HandshakeConfiguration configuration)
    {
        _maxLineLength = configuration._maxLineLength;
        _maxHeaderCount = configuration._maxHeaderCount;
        _duplicateHeaderPolicy = configuration._duplicateHeaderPolicy;
    }

    /**
     * @return the maximum length in bytes of the request line and of each header line
     */
    public int getMaxLineLength()
    {
        return _maxLineLength;
    }

    public void setMaxLineLength(int maxLineLength)
    {
        if (maxLineLength <= 0)
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        _maxLineLength = maxLineLength;
    }

    /**
     * @return the maximum number of header lines accepted in a request
     */
    public int getMaxHeaderCount()
    {
        return _maxHeaderCount;
    }

    public void setMaxHeaderCount(int maxHeaderCount)
    {
        if (maxHeaderCount < 0)
            throw new IllegalArgumentException("maxHeaderCount must not be negative: " + maxHeaderCount);
        _maxHeaderCount = maxHeaderCount;
    }

    public DuplicateHeaderPolicy getDuplicateHeaderPolicy()
    {
        return _duplicateHeaderPolicy;
    }

    public void setDuplicateHeaderPolicy(DuplicateHeaderPolicy duplicateHeaderPolicy)
    {
        _duplicateHeaderPolicy = Objects.requireNonNull(duplicateHeaderPolicy, "duplicateHeaderPolicy");
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{maxLineLength=%d,maxHeaderCount=%d,duplicates=%s}",
            getClass().getSimpleName(), hashCode(), _maxLineLength, _maxHeaderCount, _duplicateHeaderPolicy);
    }
}
