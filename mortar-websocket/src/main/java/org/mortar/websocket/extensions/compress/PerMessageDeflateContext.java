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

package org.mortar.websocket.extensions.compress;

import java.util.zip.Deflater;
import java.util.zip.Inflater;

import org.mortar.websocket.api.WebSocketEncodingExtensionContext;

/**
 * Parameters agreed for <code>permessage-deflate</code> on one connection.
 */
public class PerMessageDeflateContext implements WebSocketEncodingExtensionContext
{
    public static final int DEFAULT_WINDOW_BITS = 15;

    private final int _compressionLevel;
    private boolean _serverNoContextTakeover;
    private boolean _clientNoContextTakeover;
    private int _serverMaxWindowBits = DEFAULT_WINDOW_BITS;
    private int _clientMaxWindowBits = DEFAULT_WINDOW_BITS;

    public PerMessageDeflateContext(int compressionLevel)
    {
        _compressionLevel = compressionLevel;
    }

    public int getCompressionLevel()
    {
        return _compressionLevel;
    }

    /**
     * @return true if the server resets its compression context after each message
     */
    public boolean isServerNoContextTakeover()
    {
        return _serverNoContextTakeover;
    }

    void setServerNoContextTakeover(boolean serverNoContextTakeover)
    {
        _serverNoContextTakeover = serverNoContextTakeover;
    }

    /**
     * @return true if the client resets its compression context after each message
     */
    public boolean isClientNoContextTakeover()
    {
        return _clientNoContextTakeover;
    }

    void setClientNoContextTakeover(boolean clientNoContextTakeover)
    {
        _clientNoContextTakeover = clientNoContextTakeover;
    }

    public int getServerMaxWindowBits()
    {
        return _serverMaxWindowBits;
    }

    void setServerMaxWindowBits(int serverMaxWindowBits)
    {
        _serverMaxWindowBits = serverMaxWindowBits;
    }

    public int getClientMaxWindowBits()
    {
        return _clientMaxWindowBits;
    }

    void setClientMaxWindowBits(int clientMaxWindowBits)
    {
        _clientMaxWindowBits = clientMaxWindowBits;
    }

    /**
     * @return a raw (no zlib wrapper) deflater for outgoing messages
     */
    public Deflater newDeflater()
    {
        return new Deflater(_compressionLevel, true);
    }

    /**
     * @return a raw (no zlib wrapper) inflater for incoming messages
     */
    public Inflater newInflater()
    {
        return new Inflater(true);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{level=%d,serverNoContextTakeover=%b,clientNoContextTakeover=%b,serverMaxWindowBits=%d,clientMaxWindowBits=%d}",
            getClass().getSimpleName(), hashCode(), _compressionLevel, _serverNoContextTakeover, _clientNoContextTakeover,
            _serverMaxWindowBits, _clientMaxWindowBits);
    }
}
