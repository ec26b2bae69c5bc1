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

package org.mortar.websocket.api;

/**
 * The <code>Sec-WebSocket-Extensions</code> header does not follow the
 * <code>ext;opt;opt=value,ext</code> grammar.
 */
@SuppressWarnings("serial")
public class MalformedExtensionHeaderException extends WebSocketHandshakeException
{
    private final String _headerValue;

    public MalformedExtensionHeaderException(String message, String headerValue)
    {
        super(message + " [" + headerValue + "]");
        _headerValue = headerValue;
    }

    public String getHeaderValue()
    {
        return _headerValue;
    }
}
