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

import java.util.Objects;

/**
 * Successful result of {@link WebSocketEncodingExtension#negotiate(WebSocketHttpRequest)}.
 */
public class ExtensionNegotiation
{
    private final WebSocketExtension _response;
    private final WebSocketEncodingExtensionContext _context;

    public ExtensionNegotiation(WebSocketExtension response, WebSocketEncodingExtensionContext context)
    {
        _response = Objects.requireNonNull(response, "response");
        _context = Objects.requireNonNull(context, "context");
    }

    /**
     * @return the extension and options to write in the response
     */
    public WebSocketExtension getResponse()
    {
        return _response;
    }

    public WebSocketEncodingExtensionContext getContext()
    {
        return _context;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s}", getClass().getSimpleName(), hashCode(), _response.getParameterizedName());
    }
}
