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
 * Creates a {@link WebSocketHandshaker} per accepted connection, sharing the extension
 * registry and a snapshot of the configuration taken when the factory was built.
 */
public class WebSocketHandshakerFactory
{
    private final WebSocketExtensionRegistry _registry;
    private final HandshakeConfiguration _configuration;

    public WebSocketHandshakerFactory(WebSocketExtensionRegistry registry)
    {
        this(registry, new HandshakeConfiguration());
    }

    public WebSocketHandshakerFactory(WebSocketExtensionRegistry registry, HandshakeConfiguration configuration)
    {
        _registry = Objects.requireNonNull(registry, "registry");
        _configuration = new HandshakeConfiguration(Objects.requireNonNull(configuration, "configuration"));
    }

    public WebSocketExtensionRegistry getRegistry()
    {
        return _registry;
    }

    /**
     * @return a copy of the configuration used by new handshakers
     */
    public HandshakeConfiguration getConfiguration()
    {
        return new HandshakeConfiguration(_configuration);
    }

    public WebSocketHandshaker newHandshaker()
    {
        return new WebSocketHandshaker(_registry, _configuration);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,%s}", getClass().getSimpleName(), hashCode(), _registry, _configuration);
    }
}
