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
 * <p>An extension the server is able to negotiate.</p>
 * <p>Implementations are registered once and shared by every handshake, so
 * {@link #negotiate(WebSocketHttpRequest)} must not keep per connection state
 * outside of the context it returns.</p>
 */
public interface WebSocketEncodingExtension
{
    /**
     * @return the extension name, matched against requested extensions ignoring case
     */
    String getName();

    /**
     * Attempts to agree on this extension for a connection.
     *
     * @param request the parsed upgrade request, with its requested extensions
     * @return the response descriptor and negotiated context, or null to decline
     */
    ExtensionNegotiation negotiate(WebSocketHttpRequest request);

    /**
     * <p>Attempts to agree on this extension for one of the offers of the request.</p>
     * <p>A client may offer the same extension several times in order of preference.
     * Offers are tried one after the other until one is accepted, later offers of the
     * same name are then ignored. The default implementation ignores the offer and
     * delegates to {@link #negotiate(WebSocketHttpRequest)}, so an extension that does not
     * override it only ever sees its first offer accepted or all of them declined.</p>
     *
     * @param request the parsed upgrade request
     * @param offer the requested extension being considered
     * @return the response descriptor and negotiated context, or null to decline this offer
     */
    default ExtensionNegotiation negotiate(WebSocketHttpRequest request, WebSocketExtension offer)
    {
        return negotiate(request);
    }
}
