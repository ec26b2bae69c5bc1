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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.mortar.websocket.api.WebSocketEncodingExtensionContext;
import org.mortar.websocket.api.WebSocketExtension;
import org.mortar.websocket.api.WebSocketHttpRequest;

/**
 * Result of a completed handshake: either the connection was upgraded, and the request and
 * negotiated extensions are handed to the framing layer, or it was rejected.
 */
public class HandshakeOutcome
{
    public enum Status
    {
        ACCEPTED,
        REJECTED
    }

    private static final HandshakeOutcome REJECTED = new HandshakeOutcome(Status.REJECTED, null, Collections.emptyList(), Collections.emptyList());

    private final Status _status;
    private final WebSocketHttpRequest _request;
    private final List<WebSocketEncodingExtensionContext> _negotiatedExtensions;
    private final List<WebSocketExtension> _responseExtensions;

    private HandshakeOutcome(Status status, WebSocketHttpRequest request, List<WebSocketEncodingExtensionContext> negotiatedExtensions, List<WebSocketExtension> responseExtensions)
    {
        _status = status;
        _request = request;
        _negotiatedExtensions = negotiatedExtensions;
        _responseExtensions = responseExtensions;
    }

    public static HandshakeOutcome accepted(WebSocketHttpRequest request, List<WebSocketEncodingExtensionContext> negotiatedExtensions, List<WebSocketExtension> responseExtensions)
    {
        return new HandshakeOutcome(Status.ACCEPTED, request,
            Collections.unmodifiableList(new ArrayList<>(negotiatedExtensions)),
            Collections.unmodifiableList(new ArrayList<>(responseExtensions)));
    }

    public static HandshakeOutcome rejected()
    {
        return REJECTED;
    }

    public Status getStatus()
    {
        return _status;
    }

    public boolean isWebSocketRequest()
    {
        return _status == Status.ACCEPTED;
    }

    /**
     * @return the upgrade request, or null when rejected
     */
    public WebSocketHttpRequest getRequest()
    {
        return _request;
    }

    /**
     * @return the contexts of the negotiated extensions, in the order the client requested them
     */
    public List<WebSocketEncodingExtensionContext> getNegotiatedExtensions()
    {
        return _negotiatedExtensions;
    }

    /**
     * @return the extensions written in the <code>Sec-WebSocket-Extensions</code> response header
     */
    public List<WebSocketExtension> getResponseExtensions()
    {
        return _responseExtensions;
    }

    @Override
    public String toString()
    {
        return String.format("%s{%s,extensions=%s}", getClass().getSimpleName(), _status, _responseExtensions);
    }
}
