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

import java.net.HttpCookie;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpVersion;

/**
 * <p>The HTTP request of a WebSocket upgrade, as read from the connection.</p>
 * <p>A request belongs to a single handshake and is handed, once accepted, to
 * the layer that takes over the connection.</p>
 */
public class WebSocketHttpRequest
{
    private final Map<String, Object> _items = new HashMap<>();
    private URI _requestUri;
    private HttpVersion _httpVersion = HttpVersion.HTTP_1_0;
    private HttpFields _headers = new HttpFields();
    private List<HttpCookie> _cookies = Collections.emptyList();
    private List<WebSocketExtension> _extensions = Collections.emptyList();
    private InetSocketAddress _localAddress;
    private InetSocketAddress _remoteAddress;

    public URI getRequestUri()
    {
        return _requestUri;
    }

    public void setRequestUri(URI requestUri)
    {
        _requestUri = requestUri;
    }

    public HttpVersion getHttpVersion()
    {
        return _httpVersion;
    }

    public void setHttpVersion(HttpVersion httpVersion)
    {
        _httpVersion = httpVersion;
    }

    public HttpFields getHeaders()
    {
        return _headers;
    }

    public void setHeaders(HttpFields headers)
    {
        _headers = headers;
    }

    public String getHeader(String name)
    {
        return _headers.get(name);
    }

    public List<HttpCookie> getCookies()
    {
        return _cookies;
    }

    public void setCookies(List<HttpCookie> cookies)
    {
        _cookies = Collections.unmodifiableList(new ArrayList<>(cookies));
    }

    /**
     * @param name the cookie name
     * @return the first cookie with that name, or null
     */
    public HttpCookie getCookie(String name)
    {
        for (HttpCookie cookie : _cookies)
        {
            if (cookie.getName().equals(name))
                return cookie;
        }
        return null;
    }

    /**
     * @return the extensions requested by the client, in the order it listed them
     */
    public List<WebSocketExtension> getWebSocketExtensions()
    {
        return _extensions;
    }

    public void setWebSocketExtensions(List<WebSocketExtension> extensions)
    {
        _extensions = Collections.unmodifiableList(new ArrayList<>(extensions));
    }

    /**
     * @param name the extension name, matched ignoring case
     * @return the first requested extension with that name, or null
     */
    public WebSocketExtension getWebSocketExtension(String name)
    {
        for (WebSocketExtension extension : _extensions)
        {
            if (extension.getName().equalsIgnoreCase(name))
                return extension;
        }
        return null;
    }

    public InetSocketAddress getLocalAddress()
    {
        return _localAddress;
    }

    public void setLocalAddress(InetSocketAddress localAddress)
    {
        _localAddress = localAddress;
    }

    public InetSocketAddress getRemoteAddress()
    {
        return _remoteAddress;
    }

    public void setRemoteAddress(InetSocketAddress remoteAddress)
    {
        _remoteAddress = remoteAddress;
    }

    /**
     * @return mutable attributes that extensions and applications may attach to the request
     */
    public Map<String, Object> getItems()
    {
        return _items;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{GET %s %s,extensions=%s}", getClass().getSimpleName(), hashCode(), _requestUri, _httpVersion, _extensions);
    }
}
