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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.util.StringUtil;
import org.eclipse.jetty.util.log.Log;
import org.eclipse.jetty.util.log.Logger;
import org.mortar.websocket.api.ExtensionNegotiation;
import org.mortar.websocket.api.WebSocketEncodingExtension;
import org.mortar.websocket.api.WebSocketEncodingExtensionContext;
import org.mortar.websocket.api.WebSocketExtension;
import org.mortar.websocket.api.WebSocketHandshakeException;
import org.mortar.websocket.api.WebSocketHttpRequest;

/**
 * <p>Negotiates the RFC 6455 upgrade of one connection.</p>
 * <p>A handshaker reads the request, decides whether it is a WebSocket upgrade,
 * negotiates the requested extensions and always writes a response: either
 * <code>101 Switching Protocols</code>, leaving the connection open for the framing layer,
 * or a rejection after which the connection is closed.</p>
 * <p>Instances are single use and not thread safe; create one per accepted connection,
 * usually with {@link WebSocketHandshakerFactory#newHandshaker()}. There is no timeout
 * here, callers bound the read with the socket timeout.</p>
 */
public class WebSocketHandshaker
{
    private static final Logger LOG = Log.getLogger(WebSocketHandshaker.class);

    public static final String VERSION = "13";

    public enum State
    {
        IDLE,
        REQUEST_READ,
        VALIDATED,
        EXTENSIONS_NEGOTIATED,
        RESPONSE_SENT,
        ACCEPTED,
        REJECTED,
        FAILED
    }

    private final WebSocketExtensionRegistry _registry;
    private final HandshakeConfiguration _configuration;
    private final WebSocketHttpRequest _request = new WebSocketHttpRequest();
    private final List<WebSocketEncodingExtensionContext> _negotiatedExtensions = new ArrayList<>();
    private final List<WebSocketExtension> _responseExtensions = new ArrayList<>();
    private State _state = State.IDLE;

    public WebSocketHandshaker(WebSocketExtensionRegistry registry)
    {
        this(registry, new HandshakeConfiguration());
    }

    public WebSocketHandshaker(WebSocketExtensionRegistry registry, HandshakeConfiguration configuration)
    {
        _registry = registry;
        _configuration = configuration;
    }

    public State getState()
    {
        return _state;
    }

    public WebSocketHttpRequest getRequest()
    {
        return _request;
    }

    /**
     * Negotiates over an accepted socket. The local and remote addresses are recorded on
     * the request and the socket is closed if the handshake is rejected.
     *
     * @param socket the accepted connection
     * @return the outcome of the handshake
     * @throws WebSocketHandshakeException if the request cannot be parsed, nothing is written
     * @throws IOException if the connection fails
     */
    public HandshakeOutcome negotiate(Socket socket) throws IOException
    {
        _request.setLocalAddress(toInetSocketAddress(socket.getLocalSocketAddress()));
        _request.setRemoteAddress(toInetSocketAddress(socket.getRemoteSocketAddress()));
        return negotiate(socket.getInputStream(), socket.getOutputStream(), socket);
    }

    /**
     * Negotiates over a stream pair. On rejection the output stream is closed.
     *
     * @param in the connection input, positioned at the request line
     * @param out the connection output
     * @return the outcome of the handshake
     * @throws WebSocketHandshakeException if the request cannot be parsed, nothing is written
     * @throws IOException if the connection fails
     */
    public HandshakeOutcome negotiate(InputStream in, OutputStream out) throws IOException
    {
        return negotiate(in, out, out);
    }

    private HandshakeOutcome negotiate(InputStream in, OutputStream out, Closeable connection) throws IOException
    {
        if (_state != State.IDLE)
            throw new IllegalStateException("Handshake already " + _state);

        boolean websocket;
        try
        {
            readHttpRequest(in);
            websocket = isWebSocketRequest(_request.getHeaders());
            if (websocket)
            {
                _state = State.VALIDATED;
                selectExtensions();
                _state = State.EXTENSIONS_NEGOTIATED;
            }
            writeHttpResponse(out, connection, websocket);
        }
        catch (IOException | RuntimeException e)
        {
            _state = State.FAILED;
            throw e;
        }

        if (!websocket)
        {
            _state = State.REJECTED;
            if (LOG.isDebugEnabled())
                LOG.debug("rejected {}", _request);
            return HandshakeOutcome.rejected();
        }

        _state = State.ACCEPTED;
        if (LOG.isDebugEnabled())
            LOG.debug("upgraded {} extensions={}", _request.getRequestUri(), _responseExtensions);
        return HandshakeOutcome.accepted(_request, _negotiatedExtensions, _responseExtensions);
    }

    /**
     * @param headers the request headers
     * @return true if the headers carry everything an RFC 6455 upgrade requires
     */
    public static boolean isWebSocketRequest(HttpFields headers)
    {
        return headers.containsKey(HttpHeader.HOST.asString()) &&
            "websocket".equalsIgnoreCase(headers.get(HttpHeader.UPGRADE.asString())) &&
            headers.containsKey(HttpHeader.CONNECTION.asString()) &&
            !StringUtil.isBlank(headers.get(HttpHeader.SEC_WEBSOCKET_KEY.asString())) &&
            VERSION.equals(headers.get(HttpHeader.SEC_WEBSOCKET_VERSION.asString()));
    }

    private void readHttpRequest(InputStream in) throws IOException
    {
        HttpLineReader reader = new HttpLineReader(in, _configuration.getMaxLineLength());
        new HttpRequestParser(_configuration).parse(reader, _request);

        HttpFields headers = _request.getHeaders();
        String cookie = headers.get(HttpHeader.COOKIE.asString());
        if (cookie != null)
            _request.setCookies(new CookieParser().parse(cookie, headers.get(HttpHeader.HOST.asString())));
        // a malformed extension header fails the handshake even when the request is not an upgrade
        String extensions = headers.get(HttpHeader.SEC_WEBSOCKET_EXTENSIONS.asString());
        if (extensions != null)
            _request.setWebSocketExtensions(new ExtensionHeaderParser().parse(extensions));
        _state = State.REQUEST_READ;
    }

    private void selectExtensions()
    {
        // later offers of a name are fallbacks, tried only while earlier ones are declined
        Set<String> negotiated = new HashSet<>();
        for (WebSocketExtension requested : _request.getWebSocketExtensions())
        {
            String name = StringUtil.asciiToLowerCase(requested.getName());
            if (negotiated.contains(name))
                continue;

            WebSocketEncodingExtension extension = _registry.find(requested.getName());
            if (extension == null)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("unknown extension {}", requested.getName());
                continue;
            }

            ExtensionNegotiation negotiation = tryNegotiate(extension, requested);
            if (negotiation == null)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("extension {} declined {}", extension.getName(), requested);
                continue;
            }

            negotiated.add(name);
            _negotiatedExtensions.add(negotiation.getContext());
            _responseExtensions.add(negotiation.getResponse());
        }
    }

    private ExtensionNegotiation tryNegotiate(WebSocketEncodingExtension extension, WebSocketExtension offer)
    {
        try
        {
            return extension.negotiate(_request, offer);
        }
        catch (RuntimeException e)
        {
            LOG.warn("Extension " + extension.getName() + " failed to negotiate", e);
            return null;
        }
    }

    private void writeHttpResponse(OutputStream out, Closeable connection, boolean websocket) throws IOException
    {
        HandshakeResponseWriter writer = new HandshakeResponseWriter();
        if (websocket)
        {
            String accept = AcceptHash.hashKey(_request.getHeader(HttpHeader.SEC_WEBSOCKET_KEY.asString()));
            writer.writeAcceptance(out, accept, _request.getHeader(HttpHeader.SEC_WEBSOCKET_SUBPROTOCOL.asString()), _responseExtensions);
            _state = State.RESPONSE_SENT;
        }
        else
        {
            writer.writeRejection(out);
            _state = State.RESPONSE_SENT;
            connection.close();
        }
    }

    private static InetSocketAddress toInetSocketAddress(SocketAddress address)
    {
        return address instanceof InetSocketAddress ? (InetSocketAddress)address : null;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,%s}", getClass().getSimpleName(), hashCode(), _state, _registry);
    }
}
