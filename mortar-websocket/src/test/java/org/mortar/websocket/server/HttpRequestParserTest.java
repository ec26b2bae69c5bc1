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

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpVersion;
import org.mortar.websocket.api.DuplicateHeaderException;
import org.mortar.websocket.api.MalformedRequestException;
import org.mortar.websocket.api.WebSocketHttpRequest;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class HttpRequestParserTest
{
    private WebSocketHttpRequest parse(HandshakeConfiguration configuration, String raw) throws Exception
    {
        WebSocketHttpRequest request = new WebSocketHttpRequest();
        ByteArrayInputStream in = new ByteArrayInputStream(raw.getBytes(StandardCharsets.US_ASCII));
        new HttpRequestParser(configuration).parse(new HttpLineReader(in, configuration.getMaxLineLength()), request);
        return request;
    }

    private WebSocketHttpRequest parse(String raw) throws Exception
    {
        return parse(new HandshakeConfiguration(), raw);
    }

    private static List<String> names(HttpFields headers)
    {
        return headers.stream().map(HttpField::getName).collect(Collectors.toList());
    }

    @Test
    public void testRequestLine() throws Exception
    {
        WebSocketHttpRequest request = parse("GET /chat?room=1 HTTP/1.1\r\nHost: server.example.com\r\n\r\n");

        assertThat(request.getRequestUri().getPath(), is("/chat"));
        assertThat(request.getRequestUri().getQuery(), is("room=1"));
        assertThat(request.getHttpVersion(), is(HttpVersion.HTTP_1_1));
        assertThat(request.getHeader("host"), is("server.example.com"));
    }

    @Test
    public void testVersion() throws Exception
    {
        assertThat(parse("GET / HTTP/1.0\r\n\r\n").getHttpVersion(), is(HttpVersion.HTTP_1_0));
        assertThat(parse("GET / HTTP/2.0\r\n\r\n").getHttpVersion(), is(HttpVersion.HTTP_1_0));
        assertThat(parse("GET / HTTP/1.1\r\n\r\n").getHttpVersion(), is(HttpVersion.HTTP_1_1));
        assertThat(HttpRequestParser.toHttpVersion("XYZ/1.1"), is(HttpVersion.HTTP_1_1));
        assertThat(HttpRequestParser.toHttpVersion("HTTP/1.10"), is(HttpVersion.HTTP_1_0));
    }

    @Test
    public void testBadRequestLine()
    {
        String[] requests = {
            "",
            "\r\n",
            "   \r\n\r\n",
            "POST / HTTP/1.1\r\n\r\n",
            "get / HTTP/1.1\r\n\r\n",
            "GET /\r\n\r\n",
            "GET /a b HTTP/1.1\r\n\r\n",
            "GET / HTTP/1.1 extra\r\n\r\n",
            "GET http://example.com/ HTTP/1.1\r\n\r\n",
            "GET /a|b HTTP/1.1\r\n\r\n",
            "GET /%zz HTTP/1.1\r\n\r\n"
        };

        for (String raw : requests)
        {
            assertThrows(MalformedRequestException.class, () -> parse(raw), raw);
        }
    }

    @Test
    public void testHeaderValueStartsAfterColonSpace() throws Exception
    {
        WebSocketHttpRequest request = parse("GET / HTTP/1.1\r\n" +
            "Upgrade: websocket\r\n" +
            "X-Tight:abc\r\n" +
            "X-Empty:\r\n" +
            "X-Colons: a:b:c\r\n" +
            "no separator here\r\n" +
            "\r\n");

        HttpFields headers = request.getHeaders();
        assertThat(headers.get("UPGRADE"), is("websocket"));
        assertThat(headers.get("x-tight"), is("bc"));
        assertThat(headers.get("x-empty"), is(""));
        assertThat(headers.get("x-colons"), is("a:b:c"));
        assertThat(names(headers), contains("Upgrade", "X-Tight", "X-Empty", "X-Colons"));
    }

    @Test
    public void testHeadersEndAtEndOfStream() throws Exception
    {
        WebSocketHttpRequest request = parse("GET / HTTP/1.1\r\nHost: a\r\nOrigin: b");

        assertThat(request.getHeaders().size(), is(2));
        assertThat(request.getHeader("Origin"), is("b"));
    }

    @Test
    public void testDuplicateHeaderRejected()
    {
        DuplicateHeaderException e = assertThrows(DuplicateHeaderException.class,
            () -> parse("GET / HTTP/1.1\r\nHost: a\r\nhost: b\r\n\r\n"));
        assertThat(e.getHeader(), is("host"));
    }

    @Test
    public void testDuplicateHeaderLastWins() throws Exception
    {
        HandshakeConfiguration configuration = new HandshakeConfiguration();
        configuration.setDuplicateHeaderPolicy(DuplicateHeaderPolicy.LAST_WINS);

        WebSocketHttpRequest request = parse(configuration, "GET / HTTP/1.1\r\nHost: a\r\nhost: b\r\n\r\n");

        assertThat(request.getHeader("Host"), is("b"));
        assertThat(names(request.getHeaders()), contains("Host"));
    }

    @Test
    public void testDuplicateHeaderMerged() throws Exception
    {
        HandshakeConfiguration configuration = new HandshakeConfiguration();
        configuration.setDuplicateHeaderPolicy(DuplicateHeaderPolicy.MERGE);

        WebSocketHttpRequest request = parse(configuration, "GET / HTTP/1.1\r\n" +
            "Sec-WebSocket-Protocol: chat\r\n" +
            "Sec-WebSocket-Protocol: superchat\r\n\r\n");

        assertThat(request.getHeader("sec-websocket-protocol"), is("chat, superchat"));
        assertThat(request.getHeaders().size(), is(1));
    }

    @Test
    public void testMaxHeaderCount() throws Exception
    {
        HandshakeConfiguration configuration = new HandshakeConfiguration();
        configuration.setMaxHeaderCount(2);

        assertThat(parse(configuration, "GET / HTTP/1.1\r\nA: 1\r\nB: 2\r\n\r\n").getHeaders().size(), is(2));
        assertThrows(MalformedRequestException.class, () -> parse(configuration, "GET / HTTP/1.1\r\nA: 1\r\nB: 2\r\nC: 3\r\n\r\n"));
    }

    @Test
    public void testMaxLineLength()
    {
        HandshakeConfiguration configuration = new HandshakeConfiguration();
        configuration.setMaxLineLength(32);

        assertThrows(MalformedRequestException.class,
            () -> parse(configuration, "GET / HTTP/1.1\r\nX-Long: 0123456789012345678901234567890123456789\r\n\r\n"));
    }

    @Test
    public void testNoHeaders() throws Exception
    {
        WebSocketHttpRequest request = parse("GET / HTTP/1.1\r\n\r\n");

        assertThat(request.getHeaders().size(), is(0));
        assertThat(request.getHeader("Host"), nullValue());
    }
}
