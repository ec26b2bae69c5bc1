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

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;

import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpFields;
import org.eclipse.jetty.http.HttpVersion;
import org.eclipse.jetty.util.StringUtil;
import org.eclipse.jetty.util.log.Log;
import org.eclipse.jetty.util.log.Logger;
import org.mortar.websocket.api.DuplicateHeaderException;
import org.mortar.websocket.api.MalformedRequestException;
import org.mortar.websocket.api.WebSocketHttpRequest;

/**
 * <p>Parser for the request line and header block of an upgrade request.</p>
 * <p>The format accepted is deliberately narrow: a <code>GET</code> request line made
 * of space separated tokens, then <code>Name: value</code> lines with exactly one
 * space after the colon, up to the first blank line or the end of the stream.</p>
 */
public class HttpRequestParser
{
    private static final Logger LOG = Log.getLogger(HttpRequestParser.class);

    private final HandshakeConfiguration _configuration;

    public HttpRequestParser(HandshakeConfiguration configuration)
    {
        _configuration = configuration;
    }

    /**
     * Reads the request line and headers into the given request.
     *
     * @param reader the line reader of the connection
     * @param request the request to populate
     * @throws MalformedRequestException if the request line or headers cannot be parsed
     * @throws IOException if the connection cannot be read
     */
    public void parse(HttpLineReader reader, WebSocketHttpRequest request) throws IOException
    {
        String line = reader.readLine();
        parseRequestLine(line, request);

        HttpFields headers = new HttpFields();
        int count = 0;
        while (true)
        {
            line = reader.readLine();
            if (line == null || StringUtil.isBlank(line))
                break;
            if (++count > _configuration.getMaxHeaderCount())
                throw new MalformedRequestException("Too many headers, limit is " + _configuration.getMaxHeaderCount());
            parseHeader(line, headers);
        }
        request.setHeaders(headers);

        if (LOG.isDebugEnabled())
            LOG.debug("parsed {} {} with {} headers", request.getRequestUri(), request.getHttpVersion(), headers.size());
    }

    public void parseRequestLine(String line, WebSocketHttpRequest request) throws MalformedRequestException
    {
        if (StringUtil.isBlank(line) || !line.startsWith("GET"))
            throw new MalformedRequestException("Not GET request: " + line);

        String[] parts = line.split(" ");
        if (parts.length != 3)
            throw new MalformedRequestException("Bad request line: " + line);

        request.setRequestUri(parseRelativeUri(parts[1]));
        request.setHttpVersion(toHttpVersion(parts[2]));
    }

    /**
     * @param token the version token of the request line
     * @return {@link HttpVersion#HTTP_1_1} if the token ends with <code>1.1</code>, otherwise {@link HttpVersion#HTTP_1_0}
     */
    public static HttpVersion toHttpVersion(String token)
    {
        return token.endsWith("1.1") ? HttpVersion.HTTP_1_1 : HttpVersion.HTTP_1_0;
    }

    private static URI parseRelativeUri(String target) throws MalformedRequestException
    {
        try
        {
            URI uri = new URI(target);
            if (uri.isAbsolute())
                throw new MalformedRequestException("Request target is not relative: " + target);
            return uri;
        }
        catch (URISyntaxException e)
        {
            throw new MalformedRequestException("Bad request target: " + target, e);
        }
    }

    /**
     * Adds a <code>Name: value</code> line to the headers. The value starts two characters
     * after the colon; lines without a colon are ignored.
     *
     * @param line the header line
     * @param headers the headers parsed so far
     * @throws DuplicateHeaderException if the name is already present and duplicates are rejected
     */
    public void parseHeader(String line, HttpFields headers) throws DuplicateHeaderException
    {
        int separator = line.indexOf(':');
        if (separator == -1)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("ignoring header line without separator: {}", line);
            return;
        }

        String name = line.substring(0, separator);
        int start = Math.min(separator + 2, line.length());
        String value = line.substring(start);

        if (!headers.containsKey(name))
        {
            headers.add(name, value);
            return;
        }

        // the first spelling of the name is kept
        HttpField existing = headers.getField(name);
        switch (_configuration.getDuplicateHeaderPolicy())
        {
            case LAST_WINS:
                headers.put(new HttpField(existing.getName(), value));
                break;
            case MERGE:
                headers.put(new HttpField(existing.getName(), existing.getValue() + ", " + value));
                break;
            case REJECT:
            default:
                throw new DuplicateHeaderException(name);
        }
    }
}
