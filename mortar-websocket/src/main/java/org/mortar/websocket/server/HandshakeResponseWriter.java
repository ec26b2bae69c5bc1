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
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.eclipse.jetty.http.HttpHeader;
import org.mortar.websocket.api.WebSocketExtension;

/**
 * <p>Writes the handshake responses, ASCII encoded with CRLF line endings.</p>
 * <p>The output stream is flushed but never closed.</p>
 */
public class HandshakeResponseWriter
{
    static final String REJECTION_STATUS = "HTTP/1.1 404 Bad Request";
    static final String SWITCHING_PROTOCOLS_STATUS = "HTTP/1.1 101 Switching Protocols";

    private static final String CRLF = "\r\n";

    public void writeRejection(OutputStream out) throws IOException
    {
        write(out, REJECTION_STATUS + CRLF + CRLF);
    }

    /**
     * @param out the connection output
     * @param accept the <code>Sec-WebSocket-Accept</code> value
     * @param protocol the <code>Sec-WebSocket-Protocol</code> value to echo, or null
     * @param extensions the negotiated extensions, in negotiation order
     * @throws IOException if the response cannot be written
     */
    public void writeAcceptance(OutputStream out, String accept, String protocol, List<WebSocketExtension> extensions) throws IOException
    {
        StringBuilder response = new StringBuilder(256);
        response.append(SWITCHING_PROTOCOLS_STATUS).append(CRLF);
        response.append(HttpHeader.UPGRADE.asString()).append(": websocket").append(CRLF);
        response.append(HttpHeader.CONNECTION.asString()).append(": Upgrade").append(CRLF);
        response.append(HttpHeader.SEC_WEBSOCKET_ACCEPT.asString()).append(": ").append(accept).append(CRLF);
        if (protocol != null)
            response.append(HttpHeader.SEC_WEBSOCKET_SUBPROTOCOL.asString()).append(": ").append(protocol).append(CRLF);
        if (!extensions.isEmpty())
            response.append(HttpHeader.SEC_WEBSOCKET_EXTENSIONS.asString()).append(": ").append(toHeaderValue(extensions)).append(CRLF);
        response.append(CRLF);
        write(out, response.toString());
    }

    static String toHeaderValue(List<WebSocketExtension> extensions)
    {
        StringBuilder value = new StringBuilder();
        for (WebSocketExtension extension : extensions)
        {
            if (value.length() > 0)
                value.append(',');
            value.append(extension.getParameterizedName());
        }
        return value.toString();
    }

    private static void write(OutputStream out, String response) throws IOException
    {
        out.write(response.getBytes(StandardCharsets.US_ASCII));
        out.flush();
    }
}
