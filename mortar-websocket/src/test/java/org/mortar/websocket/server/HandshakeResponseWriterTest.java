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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.mortar.websocket.api.WebSocketExtension;
import org.mortar.websocket.api.WebSocketExtensionOption;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class HandshakeResponseWriterTest
{
    private final HandshakeResponseWriter writer = new HandshakeResponseWriter();

    @Test
    public void testRejection() throws Exception
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.writeRejection(out);

        assertThat(out.toString(StandardCharsets.US_ASCII.name()), is("HTTP/1.1 404 Bad Request\r\n\r\n"));
    }

    @Test
    public void testMinimalAcceptance() throws Exception
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.writeAcceptance(out, "s3pPLMBiTxaQ9kYGzzhZRbK+xOo=", null, Collections.emptyList());

        assertThat(out.toString(StandardCharsets.US_ASCII.name()), is(
            "HTTP/1.1 101 Switching Protocols\r\n" +
                "Upgrade: websocket\r\n" +
                "Connection: Upgrade\r\n" +
                "Sec-WebSocket-Accept: s3pPLMBiTxaQ9kYGzzhZRbK+xOo=\r\n" +
                "\r\n"));
    }

    @Test
    public void testAcceptanceWithProtocolAndExtensions() throws Exception
    {
        WebSocketExtension deflate = new WebSocketExtension("permessage-deflate", Arrays.asList(
            WebSocketExtensionOption.clientAvailable("client_max_window_bits"),
            new WebSocketExtensionOption("server_no_context_takeover"),
            new WebSocketExtensionOption("server_max_window_bits", "10")));
        WebSocketExtension bare = new WebSocketExtension("x-custom", Collections.singletonList(
            WebSocketExtensionOption.clientAvailable("hint")));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writer.writeAcceptance(out, "HSmrc0sMlYUkAGmm5OPpG2HaGWk=", "chat", Arrays.asList(deflate, bare));

        assertThat(out.toString(StandardCharsets.US_ASCII.name()), is(
            "HTTP/1.1 101 Switching Protocols\r\n" +
                "Upgrade: websocket\r\n" +
                "Connection: Upgrade\r\n" +
                "Sec-WebSocket-Accept: HSmrc0sMlYUkAGmm5OPpG2HaGWk=\r\n" +
                "Sec-WebSocket-Protocol: chat\r\n" +
                "Sec-WebSocket-Extensions: permessage-deflate;server_no_context_takeover;server_max_window_bits=10,x-custom\r\n" +
                "\r\n"));
    }
}
