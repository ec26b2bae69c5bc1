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
import java.util.List;

import org.eclipse.jetty.util.StringUtil;
import org.mortar.websocket.api.MalformedExtensionHeaderException;
import org.mortar.websocket.api.WebSocketExtension;
import org.mortar.websocket.api.WebSocketExtensionOption;

/**
 * <p>Parser of the <code>Sec-WebSocket-Extensions</code> request header.</p>
 * <pre>
 *   header    = extension *( "," extension )
 *   extension = name *( ";" option )
 *   option    = name [ "=" value ]
 * </pre>
 * <p>An option without a value is a client available option. Quoted values are
 * not supported.</p>
 */
public class ExtensionHeaderParser
{
    public List<WebSocketExtension> parse(String header) throws MalformedExtensionHeaderException
    {
        if (StringUtil.isBlank(header))
            throw new MalformedExtensionHeaderException("Cannot parse extension", header);

        List<WebSocketExtension> extensions = new ArrayList<>();
        for (String entry : header.split(",", -1))
            extensions.add(parseExtension(entry, header));
        return extensions;
    }

    private WebSocketExtension parseExtension(String entry, String header) throws MalformedExtensionHeaderException
    {
        String[] parts = entry.split(";", -1);
        String name = parts[0].trim();
        if (name.isEmpty())
            throw new MalformedExtensionHeaderException("Cannot parse extension", header);

        List<WebSocketExtensionOption> options = new ArrayList<>(parts.length - 1);
        for (int i = 1; i < parts.length; i++)
            options.add(parseOption(parts[i], header));
        return new WebSocketExtension(name, options);
    }

    private WebSocketExtensionOption parseOption(String part, String header) throws MalformedExtensionHeaderException
    {
        String[] nv = part.split("=", -1);
        String name = nv[0].trim();
        if (name.isEmpty() || nv.length > 2)
            throw new MalformedExtensionHeaderException("Cannot parse extension options", header);
        if (nv.length == 1)
            return WebSocketExtensionOption.clientAvailable(name);
        return new WebSocketExtensionOption(name, nv[1].trim(), false);
    }
}
