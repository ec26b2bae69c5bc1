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

package org.mortar.websocket.extensions.compress;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.Deflater;

import org.eclipse.jetty.util.StringUtil;
import org.eclipse.jetty.util.log.Log;
import org.eclipse.jetty.util.log.Logger;
import org.mortar.websocket.api.ExtensionNegotiation;
import org.mortar.websocket.api.WebSocketEncodingExtension;
import org.mortar.websocket.api.WebSocketExtension;
import org.mortar.websocket.api.WebSocketExtensionOption;
import org.mortar.websocket.api.WebSocketHttpRequest;

/**
 * <p>Negotiates the <code>permessage-deflate</code> extension.</p>
 * <p>An offer is declined if it carries an unknown parameter, the same parameter twice,
 * a value where none is allowed or a window size outside of 8..15, as required by
 * <a href="https://tools.ietf.org/html/rfc7692#section-7.1">RFC 7692, section 7.1</a>.
 * Accepted parameters are echoed back; a bare <code>client_max_window_bits</code> only
 * advertises what the client supports and is not echoed. When the client offers the
 * extension more than once, each offer is considered on its own.</p>
 */
public class PerMessageDeflateExtension implements WebSocketEncodingExtension
{
    private static final Logger LOG = Log.getLogger(PerMessageDeflateExtension.class);

    public static final String NAME = "permessage-deflate";
    public static final String SERVER_NO_CONTEXT_TAKEOVER = "server_no_context_takeover";
    public static final String CLIENT_NO_CONTEXT_TAKEOVER = "client_no_context_takeover";
    public static final String SERVER_MAX_WINDOW_BITS = "server_max_window_bits";
    public static final String CLIENT_MAX_WINDOW_BITS = "client_max_window_bits";

    private static final int MIN_WINDOW_BITS = 8;
    private static final int MAX_WINDOW_BITS = 15;

    private final int _compressionLevel;

    public PerMessageDeflateExtension()
    {
        this(Deflater.DEFAULT_COMPRESSION);
    }

    public PerMessageDeflateExtension(int compressionLevel)
    {
        if (compressionLevel != Deflater.DEFAULT_COMPRESSION && (compressionLevel < Deflater.NO_COMPRESSION || compressionLevel > Deflater.BEST_COMPRESSION))
            throw new IllegalArgumentException("Invalid compression level " + compressionLevel);
        _compressionLevel = compressionLevel;
    }

    @Override
    public String getName()
    {
        return NAME;
    }

    public int getCompressionLevel()
    {
        return _compressionLevel;
    }

    @Override
    public ExtensionNegotiation negotiate(WebSocketHttpRequest request)
    {
        WebSocketExtension offer = request.getWebSocketExtension(NAME);
        if (offer == null)
            return null;
        return negotiate(request, offer);
    }

    @Override
    public ExtensionNegotiation negotiate(WebSocketHttpRequest request, WebSocketExtension offer)
    {
        PerMessageDeflateContext context = new PerMessageDeflateContext(_compressionLevel);
        List<WebSocketExtensionOption> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (WebSocketExtensionOption option : offer.getOptions())
        {
            String name = StringUtil.asciiToLowerCase(option.getName());
            if (!seen.add(name))
                return decline(offer, "duplicate " + name);

            switch (name)
            {
                case SERVER_NO_CONTEXT_TAKEOVER:
                    if (option.getValue() != null)
                        return decline(offer, name + " takes no value");
                    context.setServerNoContextTakeover(true);
                    accepted.add(new WebSocketExtensionOption(SERVER_NO_CONTEXT_TAKEOVER));
                    break;

                case CLIENT_NO_CONTEXT_TAKEOVER:
                    if (option.getValue() != null)
                        return decline(offer, name + " takes no value");
                    context.setClientNoContextTakeover(true);
                    accepted.add(new WebSocketExtensionOption(CLIENT_NO_CONTEXT_TAKEOVER));
                    break;

                case SERVER_MAX_WINDOW_BITS:
                {
                    int bits = parseWindowBits(option.getValue());
                    if (bits < 0)
                        return decline(offer, name + "=" + option.getValue());
                    context.setServerMaxWindowBits(bits);
                    accepted.add(new WebSocketExtensionOption(SERVER_MAX_WINDOW_BITS, Integer.toString(bits)));
                    break;
                }

                case CLIENT_MAX_WINDOW_BITS:
                {
                    if (option.isClientAvailableOption())
                        break;
                    int bits = parseWindowBits(option.getValue());
                    if (bits < 0)
                        return decline(offer, name + "=" + option.getValue());
                    context.setClientMaxWindowBits(bits);
                    accepted.add(new WebSocketExtensionOption(CLIENT_MAX_WINDOW_BITS, Integer.toString(bits)));
                    break;
                }

                default:
                    return decline(offer, "unknown parameter " + option.getName());
            }
        }

        if (LOG.isDebugEnabled())
            LOG.debug("negotiated {}", context);
        return new ExtensionNegotiation(new WebSocketExtension(NAME, accepted), context);
    }

    private static int parseWindowBits(String value)
    {
        if (value == null)
            return -1;
        try
        {
            int bits = Integer.parseInt(value);
            return bits < MIN_WINDOW_BITS || bits > MAX_WINDOW_BITS ? -1 : bits;
        }
        catch (NumberFormatException e)
        {
            return -1;
        }
    }

    private static ExtensionNegotiation decline(WebSocketExtension offer, String reason)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("declining {}: {}", offer, reason);
        return null;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{level=%d}", getClass().getSimpleName(), hashCode(), _compressionLevel);
    }
}
