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

import java.net.HttpCookie;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.jetty.util.QuotedStringTokenizer;
import org.eclipse.jetty.util.StringUtil;
import org.eclipse.jetty.util.log.Log;
import org.eclipse.jetty.util.log.Logger;

/**
 * <p>Parser of the <code>Cookie</code> request header.</p>
 * <p>Cookies are scoped to the host the request was sent to. Pairs without a name
 * or with a name that is not a valid cookie name are skipped.</p>
 */
public class CookieParser
{
    private static final Logger LOG = Log.getLogger(CookieParser.class);

    public List<HttpCookie> parse(String header, String host)
    {
        List<HttpCookie> cookies = new ArrayList<>();
        if (StringUtil.isBlank(header))
            return cookies;

        String domain = domainOf(host);
        for (String pair : header.split(";"))
        {
            int equals = pair.indexOf('=');
            String name = (equals < 0 ? pair : pair.substring(0, equals)).trim();
            String value = equals < 0 ? "" : pair.substring(equals + 1).trim();
            if (name.isEmpty() || name.startsWith("$"))
                continue;

            HttpCookie cookie = newCookie(name, QuotedStringTokenizer.unquote(value));
            if (cookie == null)
                continue;
            if (domain != null)
                cookie.setDomain(domain);
            cookie.setPath("/");
            cookie.setVersion(0);
            cookies.add(cookie);
        }
        return cookies;
    }

    private HttpCookie newCookie(String name, String value)
    {
        try
        {
            return new HttpCookie(name, value);
        }
        catch (IllegalArgumentException e)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("skipping cookie {}: {}", name, e.getMessage());
            return null;
        }
    }

    /**
     * @param host the value of a Host header, with an optional port
     * @return the host without its port, or null
     */
    static String domainOf(String host)
    {
        if (StringUtil.isBlank(host))
            return null;
        host = host.trim();
        if (host.startsWith("["))
        {
            int close = host.indexOf(']');
            return close < 0 ? host : host.substring(0, close + 1);
        }
        int colon = host.indexOf(':');
        return colon < 0 ? host : host.substring(0, colon);
    }
}
