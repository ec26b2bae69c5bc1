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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named extension with its options, either as requested by a client in
 * <code>Sec-WebSocket-Extensions</code> or as accepted by the server.
 */
public class WebSocketExtension
{
    private final String _name;
    private final List<WebSocketExtensionOption> _options;

    public WebSocketExtension(String name)
    {
        this(name, Collections.emptyList());
    }

    public WebSocketExtension(String name, List<WebSocketExtensionOption> options)
    {
        _name = Objects.requireNonNull(name, "name");
        _options = Collections.unmodifiableList(new ArrayList<>(options));
    }

    public String getName()
    {
        return _name;
    }

    public List<WebSocketExtensionOption> getOptions()
    {
        return _options;
    }

    /**
     * @param name the option name, matched ignoring case
     * @return the first option with that name, or null
     */
    public WebSocketExtensionOption getOption(String name)
    {
        for (WebSocketExtensionOption option : _options)
        {
            if (option.getName().equalsIgnoreCase(name))
                return option;
        }
        return null;
    }

    public boolean hasOption(String name)
    {
        return getOption(name) != null;
    }

    /**
     * @return the response form <code>name[;option[=value]]...</code>,
     * leaving out client available options
     */
    public String getParameterizedName()
    {
        StringBuilder buffer = new StringBuilder(_name);
        for (WebSocketExtensionOption option : _options)
        {
            if (option.isClientAvailableOption())
                continue;
            buffer.append(';').append(option.getName());
            if (option.getValue() != null)
                buffer.append('=').append(option.getValue());
        }
        return buffer.toString();
    }

    @Override
    public String toString()
    {
        StringBuilder buffer = new StringBuilder(_name);
        for (WebSocketExtensionOption option : _options)
            buffer.append(';').append(option);
        return buffer.toString();
    }
}
