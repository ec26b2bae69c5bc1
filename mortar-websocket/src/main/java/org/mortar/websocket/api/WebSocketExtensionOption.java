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

import java.util.Objects;

/**
 * <p>A parameter of a WebSocket extension, as in <code>client_max_window_bits=10</code>.</p>
 * <p>An option the client listed bare (<code>client_max_window_bits</code>) is a
 * <em>client available</em> option: it advertises something the client may apply and is
 * never echoed back. Options a server selects are created with
 * {@code clientAvailableOption == false} and are written in the response.</p>
 */
public class WebSocketExtensionOption
{
    private final String _name;
    private final String _value;
    private final boolean _clientAvailableOption;

    /**
     * Server selected option without a value.
     */
    public WebSocketExtensionOption(String name)
    {
        this(name, null, false);
    }

    /**
     * Server selected option with a value.
     */
    public WebSocketExtensionOption(String name, String value)
    {
        this(name, value, false);
    }

    public WebSocketExtensionOption(String name, String value, boolean clientAvailableOption)
    {
        _name = Objects.requireNonNull(name, "name");
        _value = value;
        _clientAvailableOption = clientAvailableOption;
    }

    public static WebSocketExtensionOption clientAvailable(String name)
    {
        return new WebSocketExtensionOption(name, null, true);
    }

    public String getName()
    {
        return _name;
    }

    public String getValue()
    {
        return _value;
    }

    public boolean isClientAvailableOption()
    {
        return _clientAvailableOption;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof WebSocketExtensionOption))
            return false;
        WebSocketExtensionOption that = (WebSocketExtensionOption)o;
        return _clientAvailableOption == that._clientAvailableOption &&
            _name.equals(that._name) &&
            Objects.equals(_value, that._value);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_name, _value, _clientAvailableOption);
    }

    @Override
    public String toString()
    {
        return _value == null ? _name : _name + "=" + _value;
    }
}
