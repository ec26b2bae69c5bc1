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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.mortar.websocket.api.WebSocketEncodingExtension;

/**
 * <p>The extensions a server is able to negotiate.</p>
 * <p>The registry is immutable and shared by all handshakes. Names are unique
 * ignoring case.</p>
 */
public class WebSocketExtensionRegistry implements Iterable<WebSocketEncodingExtension>
{
    private static final WebSocketExtensionRegistry EMPTY = new WebSocketExtensionRegistry(Collections.emptyList());

    private final List<WebSocketEncodingExtension> _extensions;

    public WebSocketExtensionRegistry(Collection<? extends WebSocketEncodingExtension> extensions)
    {
        List<WebSocketEncodingExtension> list = new ArrayList<>(extensions.size());
        for (WebSocketEncodingExtension extension : extensions)
        {
            Objects.requireNonNull(extension, "extension");
            String name = Objects.requireNonNull(extension.getName(), "extension name");
            for (WebSocketEncodingExtension registered : list)
            {
                if (registered.getName().equalsIgnoreCase(name))
                    throw new IllegalArgumentException("Extension " + name + " registered twice");
            }
            list.add(extension);
        }
        _extensions = Collections.unmodifiableList(list);
    }

    public static WebSocketExtensionRegistry of(WebSocketEncodingExtension... extensions)
    {
        return new WebSocketExtensionRegistry(Arrays.asList(extensions));
    }

    public static WebSocketExtensionRegistry empty()
    {
        return EMPTY;
    }

    /**
     * @param name the requested extension name
     * @return the single extension whose name equals the given one ignoring case, or null
     * @throws IllegalStateException if more than one extension matches
     */
    public WebSocketEncodingExtension find(String name)
    {
        WebSocketEncodingExtension found = null;
        for (WebSocketEncodingExtension extension : _extensions)
        {
            if (!extension.getName().equalsIgnoreCase(name))
                continue;
            if (found != null)
                throw new IllegalStateException("Ambiguous extension " + name);
            found = extension;
        }
        return found;
    }

    public List<String> getNames()
    {
        List<String> names = new ArrayList<>(_extensions.size());
        for (WebSocketEncodingExtension extension : _extensions)
            names.add(extension.getName());
        return names;
    }

    public int size()
    {
        return _extensions.size();
    }

    public boolean isEmpty()
    {
        return _extensions.isEmpty();
    }

    @Override
    public Iterator<WebSocketEncodingExtension> iterator()
    {
        return _extensions.iterator();
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x%s", getClass().getSimpleName(), hashCode(), getNames());
    }
}
