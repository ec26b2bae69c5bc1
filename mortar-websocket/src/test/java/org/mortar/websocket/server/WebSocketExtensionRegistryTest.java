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

import java.util.Arrays;

import org.mortar.websocket.api.ExtensionNegotiation;
import org.mortar.websocket.api.WebSocketEncodingExtension;
import org.mortar.websocket.api.WebSocketHttpRequest;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class WebSocketExtensionRegistryTest
{
    private static WebSocketEncodingExtension named(String name)
    {
        return new WebSocketEncodingExtension()
        {
            @Override
            public String getName()
            {
                return name;
            }

            @Override
            public ExtensionNegotiation negotiate(WebSocketHttpRequest request)
            {
                return null;
            }
        };
    }

    @Test
    public void testFindIgnoresCase()
    {
        WebSocketEncodingExtension deflate = named("permessage-deflate");
        WebSocketExtensionRegistry registry = WebSocketExtensionRegistry.of(named("identity"), deflate);

        assertThat(registry.find("PerMessage-Deflate"), sameInstance(deflate));
        assertThat(registry.find("x-unknown"), nullValue());
        assertThat(registry.getNames(), contains("identity", "permessage-deflate"));
        assertThat(registry.size(), is(2));
    }

    @Test
    public void testDuplicateNamesRejected()
    {
        assertThrows(IllegalArgumentException.class,
            () -> new WebSocketExtensionRegistry(Arrays.asList(named("a"), named("A"))));
    }

    @Test
    public void testNullNameRejected()
    {
        assertThrows(NullPointerException.class, () -> WebSocketExtensionRegistry.of(named(null)));
    }

    @Test
    public void testEmpty()
    {
        assertThat(WebSocketExtensionRegistry.empty().isEmpty(), is(true));
        assertThat(WebSocketExtensionRegistry.empty().find("a"), nullValue());
    }
}
