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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class AcceptHashTest
{
    @Test
    public void testHashKeyFromRFC6455()
    {
        // Example from RFC 6455 section 1.3
        assertThat(AcceptHash.hashKey("dGhlIHNhbXBsZSBub25jZQ=="), is("s3pPLMBiTxaQ9kYGzzhZRbK+xOo="));
    }

    @Test
    public void testHashKeyIsStable()
    {
        String key = "x3JJHMbDL1EzLkh9GBhXDw==";
        assertThat(AcceptHash.hashKey(key), is(AcceptHash.hashKey(key)));
        assertThat(AcceptHash.hashKey(key), is("HSmrc0sMlYUkAGmm5OPpG2HaGWk="));
    }

    @Test
    public void testDifferentKeysDifferentHashes()
    {
        assertThat(AcceptHash.hashKey("dGhlIHNhbXBsZSBub25jZQ=="), not(is(AcceptHash.hashKey("dGhlIHNhbXBsZSBub25jZR=="))));
    }
}
