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

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import org.mortar.websocket.api.MalformedRequestException;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class HttpLineReaderTest
{
    private static ByteArrayInputStream input(String s)
    {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    public void testLineTerminators() throws Exception
    {
        HttpLineReader reader = new HttpLineReader(input("one\r\ntwo\nthree"), 100);

        assertThat(reader.readLine(), is("one"));
        assertThat(reader.readLine(), is("two"));
        assertThat(reader.readLine(), is("three"));
        assertThat(reader.readLine(), nullValue());
    }

    @Test
    public void testDoesNotReadPastLine() throws Exception
    {
        ByteArrayInputStream in = input("GET / HTTP/1.1\r\n\r\n\u0081\u0002");
        HttpLineReader reader = new HttpLineReader(in, 100);

        assertThat(reader.readLine(), is("GET / HTTP/1.1"));
        assertThat(reader.readLine(), is(""));
        assertThat(in.available(), is(2));
        assertThat(in.read(), is(0x81));
    }

    @Test
    public void testNonAsciiReplaced() throws Exception
    {
        HttpLineReader reader = new HttpLineReader(input("café\r\n"), 100);
        assertThat(reader.readLine(), is("caf?"));
    }

    @Test
    public void testMaxLineLength() throws Exception
    {
        HttpLineReader reader = new HttpLineReader(input("12345\r\n123456\r\n"), 5);

        assertThat(reader.readLine(), is("12345"));
        assertThrows(MalformedRequestException.class, reader::readLine);
    }
}
