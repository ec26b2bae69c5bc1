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

import java.io.IOException;
import java.io.InputStream;

import org.mortar.websocket.api.MalformedRequestException;

/**
 * <p>Reads ASCII lines from a connection one byte at a time.</p>
 * <p>Nothing is buffered, so once the blank line ending the header block has been
 * read the stream is positioned on the first byte sent after the handshake.
 * The stream is never closed by this reader.</p>
 */
public class HttpLineReader
{
    private static final int CR = '\r';
    private static final int LF = '\n';

    private final InputStream _in;
    private final int _maxLineLength;

    public HttpLineReader(InputStream in, int maxLineLength)
    {
        _in = in;
        _maxLineLength = maxLineLength;
    }

    /**
     * @return the next line without its CRLF or LF terminator, or null at end of stream
     * @throws MalformedRequestException if the line is longer than the maximum line length
     * @throws IOException if the stream cannot be read
     */
    public String readLine() throws IOException
    {
        StringBuilder line = new StringBuilder(80);
        int b = _in.read();
        if (b < 0)
            return null;
        while (b >= 0 && b != LF)
        {
            // one extra byte for the CR of the terminator
            if (line.length() > _maxLineLength)
                throw new MalformedRequestException("Line exceeds " + _maxLineLength + " bytes");
            // non ASCII bytes are replaced, as an ASCII decoder would
            line.append(b < 0x80 ? (char)b : '?');
            b = _in.read();
        }
        int last = line.length() - 1;
        if (last >= 0 && line.charAt(last) == CR)
            line.setLength(last);
        if (line.length() > _maxLineLength)
            throw new MalformedRequestException("Line exceeds " + _maxLineLength + " bytes");
        return line.toString();
    }
}
