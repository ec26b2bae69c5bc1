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

@SuppressWarnings("serial")
public class DuplicateHeaderException extends MalformedRequestException
{
    private final String _header;

    public DuplicateHeaderException(String header)
    {
        super("Duplicate header [" + header + "]");
        _header = header;
    }

    public String getHeader()
    {
        return _header;
    }
}
