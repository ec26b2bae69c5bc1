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

/**
 * What the request parser does when a header name is seen a second time.
 */
public enum DuplicateHeaderPolicy
{
    /**
     * Fail the handshake with a {@link org.mortar.websocket.api.DuplicateHeaderException}.
     */
    REJECT,
    /**
     * Keep the value of the last occurrence.
     */
    LAST_WINS,
    /**
     * Join the values with <code>", "</code>, as a list valued header would be.
     */
    MERGE
}
