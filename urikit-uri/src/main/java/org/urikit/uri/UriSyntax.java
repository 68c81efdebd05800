//
// ========================================================================
// Copyright (c) 2026 the UriKit project authors and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.urikit.uri;

import org.urikit.util.CharacterSet;

import static org.urikit.util.CharacterSet.of;
import static org.urikit.util.CharacterSet.range;
import static org.urikit.util.CharacterSet.union;

/**
 * <p>The character classes of the <a href="https://datatracker.ietf.org/doc/html/rfc3986#appendix-A">RFC 3986</a>
 * grammar.</p>
 * <p>Productions that allow {@code pct-encoded} are given without that alternative: the parser
 * handles {@code %} escapes itself and checks every other character against these sets.</p>
 */
public final class UriSyntax
{
    /**
     * <pre>ALPHA = %x41-5A / %x61-7A</pre>
     */
    public static final CharacterSet ALPHA = union(range('a', 'z'), range('A', 'Z'));

    /**
     * <pre>DIGIT = %x30-39</pre>
     */
    public static final CharacterSet DIGIT = range('0', '9');

    /**
     * <pre>HEXDIG = DIGIT / "A" / "B" / "C" / "D" / "E" / "F"</pre>
     * Lower case digits are accepted too.
     */
    public static final CharacterSet HEXDIG = union(DIGIT, range('A', 'F'), range('a', 'f'));

    /**
     * <pre>unreserved = ALPHA / DIGIT / "-" / "." / "_" / "~"</pre>
     */
    public static final CharacterSet UNRESERVED = union(ALPHA, DIGIT, of("-._~"));

    /**
     * <pre>sub-delims = "!" / "$" / "&amp;" / "'" / "(" / ")" / "*" / "+" / "," / ";" / "="</pre>
     */
    public static final CharacterSet SUB_DELIMS = of("!$&'()*+,;=");

    /**
     * The characters after the first of {@code scheme = ALPHA *( ALPHA / DIGIT / "+" / "-" / "." )}
     */
    public static final CharacterSet SCHEME_NOT_FIRST = union(ALPHA, DIGIT, of("+-."));

    /**
     * <pre>pchar = unreserved / pct-encoded / sub-delims / ":" / "@"</pre>
     */
    public static final CharacterSet PCHAR_NOT_PCT_ENCODED = union(UNRESERVED, SUB_DELIMS, of(":@"));

    /**
     * <pre>query = *( pchar / "/" / "?" )</pre>
     * <pre>fragment = *( pchar / "/" / "?" )</pre>
     */
    public static final CharacterSet QUERY_OR_FRAGMENT_NOT_PCT_ENCODED = PCHAR_NOT_PCT_ENCODED.with('/', '?');

    /**
     * <pre>userinfo = *( unreserved / pct-encoded / sub-delims / ":" )</pre>
     */
    public static final CharacterSet USER_INFO_NOT_PCT_ENCODED = union(UNRESERVED, SUB_DELIMS, of(':'));

    /**
     * <pre>reg-name = *( unreserved / pct-encoded / sub-delims )</pre>
     * IPv4 addresses are accepted through this set as well.
     */
    public static final CharacterSet REG_NAME_NOT_PCT_ENCODED = union(UNRESERVED, SUB_DELIMS);

    /**
     * The part after the dot of {@code IPvFuture = "v" 1*HEXDIG "." 1*( unreserved / sub-delims / ":" )}
     */
    public static final CharacterSet IPV_FUTURE_LAST_PART = union(UNRESERVED, SUB_DELIMS, of(':'));

    private UriSyntax()
    {
    }
}
