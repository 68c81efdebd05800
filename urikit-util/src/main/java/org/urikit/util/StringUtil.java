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

package org.urikit.util;

/**
 * Fast String Utilities.
 *
 * The case conversions only touch US-ASCII letters, which is what the case insensitive
 * parts of a URI (scheme and registered host names) are defined over, and avoid creating
 * a new string when nothing needs to change.
 */
public class StringUtil
{
    /**
     * fast lower case conversion. Only works on ascii (not unicode)
     *
     * @param c the char to convert
     * @return a lower case version of c
     */
    public static char asciiToLowerCase(char c)
    {
        return (c >= 'A' && c <= 'Z') ? (char)(c + ('a' - 'A')) : c;
    }

    /**
     * fast lower case conversion. Only works on ascii (not unicode)
     *
     * @param s the string to convert
     * @return a lower case version of s, or s itself if it has no upper case ascii letters
     */
    public static String asciiToLowerCase(String s)
    {
        if (s == null)
            return null;

        char[] c = null;
        for (int i = 0; i < s.length(); i++)
        {
            char lower = asciiToLowerCase(s.charAt(i));
            if (lower == s.charAt(i))
                continue;
            if (c == null)
                c = s.toCharArray();
            c[i] = lower;
        }
        return c == null ? s : new String(c);
    }

    /**
     * Find the first occurrence of any of the given characters.
     *
     * @param s the string to search
     * @param chars the characters to look for
     * @return the index of the first match, or -1
     */
    public static int indexOfAny(String s, String chars)
    {
        for (int i = 0; i < s.length(); i++)
        {
            if (chars.indexOf(s.charAt(i)) >= 0)
                return i;
        }
        return -1;
    }
}
