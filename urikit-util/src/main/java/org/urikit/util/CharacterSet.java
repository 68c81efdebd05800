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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * <p>An immutable set of characters, held as sorted, non overlapping inclusive ranges.</p>
 * <p>Sets are composed from single characters, ranges and other sets:</p>
 * <pre>
 * CharacterSet alpha = CharacterSet.union(CharacterSet.range('a', 'z'), CharacterSet.range('A', 'Z'));
 * CharacterSet unreserved = CharacterSet.union(alpha, DIGIT, CharacterSet.of('-', '.', '_', '~'));
 * </pre>
 * <p>Instances have no mutable state and may be shared freely between threads.</p>
 */
public final class CharacterSet
{
    public static final CharacterSet EMPTY = new CharacterSet(new char[0], new char[0]);

    // _lows[i].._highs[i] is the i'th range, ordered by low with gaps between ranges
    private final char[] _lows;
    private final char[] _highs;

    private CharacterSet(char[] lows, char[] highs)
    {
        _lows = lows;
        _highs = highs;
    }

    /**
     * @param chars the members of the set
     * @return a set containing exactly the given characters
     */
    public static CharacterSet of(char... chars)
    {
        List<char[]> ranges = new ArrayList<>(chars.length);
        for (char c : chars)
            ranges.add(new char[]{c, c});
        return merge(ranges);
    }

    /**
     * @param chars the members of the set
     * @return a set containing exactly the characters of the string
     */
    public static CharacterSet of(String chars)
    {
        return of(chars.toCharArray());
    }

    /**
     * @param low the first character of the range
     * @param high the last character of the range, inclusive
     * @return a set containing every character from {@code low} to {@code high}
     * @throws IllegalArgumentException if {@code high} is before {@code low}
     */
    public static CharacterSet range(char low, char high)
    {
        if (high < low)
            throw new IllegalArgumentException("Bad range " + describe(low) + "-" + describe(high));
        return new CharacterSet(new char[]{low}, new char[]{high});
    }

    /**
     * @param sets the sets to combine
     * @return a set containing every character of every given set
     */
    public static CharacterSet union(CharacterSet... sets)
    {
        List<char[]> ranges = new ArrayList<>();
        for (CharacterSet set : sets)
        {
            Objects.requireNonNull(set);
            for (int i = 0; i < set._lows.length; i++)
                ranges.add(new char[]{set._lows[i], set._highs[i]});
        }
        return merge(ranges);
    }

    /**
     * @param chars extra members
     * @return a set containing the characters of this set and the given characters
     */
    public CharacterSet with(char... chars)
    {
        return union(this, of(chars));
    }

    private static CharacterSet merge(List<char[]> ranges)
    {
        if (ranges.isEmpty())
            return EMPTY;

        ranges.sort(Comparator.comparingInt((char[] r) -> r[0]));

        char[] lows = new char[ranges.size()];
        char[] highs = new char[ranges.size()];
        int count = 0;
        for (char[] range : ranges)
        {
            // overlapping or adjacent ranges collapse into the previous one
            if (count > 0 && range[0] <= highs[count - 1] + 1)
            {
                if (range[1] > highs[count - 1])
                    highs[count - 1] = range[1];
                continue;
            }
            lows[count] = range[0];
            highs[count] = range[1];
            count++;
        }
        return new CharacterSet(Arrays.copyOf(lows, count), Arrays.copyOf(highs, count));
    }

    /**
     * @param c the character to test
     * @return true if the character is a member of this set
     */
    public boolean contains(char c)
    {
        int low = 0;
        int high = _lows.length - 1;
        while (low <= high)
        {
            int mid = (low + high) >>> 1;
            if (c < _lows[mid])
                high = mid - 1;
            else if (c > _highs[mid])
                low = mid + 1;
            else
                return true;
        }
        return false;
    }

    /**
     * @param chars the characters to test
     * @return true if every character of the sequence is a member of this set
     */
    public boolean containsAll(CharSequence chars)
    {
        for (int i = 0; i < chars.length(); i++)
        {
            if (!contains(chars.charAt(i)))
                return false;
        }
        return true;
    }

    public boolean isEmpty()
    {
        return _lows.length == 0;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof CharacterSet))
            return false;
        CharacterSet that = (CharacterSet)o;
        return Arrays.equals(_lows, that._lows) && Arrays.equals(_highs, that._highs);
    }

    @Override
    public int hashCode()
    {
        return 31 * Arrays.hashCode(_lows) + Arrays.hashCode(_highs);
    }

    @Override
    public String toString()
    {
        StringBuilder buf = new StringBuilder("[");
        for (int i = 0; i < _lows.length; i++)
        {
            if (i > 0)
                buf.append(',');
            buf.append(describe(_lows[i]));
            if (_highs[i] != _lows[i])
                buf.append('-').append(describe(_highs[i]));
        }
        return buf.append(']').toString();
    }

    private static String describe(char c)
    {
        if (c > 0x20 && c < 0x7F)
            return String.valueOf(c);
        return String.format("0x%02x", (int)c);
    }
}
