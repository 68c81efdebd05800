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

import java.util.ArrayList;
import java.util.List;

/**
 * <p>Removes dot segments from a path held as a list of segments, per
 * <a href="https://datatracker.ietf.org/doc/html/rfc3986#section-5.2.4">RFC 3986 section 5.2.4</a>.</p>
 * <p>A leading empty segment marks an absolute path and a trailing empty segment a trailing
 * {@code /}. A {@code ".."} never climbs above the start of the path: it is dropped when there
 * is nothing to remove, or when the only thing left is the absolute root marker.</p>
 * <pre>
 * ["", "a", "b", "c", ".", "..", "..", "g"]  -&gt;  ["", "a", "g"]
 * ["", "..", "c", "d"]                       -&gt;  ["", "c", "d"]
 * [".."]                                     -&gt;  []
 * </pre>
 */
public final class PathNormalizer
{
    private static final String CURRENT = ".";
    private static final String PARENT = "..";

    private PathNormalizer()
    {
    }

    /**
     * @param segments the path segments to normalize; not modified
     * @return a new list of segments with all {@code "."} and {@code ".."} segments resolved
     */
    public static List<String> removeDotSegments(List<String> segments)
    {
        List<String> output = new ArrayList<>(segments.size());
        for (String segment : segments)
        {
            switch (segment)
            {
                case CURRENT:
                    break;
                case PARENT:
                    if (!output.isEmpty() && !isRootMarker(output))
                        output.remove(output.size() - 1);
                    break;
                default:
                    output.add(segment);
                    break;
            }
        }
        return output;
    }

    /**
     * @param segments path segments
     * @return true if no segment is {@code "."} or {@code ".."}
     */
    public static boolean isNormalized(List<String> segments)
    {
        for (String segment : segments)
        {
            if (CURRENT.equals(segment) || PARENT.equals(segment))
                return false;
        }
        return true;
    }

    private static boolean isRootMarker(List<String> output)
    {
        return output.size() == 1 && output.get(0).isEmpty();
    }
}
