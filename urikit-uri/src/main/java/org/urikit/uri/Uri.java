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

import java.util.List;
import java.util.Objects;

/**
 * A URI reference.
 * Parse a URI or relative reference from a string. Given a URI
 * {@code http://user@host:8080/a/b%20c/?query#fragment}
 * this class holds the following components, all percent decoded:<ul>
 * <li>{@link #getScheme()} - http</li>
 * <li>{@link #getUserInfo()} - user</li>
 * <li>{@link #getHost()} - host</li>
 * <li>{@link #getPort()} - 8080</li>
 * <li>{@link #getPath()} - ["", "a", "b c", ""]</li>
 * <li>{@link #getQuery()} - query</li>
 * <li>{@link #getFragment()} - fragment</li>
 * </ul>
 *
 * <p>The scheme, and a host that is a registered name or IPv4 address, are lower cased so that
 * they compare case insensitively. An IP literal host is kept as written, brackets included.
 * A missing component reads as the empty string; in particular an absent query and an empty
 * query ({@code http://host?}) are not distinguished.</p>
 *
 * <p>The path is a list of segments: a leading empty segment means the path is absolute and
 * a trailing empty segment means it ends with {@code /}. Dot segments are kept as parsed until
 * {@link #normalizePath()} is called, so two URIs are equivalent in the sense of
 * <a href="https://datatracker.ietf.org/doc/html/rfc3986#section-6.2.2">RFC 3986 section 6.2.2</a>
 * when they are {@link #equals(Object) equal} after both have been normalized.</p>
 *
 * <p>Instances are not thread safe for mutation.</p>
 */
public class Uri
{
    private String _scheme = "";
    private String _userInfo = "";
    private String _host = "";
    private int _port = -1;
    private List<String> _path = List.of();
    private String _query = "";
    private String _fragment = "";

    /**
     * Parse a URI reference with the {@link UriParser#getDefault() default parser}.
     *
     * @param uri the URI reference
     * @return the parsed URI
     * @throws UriSyntaxException if the string is not a valid URI reference
     */
    public static Uri from(String uri)
    {
        return UriParser.getDefault().parse(uri);
    }

    /**
     * Construct an empty relative reference.
     */
    public Uri()
    {
    }

    public Uri(Uri uri)
    {
        set(uri);
    }

    Uri(String scheme, String userInfo, String host, int port, List<String> path, String query, String fragment)
    {
        _scheme = scheme;
        _userInfo = userInfo;
        _host = host;
        _port = port;
        _path = List.copyOf(path);
        _query = query;
        _fragment = fragment;
    }

    /**
     * Replace this URI with the parse of the given string.
     * If the string does not parse, this URI is left unchanged.
     *
     * @param uri the URI reference
     * @throws UriSyntaxException if the string is not a valid URI reference
     */
    public void parse(String uri)
    {
        set(UriParser.getDefault().parse(uri));
    }

    private void set(Uri uri)
    {
        _scheme = uri._scheme;
        _userInfo = uri._userInfo;
        _host = uri._host;
        _port = uri._port;
        _path = uri._path;
        _query = uri._query;
        _fragment = uri._fragment;
    }

    /**
     * @return the lower case scheme, or the empty string for a relative reference
     */
    public String getScheme()
    {
        return _scheme;
    }

    public String getUserInfo()
    {
        return _userInfo;
    }

    /**
     * @return the host, or the empty string if there is no authority or the authority has an empty host
     */
    public String getHost()
    {
        return _host;
    }

    public boolean hasPort()
    {
        return _port >= 0;
    }

    /**
     * @return the port {@code 0..65535}, or -1 if there is none
     */
    public int getPort()
    {
        return _port;
    }

    /**
     * @return the unmodifiable list of decoded path segments
     */
    public List<String> getPath()
    {
        return _path;
    }

    public String getQuery()
    {
        return _query;
    }

    public String getFragment()
    {
        return _fragment;
    }

    /**
     * @return true if there is no scheme
     */
    public boolean isRelativeReference()
    {
        return _scheme.isEmpty();
    }

    /**
     * @return true if the path is empty or does not start with {@code /}
     */
    public boolean containsRelativePath()
    {
        return _path.isEmpty() || !_path.get(0).isEmpty();
    }

    /**
     * Remove the {@code "."} and {@code ".."} segments of the path.
     * No other component changes. Normalizing an already normalized path has no effect.
     *
     * @see PathNormalizer#removeDotSegments(List)
     */
    public void normalizePath()
    {
        _path = List.copyOf(PathNormalizer.removeDotSegments(_path));
    }

    @Override
    public boolean equals(Object o)
    {
        if (o == this)
            return true;
        if (!(o instanceof Uri))
            return false;
        Uri that = (Uri)o;
        return _port == that._port &&
            _scheme.equals(that._scheme) &&
            _userInfo.equals(that._userInfo) &&
            _host.equals(that._host) &&
            _path.equals(that._path) &&
            _query.equals(that._query) &&
            _fragment.equals(that._fragment);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_scheme, _userInfo, _host, _port, _path, _query, _fragment);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{scheme=%s,userInfo=%s,host=%s,port=%d,path=%s,query=%s,fragment=%s}",
            getClass().getSimpleName(),
            hashCode(),
            _scheme,
            _userInfo,
            _host,
            _port,
            _path,
            _query,
            _fragment);
    }
}
