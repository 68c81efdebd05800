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

import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urikit.uri.UriSyntaxException.Violation;
import org.urikit.util.CharacterSet;
import org.urikit.util.CharsetStringBuilder;
import org.urikit.util.PercentEncodedCharacterDecoder;
import org.urikit.util.StringUtil;

/**
 * <p>Parses URI references according to the generic syntax of
 * <a href="https://datatracker.ietf.org/doc/html/rfc3986#section-3">RFC 3986</a>.</p>
 * <p>The string is split into its components in a fixed order (scheme, authority, path, fragment
 * then query) and each component is checked against its character set, with {@code %} escapes
 * decoded as it goes. The first violation fails the whole parse with a {@link UriSyntaxException};
 * no partially parsed {@link Uri} is ever returned.</p>
 * <p>Percent decoded octets are turned into characters with the parser's {@link Charset}. The default,
 * {@code ISO-8859-1}, maps every octet to the character of the same value so decoded components carry
 * the exact octets of the URI. It can be changed with the {@value #CHARSET_PROPERTY} system property,
 * or per parser with {@link #UriParser(Charset)}.</p>
 * <p>IPv6 literals and IPv4 addresses are only checked against their character sets, not against
 * their address grammars.</p>
 * <p>A parser has no mutable state and may be shared between threads.</p>
 */
public class UriParser
{
    private static final Logger LOG = LoggerFactory.getLogger(UriParser.class);

    public static final String CHARSET_PROPERTY = "org.urikit.uri.UriParser.charset";

    private static final UriParser DEFAULT = new UriParser(defaultCharset());

    private static final int MAX_PORT = 0xFFFF;

    /**
     * States of the host and port part of the authority.
     */
    private enum HostState
    {
        START,
        REG_NAME,
        PERCENT_ENCODED,
        IP_LITERAL,
        IPV6,
        IPV_FUTURE_VERSION,
        IPV_FUTURE_ADDRESS,
        IP_LITERAL_END,
        PORT
    }

    private final Charset _charset;

    static Charset defaultCharset()
    {
        String name = System.getProperty(CHARSET_PROPERTY);
        if (name == null)
            return StandardCharsets.ISO_8859_1;
        try
        {
            return Charset.forName(name);
        }
        catch (IllegalArgumentException x)
        {
            LOG.warn("Unknown charset {} for {}, using {}", name, CHARSET_PROPERTY, StandardCharsets.ISO_8859_1);
            if (LOG.isDebugEnabled())
                LOG.debug("Charset lookup failed", x);
            return StandardCharsets.ISO_8859_1;
        }
    }

    /**
     * @return the shared parser using the default charset
     */
    public static UriParser getDefault()
    {
        return DEFAULT;
    }

    public UriParser()
    {
        this(DEFAULT.getCharset());
    }

    /**
     * @param charset the charset used to turn percent decoded octets into characters
     */
    public UriParser(Charset charset)
    {
        _charset = Objects.requireNonNull(charset);
    }

    public Charset getCharset()
    {
        return _charset;
    }

    /**
     * @param uri the URI reference to parse
     * @return the parsed URI
     * @throws UriSyntaxException if the string is not a valid URI reference
     */
    public Uri parse(String uri)
    {
        Objects.requireNonNull(uri);
        try
        {
            return new Parse(uri).parse();
        }
        catch (UriSyntaxException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Rejected {} {}", x.getViolation(), uri);
            throw x;
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s}", getClass().getSimpleName(), hashCode(), _charset);
    }

    /**
     * The state of a single parse.
     */
    private class Parse
    {
        private final String _input;
        private final CharsetStringBuilder _builder = CharsetStringBuilder.forCharset(_charset);

        private String _userInfo = "";
        private String _host = "";
        private int _port = -1;

        private Parse(String input)
        {
            _input = input;
        }

        private Uri parse()
        {
            // A colon is only a scheme delimiter if it comes before any '/'
            String scheme = "";
            String rest = _input;
            int schemeEnd = _input.indexOf(':');
            int firstDelimiter = _input.indexOf('/');
            if (schemeEnd >= 0 && (firstDelimiter < 0 || schemeEnd < firstDelimiter))
            {
                scheme = parseScheme(_input.substring(0, schemeEnd));
                rest = _input.substring(schemeEnd + 1);
            }

            int pathEnd = StringUtil.indexOfAny(rest, "?#");
            if (pathEnd < 0)
                pathEnd = rest.length();
            String authorityAndPath = rest.substring(0, pathEnd);
            String queryAndFragment = rest.substring(pathEnd);

            String path;
            if (authorityAndPath.startsWith("//"))
            {
                authorityAndPath = authorityAndPath.substring(2);
                int authorityEnd = authorityAndPath.indexOf('/');
                if (authorityEnd < 0)
                    authorityEnd = authorityAndPath.length();
                parseAuthority(authorityAndPath.substring(0, authorityEnd));
                path = authorityAndPath.substring(authorityEnd);
            }
            else
            {
                path = authorityAndPath;
            }

            List<String> segments = parsePath(path);

            String fragment = "";
            String query = queryAndFragment;
            int hash = queryAndFragment.indexOf('#');
            if (hash >= 0)
            {
                fragment = decode(queryAndFragment.substring(hash + 1), UriSyntax.QUERY_OR_FRAGMENT_NOT_PCT_ENCODED, Violation.ILLEGAL_FRAGMENT);
                query = queryAndFragment.substring(0, hash);
            }
            // Anything left starts with the '?'
            if (!query.isEmpty())
                query = decode(query.substring(1), UriSyntax.QUERY_OR_FRAGMENT_NOT_PCT_ENCODED, Violation.ILLEGAL_QUERY);

            return new Uri(scheme, _userInfo, _host, _port, segments, query, fragment);
        }

        private String parseScheme(String scheme)
        {
            boolean first = true;
            for (int i = 0; i < scheme.length(); i++)
            {
                CharacterSet allowed = first ? UriSyntax.ALPHA : UriSyntax.SCHEME_NOT_FIRST;
                if (!allowed.contains(scheme.charAt(i)))
                    throw new UriSyntaxException(Violation.ILLEGAL_SCHEME, _input);
                first = false;
            }
            if (first)
                throw new UriSyntaxException(Violation.ILLEGAL_SCHEME, _input);
            return StringUtil.asciiToLowerCase(scheme);
        }

        private void parseAuthority(String authority)
        {
            String hostPort = authority;
            int at = authority.indexOf('@');
            if (at >= 0)
            {
                _userInfo = decode(authority.substring(0, at), UriSyntax.USER_INFO_NOT_PCT_ENCODED, Violation.ILLEGAL_USER_INFO);
                hostPort = authority.substring(at + 1);
            }
            new HostPort(hostPort).parse();
        }

        private List<String> parsePath(String path)
        {
            List<String> segments = new ArrayList<>();
            if (path.isEmpty())
                return segments;

            // The lone "/" is the absolute empty path, one empty segment rather than two
            if ("/".equals(path))
            {
                segments.add("");
                return segments;
            }

            int start = 0;
            while (true)
            {
                int slash = path.indexOf('/', start);
                int end = slash < 0 ? path.length() : slash;
                segments.add(decode(path.substring(start, end), UriSyntax.PCHAR_NOT_PCT_ENCODED, Violation.ILLEGAL_PATH));
                if (slash < 0)
                    return segments;
                start = slash + 1;
            }
        }

        /**
         * Check and percent decode a component.
         *
         * @param encoded the raw component
         * @param allowed the characters allowed without encoding
         * @param violation the violation for a character that is neither allowed nor an escape
         * @return the decoded component
         */
        private String decode(String encoded, CharacterSet allowed, Violation violation)
        {
            PercentEncodedCharacterDecoder decoder = null;
            // start of the pending run of literal characters, or -1
            int run = -1;
            for (int i = 0; i < encoded.length(); i++)
            {
                char c = encoded.charAt(i);
                if (decoder != null)
                {
                    if (!decoder.nextEncodedCharacter(c))
                        throw new UriSyntaxException(Violation.BAD_PERCENT_ENCODING, _input);
                    if (decoder.isDone())
                    {
                        _builder.append((byte)decoder.getDecodedCharacter());
                        decoder = null;
                    }
                }
                else if (c == '%')
                {
                    if (run >= 0)
                    {
                        _builder.append(encoded, run, i - run);
                        run = -1;
                    }
                    decoder = new PercentEncodedCharacterDecoder();
                }
                else if (allowed.contains(c))
                {
                    if (run < 0)
                        run = i;
                }
                else
                {
                    throw new UriSyntaxException(violation, _input);
                }
            }
            if (decoder != null)
                throw new UriSyntaxException(Violation.BAD_PERCENT_ENCODING, _input);
            if (run >= 0)
                _builder.append(encoded, run, encoded.length() - run);
            return build();
        }

        private String build()
        {
            try
            {
                return _builder.build();
            }
            catch (CharacterCodingException x)
            {
                throw new UriSyntaxException(Violation.MALFORMED_ENCODING, _input, x);
            }
        }

        /**
         * The host and port of an authority, parsed one character at a time.
         */
        private class HostPort
        {
            private final String _hostPort;
            private final StringBuilder _portDigits = new StringBuilder();
            private HostState _state = HostState.START;
            private PercentEncodedCharacterDecoder _decoder;
            private boolean _literal;

            private HostPort(String hostPort)
            {
                _hostPort = hostPort;
            }

            private void parse()
            {
                for (int i = 0; i < _hostPort.length(); i++)
                    _state = next(_hostPort.charAt(i));

                switch (_state)
                {
                    case START:
                    case REG_NAME:
                    case IP_LITERAL_END:
                    case PORT:
                        break;
                    case PERCENT_ENCODED:
                        throw fail(Violation.BAD_PERCENT_ENCODING);
                    case IP_LITERAL:
                    case IPV6:
                    case IPV_FUTURE_VERSION:
                    case IPV_FUTURE_ADDRESS:
                        throw fail(Violation.BAD_IP_LITERAL);
                    default:
                        throw new IllegalStateException(_state.toString());
                }

                String host = build();
                _host = _literal ? host : StringUtil.asciiToLowerCase(host);
                _port = parsePort();
            }

            private HostState next(char c)
            {
                switch (_state)
                {
                    case START:
                        return onStart(c);
                    case REG_NAME:
                        return onRegName(c);
                    case PERCENT_ENCODED:
                        return onPercentEncoded(c);
                    case IP_LITERAL:
                        return onIpLiteral(c);
                    case IPV6:
                        return onIpv6(c);
                    case IPV_FUTURE_VERSION:
                        return onIpvFutureVersion(c);
                    case IPV_FUTURE_ADDRESS:
                        return onIpvFutureAddress(c);
                    case IP_LITERAL_END:
                        return onIpLiteralEnd(c);
                    case PORT:
                        return onPort(c);
                    default:
                        throw new IllegalStateException(_state.toString());
                }
            }

            private HostState onStart(char c)
            {
                if (c == '[')
                {
                    _literal = true;
                    _builder.append(c);
                    return HostState.IP_LITERAL;
                }
                return onRegName(c);
            }

            private HostState onRegName(char c)
            {
                if (c == '%')
                {
                    _decoder = new PercentEncodedCharacterDecoder();
                    return HostState.PERCENT_ENCODED;
                }
                if (c == ':')
                    return HostState.PORT;
                if (!UriSyntax.REG_NAME_NOT_PCT_ENCODED.contains(c))
                    throw fail(Violation.ILLEGAL_HOST);
                _builder.append(c);
                return HostState.REG_NAME;
            }

            private HostState onPercentEncoded(char c)
            {
                if (!_decoder.nextEncodedCharacter(c))
                    throw fail(Violation.BAD_PERCENT_ENCODING);
                if (!_decoder.isDone())
                    return HostState.PERCENT_ENCODED;
                _builder.append((byte)_decoder.getDecodedCharacter());
                _decoder = null;
                return HostState.REG_NAME;
            }

            private HostState onIpLiteral(char c)
            {
                if (c == 'v')
                {
                    _builder.append(c);
                    return HostState.IPV_FUTURE_VERSION;
                }
                return onIpv6(c);
            }

            private HostState onIpv6(char c)
            {
                _builder.append(c);
                return c == ']' ? HostState.IP_LITERAL_END : HostState.IPV6;
            }

            private HostState onIpvFutureVersion(char c)
            {
                if (c == '.')
                {
                    _builder.append(c);
                    return HostState.IPV_FUTURE_ADDRESS;
                }
                if (!UriSyntax.HEXDIG.contains(c))
                    throw fail(Violation.BAD_IP_LITERAL);
                _builder.append(c);
                return HostState.IPV_FUTURE_VERSION;
            }

            private HostState onIpvFutureAddress(char c)
            {
                if (c == ']')
                {
                    _builder.append(c);
                    return HostState.IP_LITERAL_END;
                }
                if (!UriSyntax.IPV_FUTURE_LAST_PART.contains(c))
                    throw fail(Violation.BAD_IP_LITERAL);
                _builder.append(c);
                return HostState.IPV_FUTURE_ADDRESS;
            }

            private HostState onIpLiteralEnd(char c)
            {
                if (c != ':')
                    throw fail(Violation.BAD_IP_LITERAL);
                return HostState.PORT;
            }

            private HostState onPort(char c)
            {
                _portDigits.append(c);
                return HostState.PORT;
            }

            /**
             * @return the port, or -1 if the port is empty
             */
            private int parsePort()
            {
                if (_portDigits.length() == 0)
                    return -1;
                int port = 0;
                for (int i = 0; i < _portDigits.length(); i++)
                {
                    char c = _portDigits.charAt(i);
                    if (!UriSyntax.DIGIT.contains(c))
                        throw fail(Violation.BAD_PORT);
                    port = port * 10 + (c - '0');
                    if (port > MAX_PORT)
                        throw fail(Violation.BAD_PORT);
                }
                return port;
            }

            private UriSyntaxException fail(Violation violation)
            {
                return new UriSyntaxException(violation, _input);
            }
        }
    }
}
