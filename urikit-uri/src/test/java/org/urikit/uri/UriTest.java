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
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class UriTest
{
    @Test
    public void testEmpty()
    {
        Uri uri = new Uri();
        assertThat(uri.getScheme(), is(""));
        assertThat(uri.getUserInfo(), is(""));
        assertThat(uri.getHost(), is(""));
        assertThat(uri.hasPort(), is(false));
        assertThat(uri.getPort(), is(-1));
        assertThat(uri.getPath(), empty());
        assertThat(uri.getQuery(), is(""));
        assertThat(uri.getFragment(), is(""));
        assertThat(uri.isRelativeReference(), is(true));
        assertThat(uri.containsRelativePath(), is(true));
        assertThat(uri, is(Uri.from("")));
    }

    public static Stream<Arguments> relativeReferences()
    {
        return Stream.of(
            Arguments.of("http://www.example.com/", false),
            Arguments.of("//www.example.com/", true),
            Arguments.of("/", true),
            Arguments.of("foo", true),
            Arguments.of("urn:isbn:0451450523", false),
            Arguments.of("?query", true),
            Arguments.of("#fragment", true)
        );
    }

    @ParameterizedTest
    @MethodSource("relativeReferences")
    public void testIsRelativeReference(String input, boolean relative)
    {
        assertThat(Uri.from(input).isRelativeReference(), is(relative));
    }

    public static Stream<Arguments> relativePaths()
    {
        return Stream.of(
            Arguments.of("http://www.example.com/", false),
            Arguments.of("http://www.example.com", true),
            Arguments.of("/", false),
            Arguments.of("/foo", false),
            Arguments.of("foo/bar", true),
            Arguments.of("", true),
            Arguments.of("urn:isbn:0451450523", true),
            Arguments.of("./foo", true),
            Arguments.of("../foo", true)
        );
    }

    @ParameterizedTest
    @MethodSource("relativePaths")
    public void testContainsRelativePath(String input, boolean relative)
    {
        assertThat(Uri.from(input).containsRelativePath(), is(relative));
    }

    @Test
    public void testParseReplacesEverything()
    {
        Uri uri = new Uri();
        uri.parse("http://joe@www.example.com:8080/foo?bar#baz");
        assertThat(uri.getUserInfo(), is("joe"));
        assertThat(uri.getPort(), is(8080));

        uri.parse("https://www.example.com/");
        assertThat(uri.getScheme(), is("https"));
        assertThat(uri.getUserInfo(), is(""));
        assertThat(uri.hasPort(), is(false));
        assertThat(uri.getPath(), is(List.of("")));
        assertThat(uri.getQuery(), is(""));
        assertThat(uri.getFragment(), is(""));
    }

    @Test
    public void testFailedParseLeavesUriUnchanged()
    {
        Uri uri = Uri.from("http://joe@www.example.com:8080/foo?bar#baz");
        Uri before = new Uri(uri);

        assertThrows(UriSyntaxException.class, () -> uri.parse("http://other.example.com:99999/"));
        assertThrows(UriSyntaxException.class, () -> uri.parse("http://other.example.com/#[bad]"));
        assertThat(uri, is(before));
        assertThat(uri.getHost(), is("www.example.com"));
    }

    @Test
    public void testCopy()
    {
        Uri uri = Uri.from("http://joe@www.example.com:8080/a/./b?q#f");
        Uri copy = new Uri(uri);
        assertThat(copy, is(uri));
        assertThat(copy.hashCode(), is(uri.hashCode()));

        copy.normalizePath();
        assertThat(copy.getPath(), is(List.of("", "a", "b")));
        assertThat(uri.getPath(), is(List.of("", "a", ".", "b")));
    }

    @Test
    public void testPathIsUnmodifiable()
    {
        Uri uri = Uri.from("/a/b");
        assertThrows(UnsupportedOperationException.class, () -> uri.getPath().add("c"));
        uri.normalizePath();
        assertThrows(UnsupportedOperationException.class, () -> uri.getPath().clear());
    }

    public static Stream<Arguments> equalUris()
    {
        return Stream.of(
            Arguments.of("http://www.example.com/", "HTTP://WWW.EXAMPLE.COM/"),
            Arguments.of("http://www.example.com/%41", "http://www.example.com/A"),
            Arguments.of("http://www.example.com/%7b", "http://www.example.com/%7B"),
            Arguments.of("http://www.example.com/?", "http://www.example.com/"),
            Arguments.of("http://www.example.com/#", "http://www.example.com/"),
            Arguments.of("//host:/", "//host/")
        );
    }

    @ParameterizedTest
    @MethodSource("equalUris")
    public void testEquals(String a, String b)
    {
        Uri uriA = Uri.from(a);
        Uri uriB = Uri.from(b);
        assertThat(uriA, is(uriB));
        assertThat(uriA.hashCode(), is(uriB.hashCode()));
    }

    public static Stream<Arguments> differentUris()
    {
        return Stream.of(
            Arguments.of("http://www.example.com/", "https://www.example.com/"),
            Arguments.of("http://joe@www.example.com/", "http://JOE@www.example.com/"),
            Arguments.of("http://[::A]/", "http://[::a]/"),
            Arguments.of("http://www.example.com/", "http://www.example.com:80/"),
            Arguments.of("http://www.example.com/", "http://www.example.com"),
            Arguments.of("http://www.example.com/a/", "http://www.example.com/a"),
            Arguments.of("http://www.example.com/a/./b", "http://www.example.com/a/b"),
            Arguments.of("/?Q", "/?q"),
            Arguments.of("/#F", "/#f")
        );
    }

    @ParameterizedTest
    @MethodSource("differentUris")
    public void testNotEquals(String a, String b)
    {
        assertThat(Uri.from(a), not(is(Uri.from(b))));
    }

    @Test
    public void testEquivalentAfterNormalization()
    {
        Uri uri1 = Uri.from("example://a/b/c/%7Bfoo%7D");
        Uri uri2 = Uri.from("eXAMPLE://a/./b/../b/%63/%7bfoo%7d");
        assertThat(uri1, not(is(uri2)));

        uri1.normalizePath();
        uri2.normalizePath();
        assertThat(uri1, is(uri2));
        assertThat(uri2.getPath(), is(List.of("", "b", "c", "{foo}")));
    }

    @Test
    public void testNormalizePathOnlyChangesPath()
    {
        Uri uri = Uri.from("http://joe@www.example.com:8080/a/b/../c?q=.#..");
        uri.normalizePath();
        assertThat(uri.getScheme(), is("http"));
        assertThat(uri.getUserInfo(), is("joe"));
        assertThat(uri.getHost(), is("www.example.com"));
        assertThat(uri.getPort(), is(8080));
        assertThat(uri.getPath(), is(List.of("", "a", "c")));
        assertThat(uri.getQuery(), is("q=."));
        assertThat(uri.getFragment(), is(".."));
    }

    @Test
    public void testToString()
    {
        String s = Uri.from("http://joe@www.example.com:8080/a?q#f").toString();
        assertThat(s, containsString("scheme=http"));
        assertThat(s, containsString("userInfo=joe"));
        assertThat(s, containsString("host=www.example.com"));
        assertThat(s, containsString("port=8080"));
        assertThat(s, containsString("path=[, a]"));
        assertThat(s, containsString("query=q"));
        assertThat(s, containsString("fragment=f"));
    }
}
