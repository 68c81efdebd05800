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

import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CharsetStringBuilderTest
{
    public static Stream<Charset> charsets()
    {
        return Stream.of(StandardCharsets.ISO_8859_1, StandardCharsets.US_ASCII, StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @MethodSource("charsets")
    public void testMixedCharactersAndOctets(Charset charset) throws Exception
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(charset);
        assertThat(builder.getCharset(), is(charset));
        builder.append('h');
        builder.append((byte)'e');
        builder.append("xllox", 1, 3);
        builder.append((byte)' ');
        builder.append('!');
        assertThat(builder.build(), is("hello !"));
    }

    @ParameterizedTest
    @MethodSource("charsets")
    public void testBuildResets(Charset charset) throws Exception
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(charset);
        builder.append('a');
        builder.append((byte)'b');
        assertThat(builder.build(), is("ab"));
        assertThat(builder.build(), is(""));
        builder.append('c');
        builder.reset();
        builder.append((byte)'d');
        assertThat(builder.build(), is("d"));
    }

    @Test
    public void testIso88591KeepsEveryOctet() throws Exception
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.ISO_8859_1);
        assertThat(builder, instanceOf(CharsetStringBuilder.Iso88591StringBuilder.class));
        builder.append((byte)0xBC);
        builder.append((byte)0x00);
        builder.append((byte)0xFF);
        assertThat(builder.build(), is("¼\u0000ÿ"));
    }

    @Test
    public void testUsAsciiRejectsHighOctets()
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.US_ASCII);
        builder.append('a');
        builder.append((byte)0x80);
        assertThrows(CharacterCodingException.class, builder::build);
    }

    @Test
    public void testUtf8MultiOctet() throws Exception
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.UTF_8);
        builder.append('r');
        builder.append((byte)0xC3);
        builder.append((byte)0xA9);
        builder.append('s');
        builder.append((byte)0xE2);
        builder.append((byte)0x82);
        builder.append((byte)0xAC);
        assertThat(builder.build(), is("rés€"));
    }

    @Test
    public void testUtf8IncompleteSequenceBeforeCharacter()
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.UTF_8);
        builder.append((byte)0xC3);
        builder.append('x');
        assertThrows(CharacterCodingException.class, builder::build);
    }

    @Test
    public void testUtf8IncompleteSequenceAtEnd() throws Exception
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.UTF_8);
        builder.append('x');
        builder.append((byte)0xE2);
        builder.append((byte)0x82);
        assertThrows(CharacterCodingException.class, builder::build);

        // The failure does not leak into the next build
        builder.append('y');
        assertThat(builder.build(), is("y"));
    }

    @Test
    public void testUtf8OctetsThenLiteralRun() throws Exception
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.UTF_8);
        builder.append((byte)0xC3);
        builder.append((byte)0xA9);
        builder.append("xxt\u00e9!", 2, 3);
        builder.append((byte)0xE2);
        builder.append((byte)0x82);
        builder.append((byte)0xAC);
        assertThat(builder.build(), is("\u00e9t\u00e9!\u20ac"));
    }

    @Test
    public void testUtf8IncompleteSequenceBeforeLiteralRun()
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.UTF_8);
        builder.append((byte)0xE2);
        builder.append("abc", 0, 3);
        assertThrows(CharacterCodingException.class, builder::build);
    }

    @Test
    public void testUtf8BadOctet()
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.UTF_8);
        builder.append((byte)0xBC);
        assertThrows(CharacterCodingException.class, builder::build);
    }

    @Test
    public void testManyOctetsGrowBuffer() throws Exception
    {
        CharsetStringBuilder builder = CharsetStringBuilder.forCharset(StandardCharsets.UTF_8);
        StringBuilder expected = new StringBuilder();
        for (int i = 0; i < 100; i++)
        {
            builder.append((byte)0xC3);
            builder.append((byte)0xA9);
            expected.append('é');
        }
        assertThat(builder.build(), is(expected.toString()));
    }
}
