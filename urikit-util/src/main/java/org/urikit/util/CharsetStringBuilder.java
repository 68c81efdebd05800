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

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * <p>Build a string from a mix of already decoded characters and percent decoded octets.</p>
 * <p>Literal characters of a URI component are appended with {@link #append(char)} and the
 * octets produced by {@link PercentEncodedCharacterDecoder} with {@link #append(byte)}.
 * The octets are converted to characters according to the builder's {@link Charset}.</p>
 * <p>Any coding error is reported by a {@link CharacterCodingException} thrown from
 * {@link #build()}, which also resets the builder for reuse.</p>
 */
public interface CharsetStringBuilder
{
    /**
     * @param b An encoded octet to append
     */
    void append(byte b);

    /**
     * @param c A decoded character to append
     */
    void append(char c);

    /**
     * @param chars sequence of decoded characters
     * @param offset offset into the sequence
     * @param length the number of characters to append from the sequence.
     */
    default void append(CharSequence chars, int offset, int length)
    {
        int end = offset + length;
        for (int i = offset; i < end; i++)
            append(chars.charAt(i));
    }

    /**
     * <p>Build the completed string and reset the builder.</p>
     * @return The decoded string
     * @throws CharacterCodingException If the octets cannot be decoded or a multi-octet sequence is incomplete.
     */
    String build() throws CharacterCodingException;

    void reset();

    /**
     * @return the charset used to convert appended octets
     */
    Charset getCharset();

    /**
     * @param charset The charset
     * @return A {@link CharsetStringBuilder} suitable for the charset.
     */
    static CharsetStringBuilder forCharset(Charset charset)
    {
        Objects.requireNonNull(charset);
        if (charset == StandardCharsets.ISO_8859_1)
            return new Iso88591StringBuilder();
        if (charset == StandardCharsets.US_ASCII)
            return new UsAsciiStringBuilder();

        // Report malformed and unmappable input rather than substituting replacement characters
        return new DecoderStringBuilder(charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT));
    }

    /**
     * Every octet becomes the character of the same value, so no octet is ever rejected.
     */
    class Iso88591StringBuilder implements CharsetStringBuilder
    {
        private final StringBuilder _builder = new StringBuilder();

        @Override
        public void append(byte b)
        {
            _builder.append((char)(0xff & b));
        }

        @Override
        public void append(char c)
        {
            _builder.append(c);
        }

        @Override
        public void append(CharSequence chars, int offset, int length)
        {
            _builder.append(chars, offset, offset + length);
        }

        @Override
        public String build()
        {
            String s = _builder.toString();
            _builder.setLength(0);
            return s;
        }

        @Override
        public void reset()
        {
            _builder.setLength(0);
        }

        @Override
        public Charset getCharset()
        {
            return StandardCharsets.ISO_8859_1;
        }
    }

    class UsAsciiStringBuilder implements CharsetStringBuilder
    {
        private final StringBuilder _builder = new StringBuilder();
        private int _badOctets;

        @Override
        public void append(byte b)
        {
            if (b < 0)
                _badOctets++;
            else
                _builder.append((char)b);
        }

        @Override
        public void append(char c)
        {
            _builder.append(c);
        }

        @Override
        public String build() throws CharacterCodingException
        {
            try
            {
                if (_badOctets > 0)
                    throw new CharacterCodingException();
                return _builder.toString();
            }
            finally
            {
                reset();
            }
        }

        @Override
        public void reset()
        {
            _builder.setLength(0);
            _badOctets = 0;
        }

        @Override
        public Charset getCharset()
        {
            return StandardCharsets.US_ASCII;
        }
    }

    class DecoderStringBuilder implements CharsetStringBuilder
    {
        private final CharsetDecoder _decoder;
        private final StringBuilder _stringBuilder = new StringBuilder(32);
        private ByteBuffer _buffer = ByteBuffer.allocate(32);
        private CharacterCodingException _failure;

        public DecoderStringBuilder(CharsetDecoder charsetDecoder)
        {
            _decoder = charsetDecoder;
        }

        private void ensureSpace(int needed)
        {
            int space = _buffer.remaining();
            if (space < needed)
            {
                int position = _buffer.position();
                _buffer = ByteBuffer.wrap(Arrays.copyOf(_buffer.array(), _buffer.capacity() + needed - space + 32));
                _buffer.position(position);
            }
        }

        @Override
        public void append(byte b)
        {
            ensureSpace(1);
            _buffer.put(b);
        }

        @Override
        public void append(char c)
        {
            flushOctets();
            _stringBuilder.append(c);
        }

        @Override
        public void append(CharSequence chars, int offset, int length)
        {
            flushOctets();
            _stringBuilder.append(chars, offset, offset + length);
        }

        // A literal character ends any pending multi-octet sequence, so the octets are decoded now
        // and an incomplete sequence is remembered as the failure to report from build().
        private void flushOctets()
        {
            if (_buffer.position() == 0)
                return;
            _buffer.flip();
            try
            {
                CharBuffer decoded = _decoder.decode(_buffer);
                _stringBuilder.append(decoded);
            }
            catch (CharacterCodingException e)
            {
                if (_failure == null)
                    _failure = e;
            }
            finally
            {
                _buffer.clear();
            }
        }

        @Override
        public String build() throws CharacterCodingException
        {
            try
            {
                flushOctets();
                if (_failure != null)
                    throw _failure;
                return _stringBuilder.toString();
            }
            finally
            {
                reset();
            }
        }

        @Override
        public void reset()
        {
            _stringBuilder.setLength(0);
            _buffer.clear();
            _failure = null;
        }

        @Override
        public Charset getCharset()
        {
            return _decoder.charset();
        }
    }
}
