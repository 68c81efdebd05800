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
 * <p>Decodes a single percent encoded octet.</p>
 * <p>A new decoder is created for each {@code %} seen in the input and is fed the two
 * characters that follow it. Once both hex digits have been accepted, {@link #isDone()}
 * returns true and {@link #getDecodedCharacter()} yields the octet value {@code 0..255}.</p>
 * <pre>
 * PercentEncodedCharacterDecoder decoder = new PercentEncodedCharacterDecoder();
 * decoder.nextEncodedCharacter('4');
 * decoder.nextEncodedCharacter('a');
 * decoder.getDecodedCharacter(); // 0x4A
 * </pre>
 */
public class PercentEncodedCharacterDecoder
{
    private enum State
    {
        AWAITING_FIRST_DIGIT,
        AWAITING_SECOND_DIGIT,
        DONE
    }

    private State _state = State.AWAITING_FIRST_DIGIT;
    private int _decodedCharacter;

    /**
     * Feed the next character of the escape sequence.
     *
     * @param c the character following the {@code %}, or following the first hex digit
     * @return false if the character is not a hex digit, in which case the escape is malformed
     * @throws IllegalStateException if both digits have already been fed
     */
    public boolean nextEncodedCharacter(char c)
    {
        int digit = convertHexDigit(c);
        switch (_state)
        {
            case AWAITING_FIRST_DIGIT:
                if (digit < 0)
                    return false;
                _decodedCharacter = digit << 4;
                _state = State.AWAITING_SECOND_DIGIT;
                return true;

            case AWAITING_SECOND_DIGIT:
                if (digit < 0)
                    return false;
                _decodedCharacter += digit;
                _state = State.DONE;
                return true;

            default:
                throw new IllegalStateException(_state.toString());
        }
    }

    /**
     * @return true once two hex digits have been accepted
     */
    public boolean isDone()
    {
        return _state == State.DONE;
    }

    /**
     * @return the decoded octet, {@code 0..255}
     * @throws IllegalStateException if the decoder is not {@link #isDone() done}
     */
    public int getDecodedCharacter()
    {
        if (_state != State.DONE)
            throw new IllegalStateException(_state.toString());
        return _decodedCharacter;
    }

    /**
     * @param c a character
     * @return the value {@code 0..15} of the hex digit, or -1 if the character is not one of {@code 0-9 a-f A-F}
     */
    public static int convertHexDigit(char c)
    {
        if (c >= '0' && c <= '9')
            return c - '0';
        if (c >= 'a' && c <= 'f')
            return c - 'a' + 10;
        if (c >= 'A' && c <= 'F')
            return c - 'A' + 10;
        return -1;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,%d}", getClass().getSimpleName(), hashCode(), _state, _decodedCharacter);
    }
}
