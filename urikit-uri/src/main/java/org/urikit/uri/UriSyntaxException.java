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

/**
 * Thrown when a string is not a valid URI reference.
 * The {@link Violation} says which part of the grammar was broken.
 */
public class UriSyntaxException extends IllegalArgumentException
{
    /**
     * The ways in which a URI reference can fail to parse.
     */
    public enum Violation
    {
        /**
         * Empty scheme before the {@code :}, or a scheme character outside {@code ALPHA *( ALPHA / DIGIT / "+" / "-" / "." )}
         */
        ILLEGAL_SCHEME("Illegal scheme"),
        /**
         * A user information character outside its set that is not a valid escape
         */
        ILLEGAL_USER_INFO("Illegal user info"),
        /**
         * A registered name character outside its set that is not a valid escape
         */
        ILLEGAL_HOST("Illegal host"),
        /**
         * A path character outside {@code pchar} and {@code /}, e.g. {@code /foo[bar}
         */
        ILLEGAL_PATH("Illegal path"),
        /**
         * A query character outside its set
         */
        ILLEGAL_QUERY("Illegal query"),
        /**
         * A fragment character outside its set
         */
        ILLEGAL_FRAGMENT("Illegal fragment"),
        /**
         * A {@code %} not followed by two hex digits, e.g. {@code %X@} or a trailing {@code %4}
         */
        BAD_PERCENT_ENCODING("Bad percent encoding"),
        /**
         * A port that is not all decimal digits or is larger than 65535
         */
        BAD_PORT("Bad port"),
        /**
         * A malformed {@code IPvFuture}, an unterminated {@code [}, or characters other than {@code :} after the {@code ]}
         */
        BAD_IP_LITERAL("Bad IP literal"),
        /**
         * Percent decoded octets that are not valid in the configured charset
         */
        MALFORMED_ENCODING("Malformed encoding");

        private final String _message;

        Violation(String message)
        {
            _message = message;
        }

        public String getMessage()
        {
            return _message;
        }
    }

    private final Violation _violation;
    private final String _input;

    public UriSyntaxException(Violation violation, String input)
    {
        this(violation, input, null);
    }

    public UriSyntaxException(Violation violation, String input, Throwable cause)
    {
        super(violation.getMessage() + " in " + input, cause);
        _violation = violation;
        _input = input;
    }

    public Violation getViolation()
    {
        return _violation;
    }

    /**
     * @return the complete string that failed to parse
     */
    public String getInput()
    {
        return _input;
    }
}
