/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.status;

import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class StatusMessageMarshallerTest {

    @ParameterizedTest
    @ValueSource(strings = { "", "hello", "Connection refused: localhost/127.0.0.1:8080", "a b\tc" })
    @DisplayName("Printable ASCII is left alone and control characters are escaped")
    void printableAsciiUnchanged(String message) {
        String expected = message.replace("\t", "%09");
        assertEquals(expected, StatusMessageMarshaller.marshall(message));
    }

    @Test
    @DisplayName("Whole unreserved range passes through without copying")
    void unreservedRangeUnchanged() {
        StringBuilder builder = new StringBuilder();
        IntStream.rangeClosed(0x20, 0x7E).filter(c -> c != '%').forEach(c -> builder.append((char) c));
        String message = builder.toString();

        assertSame(message, StatusMessageMarshaller.marshall(message));
    }

    static Stream<Arguments> reservedBytes() {
        return Stream.of(
                Arguments.of("%", "%25"),
                Arguments.of("100%", "100%25"),
                Arguments.of("line\nbreak", "line%0Abreak"),
                Arguments.of("\u0000", "%00"),
                Arguments.of("\u007f", "%7F"),
                Arguments.of("\u00fc", "%C3%BC"),
                Arguments.of("\u20ac 5", "%E2%82%AC 5"));
    }

    @ParameterizedTest
    @MethodSource("reservedBytes")
    @DisplayName("Reserved bytes are escaped with upper case hex")
    void escapesReservedBytes(String message, String expected) {
        assertEquals(expected, StatusMessageMarshaller.marshall(message));
    }

    @ParameterizedTest
    @ValueSource(strings = { "plain", "50% off", "tab\there", "café", "日本語", "emoji 😀", "%%%" })
    @DisplayName("Unmarshalling reverses marshalling")
    void roundTrip(String message) {
        assertEquals(message, StatusMessageMarshaller.unmarshall(StatusMessageMarshaller.marshall(message)));
    }

    @Test
    @DisplayName("Lower case hex digits are accepted")
    void lowerCaseHex() {
        assertEquals("ü", StatusMessageMarshaller.unmarshall("%c3%bc"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "%", "%4", "%zz", "100%", "50%!", "%G1" })
    @DisplayName("Malformed escapes are kept verbatim")
    void malformedEscapesKept(String message) {
        assertEquals(message, StatusMessageMarshaller.unmarshall(message));
    }

    @Test
    @DisplayName("Malformed escape next to a valid one")
    void mixedEscapes() {
        assertEquals("%zz%", StatusMessageMarshaller.unmarshall("%zz%25"));
    }
}
