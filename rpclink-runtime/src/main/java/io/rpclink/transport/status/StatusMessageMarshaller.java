/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.rpclink.transport.status;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Percent-encodes status messages for transport in a trailer.
 *
 * <p>Bytes {@code 0x20-0x24} and {@code 0x26-0x7E} of the UTF-8 encoding travel unescaped;
 * every other byte, {@code '%'} included, becomes {@code %XX} with upper case hex digits.
 * Decoding never fails: a {@code '%'} that does not start a valid escape is kept as is.</p>
 */
public final class StatusMessageMarshaller {

    private static final byte[] HEX = "0123456789ABCDEF".getBytes(StandardCharsets.US_ASCII);

    private StatusMessageMarshaller() {
    }

    public static String marshall(String message) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        int firstEscaped = firstByteNeedingEscape(bytes);
        if (firstEscaped < 0) {
            return message;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length + 16);
        out.write(bytes, 0, firstEscaped);
        for (int i = firstEscaped; i < bytes.length; i++) {
            byte b = bytes[i];
            if (isUnreserved(b)) {
                out.write(b);
            }
            else {
                out.write('%');
                out.write(HEX[(b >> 4) & 0xF]);
                out.write(HEX[b & 0xF]);
            }
        }
        return out.toString(StandardCharsets.US_ASCII);
    }

    public static String unmarshall(String message) {
        if (message.indexOf('%') < 0) {
            return message;
        }

        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
        int i = 0;
        while (i < bytes.length) {
            byte b = bytes[i];
            if (b == '%' && i + 2 < bytes.length) {
                int high = Character.digit(bytes[i + 1], 16);
                int low = Character.digit(bytes[i + 2], 16);
                if (high >= 0 && low >= 0) {
                    out.write((high << 4) | low);
                    i += 3;
                    continue;
                }
            }
            out.write(b);
            i++;
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static int firstByteNeedingEscape(byte[] bytes) {
        for (int i = 0; i < bytes.length; i++) {
            if (!isUnreserved(bytes[i])) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isUnreserved(byte b) {
        return b >= 0x20 && b <= 0x7E && b != '%';
    }
}
