package com.scidbshim.abi;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fixed-capacity, caller-supplied buffer receiving error text from {@link ShimClientApi}.
 *
 * <p>Text is stored as UTF-8 and cut to {@code capacity - 1} bytes, the room left by a C
 * string terminator. A cut never splits a multi-byte character.
 */
public final class ErrorBuffer {
    public static final int DEFAULT_CAPACITY = 4096;

    private final byte[] bytes;
    private int length;

    public ErrorBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public ErrorBuffer(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("error buffer capacity must be at least 2 bytes: " + capacity);
        }
        this.bytes = new byte[capacity];
    }

    /**
     * Replace the buffer contents, truncating if needed.
     *
     * @param message text to store, null clears the buffer
     */
    public void write(String message) {
        clear();
        if (message == null || message.isEmpty()) {
            return;
        }
        byte[] encoded = message.getBytes(StandardCharsets.UTF_8);
        int n = Math.min(encoded.length, bytes.length - 1);
        if (n < encoded.length) {
            // back up to the first byte of the character that would be cut
            while (n > 0 && (encoded[n] & 0xC0) == 0x80) {
                n--;
            }
        }
        System.arraycopy(encoded, 0, bytes, 0, n);
        length = n;
    }

    public void clear() {
        Arrays.fill(bytes, 0, length, (byte) 0);
        length = 0;
    }

    public int capacity() {
        return bytes.length;
    }

    /**
     * @return number of text bytes stored
     */
    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    @Override
    public String toString() {
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }
}
