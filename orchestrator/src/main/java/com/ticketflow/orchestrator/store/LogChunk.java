package com.ticketflow.orchestrator.store;

import java.nio.charset.StandardCharsets;

/**
 * A slice of a run log.
 *
 * @param bytes      raw UTF-8 bytes, never ending inside a multi-byte sequence
 * @param offset     byte offset the read started at
 * @param nextOffset offset to pass to the next read; equals {@code offset} when nothing new was available
 */
public record LogChunk(byte[] bytes, long offset, long nextOffset) {

    public static LogChunk empty(long offset) {
        return new LogChunk(new byte[0], offset, offset);
    }

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }
}
