package com.ticketflow.orchestrator.api.dto;

import com.ticketflow.orchestrator.store.LogChunk;

/**
 * Response body for GET /runs/{id}/log. Pass {@code nextOffset} as the next {@code offset}.
 */
public record LogChunkResponse(String content, long offset, long nextOffset) {

    public static LogChunkResponse from(LogChunk chunk) {
        return new LogChunkResponse(chunk.text(), chunk.offset(), chunk.nextOffset());
    }
}
