package com.chainwatch.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * PUT /api/v1/subscribers/{id}/watch-list body. Replaces the whole list; an empty list clears it.
 */
public record WatchListRequest(
        @NotNull(message = "INVALID_ADDRESS")
        @Size(max = 100, message = "WATCH_LIST_TOO_LONG")
        List<String> addresses
) {
}
