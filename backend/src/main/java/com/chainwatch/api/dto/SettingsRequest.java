package com.chainwatch.api.dto;

/**
 * PUT /api/v1/subscribers/{id}/settings body. Null fields keep their current value.
 */
public record SettingsRequest(Boolean autoSnipe, Boolean hideZeroBalances) {
}
