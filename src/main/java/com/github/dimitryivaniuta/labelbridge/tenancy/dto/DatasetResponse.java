package com.github.dimitryivaniuta.labelbridge.tenancy.dto;

import com.github.dimitryivaniuta.labelbridge.tenancy.Dataset;

import java.time.Instant;

public record DatasetResponse(Long id, Long projectId, String name, long itemCount, Instant createdAt) {

    public static DatasetResponse from(Dataset d, Long projectId) {
        return new DatasetResponse(d.getId(), projectId, d.getName(), d.getItemCount(), d.getCreatedAt());
    }
}
