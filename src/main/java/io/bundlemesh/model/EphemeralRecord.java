package io.bundlemesh.model;

public record EphemeralRecord(
        String recordId,
        String parentId,
        String kind,
        String body,
        long purgeAtMs,
        long createdAtMs
) {
}
