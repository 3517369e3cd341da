package com.github.dimitryivaniuta.labelbridge.authz;

import java.util.Objects;

/**
 * Hierarchical address of a tenant resource: organization, optionally narrowed to a project and
 * then to a dataset. A dataset always implies a project.
 */
public record ResourcePath(Long organizationId, Long projectId, Long datasetId) {

    public ResourcePath {
        Objects.requireNonNull(organizationId, "organizationId must not be null");
        if (datasetId != null && projectId == null) {
            throw new IllegalArgumentException("datasetId requires projectId");
        }
    }

    public static ResourcePath organization(Long organizationId) {
        return new ResourcePath(organizationId, null, null);
    }

    public static ResourcePath project(Long organizationId, Long projectId) {
        return new ResourcePath(organizationId, Objects.requireNonNull(projectId), null);
    }

    public static ResourcePath dataset(Long organizationId, Long projectId, Long datasetId) {
        return new ResourcePath(organizationId, Objects.requireNonNull(projectId), Objects.requireNonNull(datasetId));
    }

    public boolean targetsProject() {
        return projectId != null;
    }

    /** e.g. {@code org:1/project:7/dataset:3}; used in audit rows and logs. */
    public String ref() {
        StringBuilder sb = new StringBuilder("org:").append(organizationId);
        if (projectId != null) sb.append("/project:").append(projectId);
        if (datasetId != null) sb.append("/dataset:").append(datasetId);
        return sb.toString();
    }
}
