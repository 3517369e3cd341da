package com.github.dimitryivaniuta.labelbridge.tenancy.dto;

import com.github.dimitryivaniuta.labelbridge.authz.Role;
import jakarta.validation.constraints.NotNull;

/**
 * @param projectId narrows the binding to one project; null for an organization-wide binding
 */
public record AssignRoleRequest(@NotNull Role role, Long projectId) {}
