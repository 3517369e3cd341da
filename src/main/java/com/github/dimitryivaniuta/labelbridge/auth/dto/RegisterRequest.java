package com.github.dimitryivaniuta.labelbridge.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param organizationName when present, an organization is created with the registrant as owner
 */
public record RegisterRequest(
        @NotBlank @Email @Size(max = 255) String identifier,
        @NotBlank @Size(max = 255) String displayName,
        @NotBlank @Size(max = 1024) String secret,
        @Size(max = 255) String organizationName
) {
    @Override
    public String toString() {
        return "RegisterRequest[identifier=" + identifier + ", organizationName=" + organizationName + "]";
    }
}
