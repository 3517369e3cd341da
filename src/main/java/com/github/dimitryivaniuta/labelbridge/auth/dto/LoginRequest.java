package com.github.dimitryivaniuta.labelbridge.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank @Size(max = 255) String identifier,
        @NotBlank @Size(max = 1024) String secret
) {
    @Override
    public String toString() {
        return "LoginRequest[identifier=" + identifier + "]";
    }
}
