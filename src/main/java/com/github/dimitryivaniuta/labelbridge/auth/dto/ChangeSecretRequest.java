package com.github.dimitryivaniuta.labelbridge.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangeSecretRequest(
        @NotBlank @Size(max = 1024) String currentSecret,
        @NotBlank @Size(max = 1024) String newSecret
) {
    @Override
    public String toString() {
        return "ChangeSecretRequest[***]";
    }
}
