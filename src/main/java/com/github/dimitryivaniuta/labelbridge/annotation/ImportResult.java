package com.github.dimitryivaniuta.labelbridge.annotation;

public record ImportResult(Long datasetId, int submitted, int imported) {}
