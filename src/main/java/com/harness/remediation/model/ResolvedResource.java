package com.harness.remediation.model;

public record ResolvedResource(
    String identifier,
    String currentName
) {}
