package com.clientspaces.quotaservice.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateClientSpaceRequest(@NotBlank @Size(max = 120) String name) {}
