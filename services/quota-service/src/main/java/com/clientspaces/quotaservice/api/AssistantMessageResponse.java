package com.clientspaces.quotaservice.api;

public record AssistantMessageResponse(String reply) {}
