package com.clientspaces.quotaservice.api;

import com.clientspaces.quotaservice.domain.AssistantService;
import jakarta.validation.Valid;
import java.util.concurrent.CompletableFuture;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/assistant")
public class AssistantController {

    private final AssistantService assistant;

    public AssistantController(AssistantService assistant) {
        this.assistant = assistant;
    }

    @PostMapping("/messages")
    public CompletableFuture<AssistantMessageResponse> send(
            @PathVariable String tenantId, @Valid @RequestBody AssistantMessageRequest request) {
        return assistant.send(tenantId, request.message())
                .thenApply(result -> new AssistantMessageResponse(ClientSpaceController.valueOrThrow(result)));
    }
}
