package com.clientspaces.quotaservice.api;

import com.clientspaces.quota.OperationResult;
import com.clientspaces.quotaservice.domain.ClientSpace;
import com.clientspaces.quotaservice.domain.ClientSpaceRegistry;
import com.clientspaces.quotaservice.domain.ClientSpaceService;
import com.clientspaces.quotaservice.infrastructure.web.OperationFailedException;
import jakarta.validation.Valid;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Client spaces of a tenant. Creation is quota-checked and may be answered after upstream
 * retries, so it completes asynchronously.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/client-spaces")
public class ClientSpaceController {

    private final ClientSpaceService clientSpaces;
    private final ClientSpaceRegistry registry;

    public ClientSpaceController(ClientSpaceService clientSpaces, ClientSpaceRegistry registry) {
        this.clientSpaces = clientSpaces;
        this.registry = registry;
    }

    @PostMapping
    public CompletableFuture<ResponseEntity<ClientSpace>> create(
            @PathVariable String tenantId, @Valid @RequestBody CreateClientSpaceRequest request) {
        return clientSpaces.create(tenantId, request.name())
                .thenApply(result -> ResponseEntity.status(HttpStatus.CREATED).body(valueOrThrow(result)));
    }

    @GetMapping
    public List<ClientSpace> list(@PathVariable String tenantId) {
        return registry.list(tenantId);
    }

    static <T> T valueOrThrow(OperationResult<T> result) {
        if (!result.isSuccess()) {
            throw new OperationFailedException(result.error());
        }
        return result.value();
    }
}
