package com.clientspaces.quotaservice.domain;

import com.clientspaces.quota.BudgetKind;
import com.clientspaces.quota.OperationResult;
import com.clientspaces.quota.ProtectedOperation;
import com.clientspaces.quota.ProtectedOperationRunner;
import com.clientspaces.quota.ResourceKind;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Service;

/**
 * Creates client spaces. Each creation provisions a site upstream, counts against the tenant's
 * client-space cap and costs one {@code api-call}.
 */
@Service
public class ClientSpaceService {

    static final String OPERATION = "CreateClientSpace";

    private final ProtectedOperationRunner runner;
    private final CollaborationApiClient collaborationApi;
    private final ClientSpaceRegistry registry;
    private final SubscriptionDirectory subscriptions;

    public ClientSpaceService(
            ProtectedOperationRunner runner,
            CollaborationApiClient collaborationApi,
            ClientSpaceRegistry registry,
            SubscriptionDirectory subscriptions) {
        this.runner = runner;
        this.collaborationApi = collaborationApi;
        this.registry = registry;
        this.subscriptions = subscriptions;
    }

    public CompletableFuture<OperationResult<ClientSpace>> create(String tenantId, String name) {
        ProtectedOperation operation = ProtectedOperation
                .of(tenantId, subscriptions.tierFor(tenantId), OPERATION, BudgetKind.API_CALL)
                .creating(ResourceKind.CLIENT_SPACE);
        return runner.execute(operation, () -> collaborationApi.createSite(tenantId, name))
                .thenApply(result -> result.map(site -> registry.register(tenantId, name, site)));
    }
}
