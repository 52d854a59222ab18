package com.clientspaces.quotaservice.domain;

import com.clientspaces.quota.BudgetKind;
import com.clientspaces.quota.OperationResult;
import com.clientspaces.quota.ProtectedOperation;
import com.clientspaces.quota.ProtectedOperationRunner;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Service;

/**
 * Sends AI assistant messages, one {@code ai-message} each.
 */
@Service
public class AssistantService {

    static final String OPERATION = "SendAssistantMessage";

    private final ProtectedOperationRunner runner;
    private final CollaborationApiClient collaborationApi;
    private final SubscriptionDirectory subscriptions;

    public AssistantService(
            ProtectedOperationRunner runner,
            CollaborationApiClient collaborationApi,
            SubscriptionDirectory subscriptions) {
        this.runner = runner;
        this.collaborationApi = collaborationApi;
        this.subscriptions = subscriptions;
    }

    public CompletableFuture<OperationResult<String>> send(String tenantId, String message) {
        ProtectedOperation operation = ProtectedOperation.of(
                tenantId, subscriptions.tierFor(tenantId), OPERATION, BudgetKind.AI_MESSAGE);
        return runner.execute(operation, () -> collaborationApi.sendAssistantMessage(tenantId, message));
    }
}
