package com.clientspaces.quotaservice.domain;

import com.clientspaces.quota.ResourceCountStore;
import com.clientspaces.quota.ResourceKind;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.springframework.stereotype.Component;

/**
 * Client spaces per tenant. Also answers resource counts for the plan's client-space cap.
 */
@Component
public class ClientSpaceRegistry implements ResourceCountStore {

    private final Map<String, Queue<ClientSpace>> spacesByTenant = new ConcurrentHashMap<>();
    private final Clock clock;

    public ClientSpaceRegistry(Clock clock) {
        this.clock = clock;
    }

    public ClientSpace register(String tenantId, String name, ProvisionedSite site) {
        ClientSpace space = new ClientSpace(
                UUID.randomUUID().toString(), tenantId, name, site.siteId(), site.url(), clock.instant());
        spacesByTenant.computeIfAbsent(tenantId, id -> new ConcurrentLinkedQueue<>()).add(space);
        return space;
    }

    public List<ClientSpace> list(String tenantId) {
        Queue<ClientSpace> spaces = spacesByTenant.get(tenantId);
        return spaces == null ? List.of() : List.copyOf(spaces);
    }

    @Override
    public long countActive(String tenantId, ResourceKind kind) {
        if (!ResourceKind.CLIENT_SPACE.equals(kind)) {
            return 0;
        }
        Queue<ClientSpace> spaces = spacesByTenant.get(tenantId);
        return spaces == null ? 0 : spaces.size();
    }
}
