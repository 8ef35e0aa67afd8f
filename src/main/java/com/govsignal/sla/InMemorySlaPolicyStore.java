package com.govsignal.sla;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
@ConditionalOnProperty(prefix = "governance.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemorySlaPolicyStore implements SlaPolicyStore {

    private final CopyOnWriteArrayList<SlaPolicy> policies = new CopyOnWriteArrayList<>();

    @Override
    public List<SlaPolicy> findActive() {
        return policies.stream().filter(SlaPolicy::active).toList();
    }

    @Override
    public void save(SlaPolicy policy) {
        policies.add(policy);
    }

    public void clear() {
        policies.clear();
    }
}
