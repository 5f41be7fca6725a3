package com.github.dominikschlosser.federation.dynamicgroup;

import com.github.dominikschlosser.federation.trust.FederationConfiguration;
import com.github.dominikschlosser.federation.trust.TrustRegistry;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Computes dynamic group membership of a non-human resource. The result is the union of the group
 * ids of every rule that matches. Evaluation has no side effects; applying the membership is up to
 * the caller.
 */
public class DynamicGroupEvaluator {

    private final TrustRegistry trustRegistry;

    public DynamicGroupEvaluator(TrustRegistry trustRegistry) {
        this.trustRegistry = trustRegistry;
    }

    public SortedSet<String> evaluate(ResourceIdentity resource) {
        return evaluate(trustRegistry.snapshot(), resource);
    }

    public SortedSet<String> evaluate(FederationConfiguration config, ResourceIdentity resource) {
        SortedSet<String> groups = new TreeSet<>();
        for (DynamicGroupRule rule : config.getDynamicGroupRules()) {
            if (rule.matches(resource)) {
                groups.add(rule.getGroupId());
            }
        }
        return Collections.unmodifiableSortedSet(groups);
    }
}
