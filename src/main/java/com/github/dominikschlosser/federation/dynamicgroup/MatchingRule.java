package com.github.dominikschlosser.federation.dynamicgroup;

import java.util.Map;

/**
 * Boolean predicate over resource scope attributes. Only equality, set membership and their
 * {@code ALL}/{@code ANY} combinations exist; there is no way to express anything else.
 */
public interface MatchingRule {

    boolean matches(Map<String, String> attributes);
}
