package com.tessera.security.permission;

import com.tessera.security.credential.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Evaluates the conditions attached to a matrix entry or override.
 * <p>
 * {@value #OWN_ONLY}: when a target resource id is given it must equal the principal id; without
 * a target id the condition holds. Condition keys this class does not know pass.
 */
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    public static final String OWN_ONLY = "own_only";

    public boolean evaluate(Map<String, Object> conditions, Principal principal, String targetResourceId) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> condition : conditions.entrySet()) {
            if (OWN_ONLY.equals(condition.getKey())) {
                if (isTrue(condition.getValue()) && targetResourceId != null
                        && !targetResourceId.equals(principal.id())) {
                    log.debug("Condition own_only failed for {} on {}", principal.id(), targetResourceId);
                    return false;
                }
            } else {
                log.debug("Unknown permission condition '{}' passes", condition.getKey());
            }
        }
        return true;
    }

    private static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(String.valueOf(value));
    }
}
