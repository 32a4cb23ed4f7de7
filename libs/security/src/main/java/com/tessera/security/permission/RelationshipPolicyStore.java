package com.tessera.security.permission;

import java.util.List;

/**
 * Fine-grained relationship checks ("is user u a {@code viewer} of session s"), consulted after
 * the role-based evaluation denies and a target resource is known. Optional: deployments without
 * one rely on roles alone.
 */
public interface RelationshipPolicyStore {

    /**
     * @return whether the subject has {@code relation} on the resource
     * @throws RuntimeException if the store cannot answer; callers treat this as a denial
     */
    boolean check(String resourceType, String resourceId, String relation, String subjectType, String subjectId);

    void writeRelationship(Relationship relationship);

    void deleteRelationship(Relationship relationship);

    List<SubjectReference> lookupSubjects(String resourceType, String resourceId, String relation);

    record Relationship(String resourceType, String resourceId, String relation, String subjectType,
                        String subjectId) {

        public Relationship {
            if (resourceType == null || resourceId == null || relation == null || subjectType == null
                    || subjectId == null) {
                throw new IllegalArgumentException("every relationship field is required");
            }
        }
    }

    record SubjectReference(String subjectType, String subjectId) {
    }
}
