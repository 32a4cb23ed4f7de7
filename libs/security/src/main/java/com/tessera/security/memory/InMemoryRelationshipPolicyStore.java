package com.tessera.security.memory;

import com.tessera.security.permission.RelationshipPolicyStore;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RelationshipPolicyStore} holding direct relationships only; there is no rewriting or
 * inheritance between relations.
 */
public final class InMemoryRelationshipPolicyStore implements RelationshipPolicyStore {

    private final Set<Relationship> relationships = ConcurrentHashMap.newKeySet();

    @Override
    public boolean check(String resourceType, String resourceId, String relation, String subjectType,
                         String subjectId) {
        return relationships.contains(new Relationship(resourceType, resourceId, relation, subjectType, subjectId));
    }

    @Override
    public void writeRelationship(Relationship relationship) {
        relationships.add(relationship);
    }

    @Override
    public void deleteRelationship(Relationship relationship) {
        relationships.remove(relationship);
    }

    @Override
    public List<SubjectReference> lookupSubjects(String resourceType, String resourceId, String relation) {
        return relationships.stream()
                .filter(r -> r.resourceType().equals(resourceType) && r.resourceId().equals(resourceId)
                        && r.relation().equals(relation))
                .map(r -> new SubjectReference(r.subjectType(), r.subjectId()))
                .toList();
    }
}
