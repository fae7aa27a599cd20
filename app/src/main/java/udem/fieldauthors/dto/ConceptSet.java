package udem.fieldauthors.dto;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Concept ids of a subtree: the root plus every descendant. Immutable once built.
 */
public final class ConceptSet {
    private final String rootId;
    private final Set<String> ids;

    public ConceptSet(String rootId, Collection<String> descendants) {
        if (rootId == null || rootId.isBlank()) {
            throw new IllegalArgumentException("Root concept id is required");
        }
        var all = new HashSet<String>(descendants);
        all.add(rootId);
        this.rootId = rootId;
        this.ids = Set.copyOf(all);
    }

    public static ConceptSet of(String rootId, String... descendants) {
        return new ConceptSet(rootId, Arrays.asList(descendants));
    }

    public String rootId() {
        return rootId;
    }

    public boolean contains(String conceptId) {
        return conceptId != null && ids.contains(conceptId);
    }

    public boolean contains(TopicScore topic) {
        return topic != null && contains(topic.id());
    }

    public int size() {
        return ids.size();
    }

    public Set<String> ids() {
        return ids;
    }

    @Override
    public String toString() {
        return "ConceptSet{root=" + rootId + ", size=" + ids.size() + '}';
    }
}
