package com.lodestar.core.store;

import com.lodestar.core.model.ArtifactStatus;
import com.lodestar.core.model.ArtifactType;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.StructuredArtifact;
import com.lodestar.core.model.SupersessionLink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Append-only store of structured artifacts.
 * <p>
 * Artifacts live in an arena in creation order, indexed by ID. A change is recorded as a
 * new artifact plus a {@link SupersessionLink}; nothing is ever updated or removed, and a
 * link once added is never cleared. Instances are immutable: {@link #append} and
 * {@link #supersede} return a new store and leave the receiver untouched.
 * <p>
 * Views returned by queries carry {@code supersededBy} from the link table; the stored
 * originals do not.
 */
public final class ArtifactStore {

    private static final Pattern NUMERIC_SUFFIX = Pattern.compile("-(\\d+)$");

    private static final Comparator<StructuredArtifact> BY_ID = Comparator.comparing(StructuredArtifact::id);

    private final List<StructuredArtifact> arena;
    private final Map<String, Integer> index;
    private final Map<String, SupersessionLink> links;

    private ArtifactStore(List<StructuredArtifact> arena, Map<String, SupersessionLink> links) {
        this.arena = List.copyOf(arena);
        this.index = new HashMap<>();
        for (int i = 0; i < this.arena.size(); i++) {
            var previous = index.put(this.arena.get(i).id(), i);
            if (previous != null) {
                throw new IllegalStateException("Duplicate artifact ID " + this.arena.get(i).id());
            }
        }
        this.links = Collections.unmodifiableMap(new LinkedHashMap<>(links));
    }

    public static ArtifactStore empty() {
        return new ArtifactStore(List.of(), Map.of());
    }

    /**
     * Rebuilds a store from persisted artifacts and links, checking that every link
     * points at known artifacts and that no artifact was superseded twice.
     */
    public static ArtifactStore of(Collection<StructuredArtifact> artifacts, Collection<SupersessionLink> supersessions) {
        var store = new ArtifactStore(new ArrayList<>(artifacts), Map.of());
        var linkMap = new LinkedHashMap<String, SupersessionLink>();
        for (SupersessionLink link : supersessions) {
            store.require(link.supersededId());
            store.require(link.supersedingId());
            if (linkMap.putIfAbsent(link.supersededId(), link) != null) {
                throw new IllegalStateException("Artifact " + link.supersededId() + " superseded more than once");
            }
        }
        return new ArtifactStore(store.arena, linkMap);
    }

    public ArtifactStore append(StructuredArtifact artifact) {
        if (index.containsKey(artifact.id())) {
            throw new IllegalArgumentException("Artifact " + artifact.id() + " already exists; supersede it instead");
        }
        if (artifact.isSuperseded()) {
            throw new IllegalArgumentException("Cannot append " + artifact.id() + " already marked superseded");
        }
        var grown = new ArrayList<>(arena);
        grown.add(artifact);
        return new ArtifactStore(grown, links);
    }

    /**
     * Appends {@code replacement} and links {@code supersededId} to it.
     *
     * @throws IllegalStateException if the target is already superseded
     */
    public ArtifactStore supersede(String supersededId, StructuredArtifact replacement, PhaseId phase) {
        StructuredArtifact target = original(supersededId)
                .orElseThrow(() -> new NoSuchElementException("Unknown artifact " + supersededId));
        if (links.containsKey(supersededId)) {
            throw new IllegalStateException("Artifact " + supersededId + " is already superseded by "
                    + links.get(supersededId).supersedingId());
        }
        if (target.type() != replacement.type()) {
            throw new IllegalArgumentException("Cannot supersede " + target.type() + " " + supersededId
                    + " with " + replacement.type());
        }
        ArtifactStore appended = append(replacement);
        var grownLinks = new LinkedHashMap<>(links);
        grownLinks.put(supersededId, new SupersessionLink(supersededId, replacement.id(), phase, Instant.now()));
        return new ArtifactStore(appended.arena, grownLinks);
    }

    // ── Queries ──────────────────────────────────────────────────────

    public boolean contains(String id) {
        return index.containsKey(id);
    }

    public Optional<StructuredArtifact> find(String id) {
        return original(id).map(this::view);
    }

    public StructuredArtifact require(String id) {
        return find(id).orElseThrow(() -> new NoSuchElementException("Unknown artifact " + id));
    }

    public boolean isSuperseded(String id) {
        return links.containsKey(id);
    }

    /** Active (non-superseded) artifacts of a type, sorted by ID. */
    public List<StructuredArtifact> current(ArtifactType type) {
        return arena.stream()
                .filter(a -> a.type() == type && !links.containsKey(a.id()))
                .sorted(BY_ID)
                .toList();
    }

    /** Every artifact of a type ever appended, superseded ones included, sorted by ID. */
    public List<StructuredArtifact> history(ArtifactType type) {
        return arena.stream()
                .filter(a -> a.type() == type)
                .map(this::view)
                .sorted(BY_ID)
                .toList();
    }

    public List<StructuredArtifact> superseded(ArtifactType type) {
        return history(type).stream().filter(StructuredArtifact::isSuperseded).toList();
    }

    public List<StructuredArtifact> currentFromPhase(PhaseId phase) {
        return arena.stream()
                .filter(a -> a.sourcePhase() == phase && !links.containsKey(a.id()))
                .sorted(BY_ID)
                .toList();
    }

    public List<StructuredArtifact> byStatus(ArtifactType type, ArtifactStatus status) {
        return history(type).stream().filter(a -> status(a.id()) == status).toList();
    }

    /**
     * Status derived from links: a capability is covered when an active decision serves
     * it, anything an active work item implements is implemented.
     */
    public ArtifactStatus status(String id) {
        StructuredArtifact artifact = require(id);
        if (links.containsKey(id)) {
            return ArtifactStatus.SUPERSEDED;
        }
        boolean implemented = current(ArtifactType.WORK_ITEM).stream().anyMatch(w -> w.serves().contains(id));
        return switch (artifact.type()) {
            case CAPABILITY -> implemented ? ArtifactStatus.IMPLEMENTED
                    : coveringDecisions(id).isEmpty() ? ArtifactStatus.UNCOVERED : ArtifactStatus.COVERED;
            case DECISION -> implemented ? ArtifactStatus.IMPLEMENTED : ArtifactStatus.ACTIVE;
            case ENTITY, WORK_ITEM -> ArtifactStatus.ACTIVE;
        };
    }

    public List<StructuredArtifact> coveringDecisions(String capabilityId) {
        return current(ArtifactType.DECISION).stream().filter(d -> d.serves().contains(capabilityId)).toList();
    }

    public List<StructuredArtifact> entitiesReferencedBy(String decisionId) {
        return current(ArtifactType.ENTITY).stream().filter(e -> e.serves().contains(decisionId)).toList();
    }

    /**
     * Next free ID for a type, e.g. {@code CAP-F-004} or {@code WI-012}.
     * Superseded artifacts keep their numbers, so IDs are never reused.
     */
    public String nextId(ArtifactType type, String infix) {
        String prefix = infix == null || infix.isBlank()
                ? type.idPrefix() + "-"
                : type.idPrefix() + "-" + infix + "-";
        int max = 0;
        for (StructuredArtifact a : arena) {
            if (a.id().startsWith(prefix) && a.id().length() > prefix.length()
                    && Character.isDigit(a.id().charAt(prefix.length()))) {
                Matcher m = NUMERIC_SUFFIX.matcher(a.id());
                if (m.find()) {
                    max = Math.max(max, Integer.parseInt(m.group(1)));
                }
            }
        }
        return prefix + String.format("%03d", max + 1);
    }

    /** Stored originals in creation order, for persistence. */
    public List<StructuredArtifact> artifacts() {
        return arena;
    }

    public List<SupersessionLink> supersessions() {
        return List.copyOf(links.values());
    }

    public int size() {
        return arena.size();
    }

    private Optional<StructuredArtifact> original(String id) {
        Integer slot = index.get(id);
        return slot == null ? Optional.empty() : Optional.of(arena.get(slot));
    }

    private StructuredArtifact view(StructuredArtifact stored) {
        SupersessionLink link = links.get(stored.id());
        return link == null ? stored : stored.withSupersededBy(link.supersedingId());
    }
}
