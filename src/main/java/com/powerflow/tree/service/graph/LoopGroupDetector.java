package com.powerflow.tree.service.graph;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.AlternateParent;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.ConnectionType;
import com.powerflow.tree.model.EquipmentNode;
import com.powerflow.tree.model.LoopGroupData;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.ConnectionRelation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Collapses ring buses and dual-source transfer switches into one representative node.
 *
 * Detection works on names:
 * 1. Ring bus series such as "CDS-01R-A" and "CDS-01R-B" share the key CDS-01R-RING
 * 2. Ring members such as "RING-A-1" and "RING-A-3" share the key RING-A
 * 3. Transfer switches named with the ATS token that collected more than one source
 *
 * Members stay in the dataset, marked as absorbed, so spans and edges can still resolve them.
 */
@Service
@Slf4j
public class LoopGroupDetector {

    public static final String LOOP_ID_PREFIX = "loop-";
    public static final String RING_BUS_TYPE = "RING BUS";

    private static final Pattern CDS_RING = Pattern.compile("cds[^a-z0-9]*(\\d+)[^a-z]*r");
    private static final Pattern NAMED_RING = Pattern.compile("(^|[^a-z])ring[^a-z0-9]*([a-z]+|\\d+)[^a-z0-9]+\\d+");
    private static final Pattern ATS_TOKEN = Pattern.compile("(^|[^a-z])ats([^a-z]|$)");

    /**
     * Detect loop groups, append their representatives and rewire references to members.
     *
     * @return representatives first, then every input node in its original order
     */
    public List<EquipmentNode> detect(List<EquipmentNode> equipment, ConnectionMap connectionMap,
                                      String rootId, LayoutDiagnostics diagnostics) {
        Map<String, List<EquipmentNode>> groups = groupByKey(equipment);

        List<EquipmentNode> representatives = new ArrayList<>();
        Map<String, String> replacements = new HashMap<>();

        for (Map.Entry<String, List<EquipmentNode>> group : groups.entrySet()) {
            if (group.getValue().size() < 2) continue;

            EquipmentNode representative = createRepresentative(group.getKey(), group.getValue(), connectionMap);
            representatives.add(representative);
            for (EquipmentNode member : group.getValue()) {
                member.setAbsorbedBy(representative.getId());
                replacements.put(member.getId(), representative.getId());
            }

            log.info("Loop group {} created from {} members at level {} ({})", representative.getName(),
                    group.getValue().size(), representative.getLevel(), representative.getBranch());
            diagnostics.info(DiagnosticCode.LOOP_GROUP_CREATED, representative.getId(),
                    "Collapsed " + group.getValue().size() + " members into " + representative.getName());
        }

        List<EquipmentNode> processed = new ArrayList<>(representatives);
        processed.addAll(equipment);

        if (!replacements.isEmpty()) {
            rewire(processed, replacements);
        }
        recomputeLevels(processed, rootId);

        log.info("Processed {} equipment items ({} loop groups), rewired {} member references",
                processed.size(), representatives.size(), replacements.size());
        return processed;
    }

    /**
     * Group key for a piece of equipment, or null when it belongs to no loop.
     */
    String groupKeyOf(EquipmentNode node) {
        String name = node.getName() == null ? "" : node.getName().toLowerCase(Locale.ROOT);
        String groupKey = null;

        Matcher cds = CDS_RING.matcher(name);
        if (cds.find()) {
            groupKey = "CDS-" + cds.group(1) + "R-RING";
        } else {
            Matcher ring = NAMED_RING.matcher(name);
            if (ring.find()) {
                groupKey = "RING-" + ring.group(2).toUpperCase(Locale.ROOT);
            }
        }

        if (ATS_TOKEN.matcher(name).find() && node.getSources().size() > 1) {
            groupKey = node.getName() + "-DUAL-SOURCE";
        }
        return groupKey;
    }

    // ========================= GROUPING =========================

    private Map<String, List<EquipmentNode>> groupByKey(List<EquipmentNode> equipment) {
        Map<String, List<EquipmentNode>> groups = new LinkedHashMap<>();
        for (EquipmentNode node : equipment) {
            if (node.isLoopGroup() || node.isAbsorbed()) continue;
            String key = groupKeyOf(node);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(node);
            }
        }
        return groups;
    }

    private EquipmentNode createRepresentative(String groupKey, List<EquipmentNode> members,
                                               ConnectionMap connectionMap) {
        List<EquipmentNode> sorted = members.stream()
                .sorted(Comparator.comparing(EquipmentNode::getName).thenComparing(EquipmentNode::getId))
                .collect(Collectors.toList());
        EquipmentNode start = sorted.get(0);
        EquipmentNode end = sorted.get(sorted.size() - 1);

        Set<String> sources = new LinkedHashSet<>();
        members.forEach(member -> sources.addAll(member.getSources()));

        EquipmentNode closest = closestToRoot(members);
        String loopParentId = closest.getParentId() != null
                ? closest.getParentId()
                : closest.getParentIds().stream().findFirst().orElse(null);

        Branch branch = resolveBranch(closest, loopParentId, members, sources, connectionMap);

        Set<String> parentIds = new LinkedHashSet<>();
        if (loopParentId != null) {
            parentIds.add(loopParentId);
        }

        return EquipmentNode.builder()
                .id(LOOP_ID_PREFIX + groupKey)
                .name(start.getName() + " ↔ " + end.getName())
                .type(RING_BUS_TYPE)
                .level(closest.getLevel())
                .parentId(loopParentId)
                .sourceLabel(branch != null ? branch.getSourceLabel() : closest.getSourceLabel())
                .branch(branch)
                .classification(ConnectionType.NORMAL)
                .sequence(members.stream().mapToLong(EquipmentNode::getSequence).min().orElse(0))
                .sources(sources)
                .parentIds(parentIds)
                .path(new ArrayList<>(closest.getPath()))
                .loopGroup(true)
                .loopGroupData(LoopGroupData.builder()
                        .groupKey(groupKey)
                        .members(sorted)
                        .startMemberId(start.getId())
                        .endMemberId(end.getId())
                        .build())
                .build();
    }

    /**
     * Lowest level wins; on a level tie a secondary member replaces a non-secondary one.
     */
    private EquipmentNode closestToRoot(List<EquipmentNode> members) {
        EquipmentNode best = members.get(0);
        for (EquipmentNode candidate : members.subList(1, members.size())) {
            if (candidate.getLevel() < best.getLevel()) {
                best = candidate;
            } else if (candidate.getLevel() == best.getLevel()
                    && candidate.branchHint() == Branch.SECONDARY
                    && best.branchHint() != Branch.SECONDARY) {
                best = candidate;
            }
        }
        return best;
    }

    private Branch resolveBranch(EquipmentNode closest, String loopParentId, List<EquipmentNode> members,
                                 Set<String> groupSources, ConnectionMap connectionMap) {
        Branch hint = closest.branchHint();
        if (hint != null) return hint;

        if (loopParentId != null) {
            Set<String> memberIds = members.stream().map(EquipmentNode::getId).collect(Collectors.toSet());
            Optional<Branch> fromRelation = connectionMap.upstreamOf(loopParentId).stream()
                    .filter(relation -> memberIds.contains(relation.getId()))
                    .map(ConnectionRelation::getSourceLabel)
                    .map(Branch::fromSourceLabel)
                    .filter(Objects::nonNull)
                    .findFirst();
            if (fromRelation.isPresent()) return fromRelation.get();
        }

        boolean primary = groupSources.contains(Branch.PRIMARY.getSourceLabel());
        boolean secondary = groupSources.contains(Branch.SECONDARY.getSourceLabel());
        if (secondary && !primary) return Branch.SECONDARY;
        if (primary) return Branch.PRIMARY;
        return null;
    }

    // ========================= REWIRING =========================

    private void rewire(List<EquipmentNode> processed, Map<String, String> replacements) {
        for (EquipmentNode node : processed) {
            if (node.isAbsorbed()) continue;

            String parentId = node.getParentId();
            if (parentId != null && replacements.containsKey(parentId)) {
                String replacement = replacements.get(parentId);
                node.setParentId(replacement.equals(node.getId()) ? null : replacement);
            }

            Set<String> parentIds = new LinkedHashSet<>();
            for (String id : node.getParentIds()) {
                String replaced = replacements.getOrDefault(id, id);
                if (!replaced.equals(node.getId())) {
                    parentIds.add(replaced);
                }
            }
            node.setParentIds(parentIds);

            List<AlternateParent> alternates = new ArrayList<>();
            for (AlternateParent alternate : node.getAlternateParents()) {
                String replaced = replacements.getOrDefault(alternate.getId(), alternate.getId());
                boolean duplicate = alternates.stream().anyMatch(existing -> existing.getId().equals(replaced)
                        && existing.getClassification() == alternate.getClassification());
                if (!replaced.equals(node.getId()) && !duplicate) {
                    alternates.add(AlternateParent.builder()
                            .id(replaced)
                            .sourceLabel(alternate.getSourceLabel())
                            .classification(alternate.getClassification())
                            .build());
                }
            }
            node.setAlternateParents(alternates);
        }
    }

    /**
     * Level of every rendered node becomes its canonical parent's level + 1, resolved from the root.
     */
    private void recomputeLevels(List<EquipmentNode> processed, String rootId) {
        Map<String, EquipmentNode> index = new HashMap<>();
        processed.stream().filter(node -> !node.isAbsorbed()).forEach(node -> index.put(node.getId(), node));

        Map<String, Integer> resolved = new HashMap<>();
        for (EquipmentNode node : index.values()) {
            resolveLevel(node, index, rootId, resolved, new HashSet<>());
        }

        for (EquipmentNode node : processed) {
            Integer level = resolved.get(node.getId());
            if (level != null && level != node.getLevel() && !node.isAbsorbed()) {
                log.debug("Level of {} moved {} -> {} (parent {})", node.getName(), node.getLevel(), level,
                        node.getParentId());
                node.setLevel(level);
            }
        }
    }

    private int resolveLevel(EquipmentNode node, Map<String, EquipmentNode> index, String rootId,
                             Map<String, Integer> resolved, Set<String> resolving) {
        Integer known = resolved.get(node.getId());
        if (known != null) return known;

        int level = node.getLevel();
        String parentId = node.getParentId();
        if (rootId != null && rootId.equals(parentId)) {
            level = 1;
        } else if (parentId != null && index.containsKey(parentId) && resolving.add(node.getId())) {
            level = resolveLevel(index.get(parentId), index, rootId, resolved, resolving) + 1;
            resolving.remove(node.getId());
        }

        resolved.put(node.getId(), level);
        return level;
    }
}
