package com.powerflow.tree.service.layout;

import com.powerflow.tree.dto.graph.DiagnosticCode;
import com.powerflow.tree.dto.graph.LayoutDiagnostics;
import com.powerflow.tree.model.Branch;
import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.CollisionInfo;
import com.powerflow.tree.model.layout.LateralDirection;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.LayoutInfo;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.Position;
import com.powerflow.tree.service.graph.EquipmentTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Iterative overlap repair.
 *
 * Each pass resolves every detected collision, largest overlap first, then clamps every node
 * to a drift window around its anchor so whole branches cannot walk away. A residual sweep
 * separates whatever is left once all other passes are done.
 */
@Service
@Slf4j
public class CollisionResolver {

    public void resolve(PlacementTree tree, LayoutFrame frame, LayoutSettings settings,
                        LayoutDiagnostics diagnostics) {
        for (int pass = 1; pass <= settings.getMaxCollisionPasses(); pass++) {
            List<CollisionInfo> collisions = LayoutGeometry.findAllCollisions(frame.positions(), settings);
            if (collisions.isEmpty()) {
                enforceBranchAnchors(tree, frame, settings);
                log.info("Collision resolution converged after {} passes", pass - 1);
                return;
            }

            log.debug("Collision pass {}: {} collisions", pass, collisions.size());
            resolveCollisions(collisions, tree, frame, settings);
            enforceBranchAnchors(tree, frame, settings);
        }

        int remaining = LayoutGeometry.findAllCollisions(frame.positions(), settings).size();
        if (remaining > 0) {
            log.info("Collision passes exhausted with {} collisions left for the residual sweep", remaining);
            diagnostics.info(DiagnosticCode.COLLISION_PASSES_EXHAUSTED, null,
                    remaining + " collisions left after " + settings.getMaxCollisionPasses() + " passes");
        }
    }

    // ========================= PAIRWISE RESOLUTION =========================

    private void resolveCollisions(List<CollisionInfo> collisions, PlacementTree tree, LayoutFrame frame,
                                   LayoutSettings settings) {
        List<CollisionInfo> ordered = new ArrayList<>(collisions);
        ordered.sort(Comparator.comparingDouble(CollisionInfo::totalOverlap).reversed()
                .thenComparing(CollisionInfo::getFirst)
                .thenComparing(CollisionInfo::getSecond));

        for (CollisionInfo collision : ordered) {
            Position first = frame.position(collision.getFirst());
            Position second = frame.position(collision.getSecond());
            LayoutInfo firstInfo = infoOf(collision.getFirst(), tree);
            LayoutInfo secondInfo = infoOf(collision.getSecond(), tree);

            if (canSplit(firstInfo, secondInfo)) {
                double shift = (collision.getHorizontalOverlap() + settings.getCollisionPadding()) / 2;
                boolean firstIsLeft = firstInfo.getBranch() == Branch.PRIMARY;
                String leftId = firstIsLeft ? collision.getFirst() : collision.getSecond();
                String rightId = firstIsLeft ? collision.getSecond() : collision.getFirst();
                frame.move(leftId, frame.position(leftId).withX(frame.position(leftId).getX() - shift));
                frame.move(rightId, frame.position(rightId).withX(frame.position(rightId).getX() + shift));
                continue;
            }

            boolean moveFirst = firstMoves(collision.getFirst(), collision.getSecond(), tree);
            String moverId = moveFirst ? collision.getFirst() : collision.getSecond();
            Position mover = moveFirst ? first : second;
            Position other = moveFirst ? second : first;
            frame.move(moverId, safePosition(moverId, mover, other, collision, tree, settings));
        }
    }

    /**
     * Same level, opposite branches, neither lateral: both nodes give way by half the overlap.
     */
    private boolean canSplit(LayoutInfo first, LayoutInfo second) {
        return first != null && second != null
                && first.getLevel() == second.getLevel()
                && first.getBranch() != null && second.getBranch() != null
                && first.getBranch() != second.getBranch()
                && !first.isLateral() && !second.isLateral();
    }

    /**
     * Whether the first node of a pair is the one that moves. Power storage never moves, the
     * root never moves, laterals move before ordinary nodes, deeper before shallower, secondary
     * before primary, then the larger id.
     */
    boolean firstMoves(String firstId, String secondId, PlacementTree tree) {
        LayoutInfo first = infoOf(firstId, tree);
        LayoutInfo second = infoOf(secondId, tree);
        if (first == null || second == null) return true;

        boolean firstStorage = EquipmentTypes.isPowerStorage(first.getEquipment().getType(), first.name());
        boolean secondStorage = EquipmentTypes.isPowerStorage(second.getEquipment().getType(), second.name());
        if (firstStorage != secondStorage) return secondStorage;

        boolean firstRoot = firstId.equals(tree.getRootId());
        boolean secondRoot = secondId.equals(tree.getRootId());
        if (firstRoot != secondRoot) return secondRoot;

        if (first.isLateral() != second.isLateral()) return first.isLateral();
        if (first.getLevel() != second.getLevel()) return first.getLevel() > second.getLevel();
        if (first.getBranch() != second.getBranch()) return first.getBranch() == Branch.SECONDARY;
        return firstId.compareTo(secondId) > 0;
    }

    private Position safePosition(String moverId, Position mover, Position other, CollisionInfo collision,
                                  PlacementTree tree, LayoutSettings settings) {
        if (moverId.equals(tree.getRootId())) {
            return mover;
        }

        LayoutInfo info = infoOf(moverId, tree);
        double deltaX = collision.getHorizontalOverlap() + settings.getCollisionPadding();
        boolean moveRight;
        if (info != null && info.isLateral() && info.getLateralDirection() != null) {
            moveRight = info.getLateralDirection() == LateralDirection.RIGHT;
        } else if (info != null && info.getBranch() == Branch.SECONDARY) {
            moveRight = true;
        } else if (info != null && info.getBranch() == Branch.PRIMARY) {
            moveRight = false;
        } else {
            moveRight = mover.getX() > other.getX();
        }
        return mover.withX(mover.getX() + (moveRight ? deltaX : -deltaX));
    }

    /**
     * Clamp every node to a window around its anchor. Lateral power storage may only drift a
     * little to the right; primary nodes drift mostly left, secondary nodes mostly right.
     */
    private void enforceBranchAnchors(PlacementTree tree, LayoutFrame frame, LayoutSettings settings) {
        double gap = settings.getMinimumGap();
        for (Map.Entry<String, Position> anchor : frame.anchors().entrySet()) {
            String id = anchor.getKey();
            LayoutInfo info = infoOf(id, tree);
            if (info == null || !frame.isPlaced(id)) continue;

            double leftSlack = gap / 2;
            double rightSlack = gap / 2;
            if (info.isLateral() && EquipmentTypes.isPowerStorage(info.getEquipment().getType(), info.name())) {
                leftSlack = gap / 3;
                rightSlack = Math.min(settings.getCollisionPadding(), gap / 10);
            } else if (info.getBranch() == Branch.PRIMARY) {
                leftSlack = gap * 0.8;
                rightSlack = gap * 0.2;
            } else if (info.getBranch() == Branch.SECONDARY) {
                leftSlack = gap * 0.2;
                rightSlack = gap * 0.8;
            }

            Position current = frame.position(id);
            double clamped = Math.min(Math.max(current.getX(), anchor.getValue().getX() - leftSlack),
                    anchor.getValue().getX() + rightSlack);
            if (clamped != current.getX()) {
                frame.move(id, current.withX(clamped));
            }
        }
    }

    // ========================= RESIDUAL SWEEP =========================

    /**
     * Separate every remaining overlap. Rows close enough to collide form a band; inside a
     * band each node moves together with its same-row laterals as one unit. The unit holding
     * the root (or, without it, the unit nearest the centre) stays put and the others are
     * pushed outwards just far enough.
     *
     * @return number of units moved
     */
    public int separateResidualOverlaps(PlacementTree tree, LayoutFrame frame, LayoutSettings settings,
                                        LayoutDiagnostics diagnostics) {
        if (LayoutGeometry.findAllCollisions(frame.positions(), settings).isEmpty()) {
            return 0;
        }

        int moved = 0;
        for (List<String> band : bands(frame, settings)) {
            moved += separateBand(band, tree, frame, settings);
        }

        if (moved > 0) {
            log.warn("Residual overlap sweep moved {} units", moved);
            diagnostics.warn(DiagnosticCode.RESIDUAL_OVERLAP_SEPARATED, null,
                    "Residual overlaps separated by moving " + moved + " units");
        }
        return moved;
    }

    private List<List<String>> bands(LayoutFrame frame, LayoutSettings settings) {
        TreeMap<Double, List<String>> byY = new TreeMap<>();
        for (Map.Entry<String, Position> entry : frame.positions().entrySet()) {
            byY.computeIfAbsent(entry.getValue().getY(), y -> new ArrayList<>()).add(entry.getKey());
        }

        List<List<String>> bands = new ArrayList<>();
        List<String> current = new ArrayList<>();
        Double previousY = null;
        for (Map.Entry<Double, List<String>> row : byY.entrySet()) {
            if (previousY != null && !LayoutGeometry.verticallyConflicting(previousY, row.getKey(), settings)) {
                bands.add(current);
                current = new ArrayList<>();
            }
            current.addAll(row.getValue());
            previousY = row.getKey();
        }
        if (!current.isEmpty()) {
            bands.add(current);
        }
        return bands;
    }

    private int separateBand(List<String> band, PlacementTree tree, LayoutFrame frame, LayoutSettings settings) {
        List<List<String>> units = units(band, tree, frame, settings);
        if (units.size() < 2) return 0;

        units.sort(Comparator.comparingDouble((List<String> unit) -> centerOf(unit, frame))
                .thenComparing(unit -> unit.get(0)));
        int anchorIndex = anchorUnit(units, tree, frame, settings);

        List<String> fixed = new ArrayList<>(units.get(anchorIndex));
        int moved = 0;
        for (int i = anchorIndex + 1; i < units.size(); i++) {
            moved += pushClear(units.get(i), fixed, 1, frame, settings);
            fixed.addAll(units.get(i));
        }
        for (int i = anchorIndex - 1; i >= 0; i--) {
            moved += pushClear(units.get(i), fixed, -1, frame, settings);
            fixed.addAll(units.get(i));
        }
        return moved;
    }

    /**
     * Shift a unit outwards until none of its members collides with a fixed node.
     * Every step puts the offending member a full centre spacing past the fixed node, so the
     * loop ends after at most one step per member and fixed node.
     */
    private int pushClear(List<String> unit, List<String> fixed, int direction, LayoutFrame frame,
                          LayoutSettings settings) {
        double total = 0;
        int limit = unit.size() * fixed.size() + 1;
        for (int step = 0; step < limit; step++) {
            double shift = 0;
            for (String member : unit) {
                Position position = frame.position(member);
                for (String placed : fixed) {
                    Position other = frame.position(placed);
                    if (LayoutGeometry.checkCollision(member, position, placed, other, settings) == null) continue;
                    double needed = direction > 0
                            ? other.getX() + settings.centerSpacing() - position.getX()
                            : position.getX() - (other.getX() - settings.centerSpacing());
                    shift = Math.max(shift, needed);
                }
            }
            if (shift <= 0) break;
            shiftUnit(unit, direction * shift, frame);
            total += shift;
        }
        if (total == 0) return 0;
        log.debug("Shifted unit {} by {}", unit, direction * total);
        return 1;
    }

    /**
     * A node together with the direct laterals and paired storage sharing its y. A unit whose own members collide
     * is split back into single nodes.
     */
    private List<List<String>> units(List<String> band, PlacementTree tree, LayoutFrame frame,
                                     LayoutSettings settings) {
        Set<String> inBand = new HashSet<>(band);
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (String id : band) {
            String owner = unitOwner(id, tree, frame, inBand);
            grouped.computeIfAbsent(owner, key -> new ArrayList<>()).add(id);
        }

        List<List<String>> units = new ArrayList<>();
        for (List<String> unit : grouped.values()) {
            unit.sort(Comparator.naturalOrder());
            Map<String, Position> members = new LinkedHashMap<>();
            unit.forEach(id -> members.put(id, frame.position(id)));
            if (LayoutGeometry.findAllCollisions(members, settings).isEmpty()) {
                units.add(unit);
            } else {
                unit.forEach(id -> units.add(new ArrayList<>(List.of(id))));
            }
        }
        return units;
    }

    private String unitOwner(String id, PlacementTree tree, LayoutFrame frame, Set<String> inBand) {
        String partnerId = frame.partnerOf(id);
        if (partnerId != null && inBand.contains(partnerId) && sameRow(id, partnerId, frame)) {
            return partnerId;
        }

        PlacementNode node = tree.node(id);
        if (node == null || !node.getInfo().isLateral()) return id;
        String parentId = node.getParentId();
        if (parentId == null || !inBand.contains(parentId)) return id;
        PlacementNode parent = tree.node(parentId);
        if (parent != null && parent.getInfo().isLateral()) return id;
        return sameRow(id, parentId, frame) ? parentId : id;
    }

    private boolean sameRow(String id, String otherId, LayoutFrame frame) {
        return Math.abs(frame.position(otherId).getY() - frame.position(id).getY())
                < LayoutGeometry.SAME_ROW_TOLERANCE;
    }

    private int anchorUnit(List<List<String>> units, PlacementTree tree, LayoutFrame frame, LayoutSettings settings) {
        for (int i = 0; i < units.size(); i++) {
            if (units.get(i).contains(tree.getRootId())) return i;
        }
        int best = 0;
        for (int i = 1; i < units.size(); i++) {
            if (Math.abs(centerOf(units.get(i), frame) - settings.getCenterX())
                    < Math.abs(centerOf(units.get(best), frame) - settings.getCenterX())) {
                best = i;
            }
        }
        return best;
    }

    private void shiftUnit(List<String> unit, double shift, LayoutFrame frame) {
        for (String id : unit) {
            Position position = frame.position(id);
            frame.move(id, position.withX(position.getX() + shift));
        }
    }

    private double centerOf(List<String> unit, LayoutFrame frame) {
        return unit.stream().mapToDouble(id -> frame.position(id).getX()).average().orElse(0);
    }

    private LayoutInfo infoOf(String id, PlacementTree tree) {
        PlacementNode node = tree.node(id);
        return node == null ? null : node.getInfo();
    }
}
