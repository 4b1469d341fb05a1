package com.powerflow.tree.service.layout;

import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.CollisionInfo;
import com.powerflow.tree.model.layout.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collision geometry shared by the resolver and the validator.
 */
public final class LayoutGeometry {

    /** Vertical distance below which two nodes count as sharing a row. */
    public static final double SAME_ROW_TOLERANCE = 10;

    private static final double EPSILON = 1e-6;

    private LayoutGeometry() {
    }

    /**
     * Overlap of two node centres, or null when they do not collide. Nodes collide when they are
     * closer than width + gap horizontally and either share a row or are closer than
     * height + clearance vertically.
     */
    public static CollisionInfo checkCollision(String firstId, Position first, String secondId, Position second,
                                               LayoutSettings settings) {
        double horizontalOverlap = settings.centerSpacing() - Math.abs(first.getX() - second.getX());
        if (horizontalOverlap <= EPSILON) {
            return null;
        }

        double verticalDistance = Math.abs(first.getY() - second.getY());
        if (verticalDistance < SAME_ROW_TOLERANCE) {
            return new CollisionInfo(firstId, secondId, horizontalOverlap, 0);
        }

        double verticalOverlap = settings.minimumVerticalSeparation() - verticalDistance;
        if (verticalOverlap > EPSILON) {
            return new CollisionInfo(firstId, secondId, horizontalOverlap, verticalOverlap);
        }
        return null;
    }

    /**
     * Whether two rows are close enough that their nodes can collide.
     */
    public static boolean verticallyConflicting(double firstY, double secondY, LayoutSettings settings) {
        double verticalDistance = Math.abs(firstY - secondY);
        return verticalDistance < SAME_ROW_TOLERANCE
                || settings.minimumVerticalSeparation() - verticalDistance > EPSILON;
    }

    public static List<CollisionInfo> findAllCollisions(Map<String, Position> positions, LayoutSettings settings) {
        List<CollisionInfo> collisions = new ArrayList<>();
        List<Map.Entry<String, Position>> entries = new ArrayList<>(positions.entrySet());

        for (int i = 0; i < entries.size(); i++) {
            for (int j = i + 1; j < entries.size(); j++) {
                CollisionInfo collision = checkCollision(entries.get(i).getKey(), entries.get(i).getValue(),
                        entries.get(j).getKey(), entries.get(j).getValue(), settings);
                if (collision != null) {
                    collisions.add(collision);
                }
            }
        }
        return collisions;
    }
}
