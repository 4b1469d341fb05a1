package com.powerflow.tree.service.layout;

import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.graph.ConnectionMap;
import com.powerflow.tree.model.graph.ConnectionRelation;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.Position;
import com.powerflow.tree.service.graph.EquipmentTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Pulls power storage fed by a main distribution switch onto the switch's row, one pairing
 * distance to its left, when the placement tree did not already pair them.
 *
 * Only storage outside the lateral groups is considered. A switch pairs with one storage unit:
 * a switch that already carries laterals, or was claimed by an earlier unit, is skipped.
 */
@Service
@Slf4j
public class StoragePairTightener {

    /** Distance error tolerated before a unit that already sits left of its switch is re-snapped. */
    public static final double PAIR_TOLERANCE = 6;

    /**
     * @return number of storage units paired
     */
    public int tighten(PlacementTree tree, LayoutFrame frame, ConnectionMap connectionMap, LayoutSettings settings) {
        int paired = 0;

        for (PlacementNode node : tree.nodes()) {
            String id = node.getId();
            if (id.equals(tree.getRootId()) || node.getInfo().isLateral() || !frame.isPlaced(id)) continue;
            if (!EquipmentTypes.isPowerStorage(node.getInfo().getEquipment().getType())) continue;

            Optional<String> switchId = feedingSwitch(id, tree, frame, connectionMap);
            if (switchId.isEmpty()) continue;

            Position target = pairedPosition(frame.position(id), frame.position(switchId.get()), settings);
            frame.place(id, target, frame.row(switchId.get()));
            frame.updateAnchor(id, target);
            frame.pair(id, switchId.get());
            paired++;
            log.debug("Paired {} with {} at ({}, {})", id, switchId.get(), target.getX(), target.getY());
        }

        log.info("Tightened {} storage units beside their feeding switches", paired);
        return paired;
    }

    /**
     * First upstream main distribution switch that is placed and still free.
     */
    private Optional<String> feedingSwitch(String id, PlacementTree tree, LayoutFrame frame,
                                           ConnectionMap connectionMap) {
        return connectionMap.upstreamOf(id).stream()
                .filter(relation -> EquipmentTypes.isMainDistribution(relation.getType()))
                .map(ConnectionRelation::getId)
                .filter(switchId -> tree.contains(switchId) && frame.isPlaced(switchId))
                .filter(switchId -> tree.node(switchId).getLateralChildren().isEmpty())
                .filter(switchId -> !frame.hasPartner(switchId))
                .findFirst();
    }

    /**
     * Keep the x of a unit already left of its switch at an accepted distance; otherwise snap
     * it one pairing distance to the left. The y always follows the switch.
     */
    Position pairedPosition(Position storage, Position feeder, LayoutSettings settings) {
        double distance = Math.abs(feeder.getX() - storage.getX());
        boolean alreadyLeft = storage.getX() < feeder.getX();
        boolean accepted = Math.abs(distance - settings.pairingDistance()) <= PAIR_TOLERANCE
                || Math.abs(distance - settings.centerSpacing()) <= PAIR_TOLERANCE;
        if (alreadyLeft && accepted) {
            return Position.of(storage.getX(), feeder.getY());
        }
        return Position.of(feeder.getX() - settings.pairingDistance(), feeder.getY());
    }
}
