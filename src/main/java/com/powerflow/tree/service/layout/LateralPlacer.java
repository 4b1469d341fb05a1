package com.powerflow.tree.service.layout;

import com.powerflow.tree.model.LayoutSettings;
import com.powerflow.tree.model.layout.LateralDirection;
import com.powerflow.tree.model.layout.LayoutFrame;
import com.powerflow.tree.model.layout.PlacementNode;
import com.powerflow.tree.model.layout.PlacementTree;
import com.powerflow.tree.model.layout.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Pairs lateral equipment beside the node it serves: same y and row as the parent, one
 * pairing distance per lateral towards the lateral's side.
 */
@Service
@Slf4j
public class LateralPlacer {

    public void place(PlacementTree tree, LayoutFrame frame, LayoutSettings settings) {
        int placed = 0;

        // Tree nodes iterate in discovery order, so a lateral's parent is always settled first
        for (PlacementNode node : tree.nodes()) {
            if (node.getLateralChildren().isEmpty() || !frame.isPlaced(node.getId())) continue;

            Position parentPosition = frame.position(node.getId());
            int parentRow = frame.row(node.getId());
            int left = 0;
            int right = 0;

            for (String lateralId : node.getLateralChildren()) {
                LateralDirection direction = tree.node(lateralId).getInfo().getLateralDirection();
                if (direction == null) {
                    direction = LateralDirection.LEFT;
                }
                int steps = direction == LateralDirection.LEFT ? ++left : ++right;
                Position target = Position.of(
                        parentPosition.getX() + direction.sign() * steps * settings.pairingDistance(),
                        parentPosition.getY());

                frame.place(lateralId, target, parentRow);
                frame.updateAnchor(lateralId, target);
                placed++;
            }
        }

        log.info("Placed {} lateral nodes beside their parents", placed);
    }
}
