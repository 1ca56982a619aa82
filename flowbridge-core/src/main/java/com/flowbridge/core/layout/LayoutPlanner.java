package com.flowbridge.core.layout;

import com.flowbridge.core.model.ComponentInstance;
import com.flowbridge.core.model.Position;
import com.flowbridge.core.model.SourceNode;

import java.util.Collection;

/**
 * Editor positions for compiled components.
 *
 * <p>Nodes keep the position their source document gives them; nodes without one are laid out
 * left to right. Routing components are placed to the right of their branch point, gates
 * stepping down and to the right along the chain.
 */
public class LayoutPlanner {

    static final Position ENTRY_POSITION = new Position(-800, 0);
    static final double AUTO_X_START = -400;
    static final double AUTO_Y = 100;
    static final double COLUMN_WIDTH = 300;
    static final double EXIT_MARGIN = 400;
    static final double GATE_OFFSET_X = 600;
    static final double GATE_STEP_Y = 150;

    public Position entryPosition() {
        return ENTRY_POSITION;
    }

    /**
     * Returns the position of a node's component.
     *
     * @param node source node
     * @param index node index in document order
     * @return document position, or the auto-layout slot for the index
     */
    public Position nodePosition(SourceNode node, int index) {
        if (node.position() != null) {
            return node.position();
        }
        return new Position(AUTO_X_START + index * COLUMN_WIDTH, AUTO_Y);
    }

    /**
     * Returns the exit sentinel position, right of everything placed so far.
     *
     * @param placed instances already positioned
     * @return exit position
     */
    public Position exitPosition(Collection<ComponentInstance> placed) {
        double maxX = placed.stream().mapToDouble(i -> i.position().x()).max().orElse(0);
        return new Position(maxX + EXIT_MARGIN, 0);
    }

    public Position classifierPosition(Position branchPoint) {
        return branchPoint.translate(COLUMN_WIDTH, 0);
    }

    /**
     * Returns the position of a gate in a routing chain.
     *
     * @param branchPoint position of the branch point
     * @param gateIndex 1-based gate index
     * @return gate position
     */
    public Position gatePosition(Position branchPoint, int gateIndex) {
        int step = gateIndex - 1;
        return branchPoint.translate(GATE_OFFSET_X + step * COLUMN_WIDTH, step * GATE_STEP_Y);
    }
}
