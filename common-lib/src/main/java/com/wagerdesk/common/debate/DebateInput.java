package com.wagerdesk.common.debate;

import com.wagerdesk.common.edge.EdgeResult;
import com.wagerdesk.common.edge.SideEdge;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Context;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.Projection;
import com.wagerdesk.common.model.SideContext;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;
import com.wagerdesk.common.simulation.ScenarioReport;
import com.wagerdesk.common.simulation.SimulationResult;

/**
 * What both argument catalogs read. {@code edge} is {@code null} when no line was available,
 * {@code scenarios} when scenario analysis was not run.
 */
public record DebateInput(
    Context context,
    Projection projection,
    SimulationResult simulation,
    EdgeResult edge,
    ScenarioReport scenarios,
    Direction selection
) {
    public BetType betType() {
        return context.betType();
    }

    public boolean isOver() {
        return selection == Direction.OVER;
    }

    /** Simulated probability that the selection wins. */
    public double selectionProbability() {
        return (selection == Direction.OVER || selection == Direction.SIDE_A)
            ? simulation.pOver() : simulation.pUnder();
    }

    /** Edge of the selection after penalties, or 0 when there is no priced market. */
    public double selectionEdge() {
        SideEdge side = selectionSide();
        return side == null ? 0.0 : side.adjustedEdge();
    }

    public SideEdge selectionSide() {
        return edge == null ? null : edge.side(selection);
    }

    /** Projection margin from the line, positive when it favours the selection. */
    public double marginForSelection() {
        double m = projection.marginFromLine();
        return (selection == Direction.UNDER || selection == Direction.SIDE_B) ? -m : m;
    }

    public SideContext selectedSide() {
        return selection == Direction.SIDE_B ? context.sideB() : context.sideA();
    }

    public SideContext opposingSide() {
        return selection == Direction.SIDE_B ? context.sideA() : context.sideB();
    }

    /** Most recent window available for a side, or {@code null}. */
    static WindowAggregate recent(SideContext side) {
        if (side == null) return null;
        WindowAggregate agg = side.windows().get(Window.L10);
        if (agg != null) return agg;
        for (Window w : new Window[] {Window.L5, Window.L15, Window.SEASON}) {
            agg = side.windows().get(w);
            if (agg != null) return agg;
        }
        return null;
    }

    double adjustment(String label) {
        return projection.adjustments().stream()
            .filter(a -> a.label().equals(label))
            .mapToDouble(a -> a.value())
            .sum();
    }
}
