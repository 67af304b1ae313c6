package com.wagerdesk.orchestrator.context;

import com.wagerdesk.common.data.EntityRef;
import com.wagerdesk.common.data.SideProfile;
import com.wagerdesk.common.model.Context;
import com.wagerdesk.common.model.DataQuality;
import com.wagerdesk.common.model.HeadToHead;
import com.wagerdesk.common.model.MarketLine;
import com.wagerdesk.common.model.PlayerStatLine;
import com.wagerdesk.common.model.RestProfile;
import com.wagerdesk.common.model.SideContext;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;
import com.wagerdesk.orchestrator.model.EvaluationRequest;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything fetched so far for one request. Found parts survive a retry; parts that came
 * back empty are stale and get fetched again.
 *
 * <p>{@code errors} name gaps that make the context unusable (an unresolved side, a side with no
 * aggregates, a missing prop stat line). {@code missing} names optional gaps the pipeline can
 * live with. Both are rebuilt on every attempt.
 */
public record ContextAssembly(
    SideAssembly sideA,
    SideAssembly sideB,
    HeadToHead headToHead,
    MarketLine market,
    PlayerStatLine prop,
    List<String> missing,
    List<String> errors
) {
    public ContextAssembly {
        if (sideA == null) sideA = SideAssembly.EMPTY;
        if (sideB == null) sideB = SideAssembly.EMPTY;
        missing = missing == null ? List.of() : List.copyOf(missing);
        errors  = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ContextAssembly empty() {
        return new ContextAssembly(SideAssembly.EMPTY, SideAssembly.EMPTY, null, null, null, List.of(), List.of());
    }

    public boolean isUsable(EvaluationRequest request) {
        if (request.isProp()) {
            return sideA.entity() != null && prop != null && !prop.averages().isEmpty();
        }
        return sideA.entity() != null && sideB.entity() != null
            && !sideA.windows().isEmpty() && !sideB.windows().isEmpty();
    }

    public DataQuality quality(EvaluationRequest request) {
        if (!isUsable(request)) return DataQuality.UNAVAILABLE;
        return missing.isEmpty() && errors.isEmpty() ? DataQuality.FRESH : DataQuality.PARTIAL;
    }

    public Context toContext(EvaluationRequest request) {
        LocalDate date = request.gameDate() != null ? request.gameDate() : LocalDate.now();
        return new Context(
            request.eventId(),
            request.betType(),
            date,
            sideA.toSideContext(request.sideA(), request.sideAHome()),
            sideB.entity() == null ? null : sideB.toSideContext(request.sideB(), !request.sideAHome()),
            headToHead,
            market,
            prop,
            quality(request),
            missing);
    }

    /**
     * One side's fetched parts. {@code entity} is {@code null} until the name resolves.
     */
    public record SideAssembly(
        EntityRef entity,
        Map<Window, WindowAggregate> windows,
        RestProfile rest,
        SideProfile profile
    ) {
        public static final SideAssembly EMPTY = new SideAssembly(null, Map.of(), null, null);

        public SideAssembly {
            Map<Window, WindowAggregate> copy = new EnumMap<>(Window.class);
            if (windows != null) copy.putAll(windows);
            windows = Map.copyOf(copy);
        }

        SideContext toSideContext(String requestedName, boolean home) {
            String name = entity.name() != null ? entity.name() : requestedName;
            return new SideContext(entity.entityId(), name, home, windows, rest,
                profile == null ? null : profile.venue(),
                profile == null ? null : profile.strength(),
                profile == null ? null : profile.overUnder());
        }
    }
}
