package com.wagerdesk.orchestrator.context;

import com.wagerdesk.common.data.DataAccess;
import com.wagerdesk.common.data.EntityRef;
import com.wagerdesk.common.data.EntityRef.EntityKind;
import com.wagerdesk.common.data.Lookup;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.DataQuality;
import com.wagerdesk.common.model.HeadToHead;
import com.wagerdesk.common.model.PlayerStatLine;
import com.wagerdesk.common.model.RestProfile;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.orchestrator.OrchestratorFixtures;
import com.wagerdesk.orchestrator.model.Depth;
import com.wagerdesk.orchestrator.model.EvaluationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static com.wagerdesk.orchestrator.OrchestratorFixtures.EVENT_ID;
import static com.wagerdesk.orchestrator.OrchestratorFixtures.GAME_DATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContextAssemblerTest {

    @Mock
    private DataAccess dataAccess;

    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ContextAssembler(dataAccess);
    }

    @Test
    @DisplayName("every lookup found → usable, fresh, no gaps")
    void healthyContext() {
        OrchestratorFixtures.healthyWarehouse(dataAccess);

        ContextAssembly assembly = assembler.assemble(OrchestratorFixtures.total(null, EVENT_ID), null).block();

        assertThat(assembly.isUsable(OrchestratorFixtures.total(null, EVENT_ID))).isTrue();
        assertThat(assembly.missing()).isEmpty();
        assertThat(assembly.errors()).isEmpty();
        assertThat(assembly.sideA().windows()).hasSize(Window.values().length);
        assertThat(assembly.market().line()).isEqualTo(260.0);
        verify(dataAccess, times(8)).fetchAggregates(anyString(), any(Window.class));
    }

    @Test
    @DisplayName("a retry only refetches what the previous attempt did not find")
    void retryReusesFoundParts() {
        OrchestratorFixtures.healthyWarehouse(dataAccess);
        when(dataAccess.resolveEntity("Denver"))
            .thenReturn(Mono.just(Lookup.notFound("unknown team")))
            .thenReturn(Mono.just(Lookup.found(OrchestratorFixtures.DENVER)));
        EvaluationRequest request = OrchestratorFixtures.total(null, EVENT_ID);

        ContextAssembly first = assembler.assemble(request, null).block();
        assertThat(first.isUsable(request)).isFalse();
        assertThat(first.errors()).containsExactly("sideB.entity: unknown team");
        assertThat(first.sideA().windows()).isNotEmpty();

        ContextAssembly second = assembler.assemble(request, first).block();
        assertThat(second.isUsable(request)).isTrue();
        assertThat(second.errors()).isEmpty();

        verify(dataAccess, times(1)).resolveEntity("Boston");
        verify(dataAccess, times(2)).resolveEntity("Denver");
        verify(dataAccess, times(4)).fetchAggregates(eq("t-bos"), any(Window.class));
        verify(dataAccess, times(1)).fetchMarketOdds(EVENT_ID, BetType.TOTAL);
    }

    @Test
    @DisplayName("error and empty signals become gaps, not failures")
    void errorsBecomeGaps() {
        OrchestratorFixtures.healthyWarehouse(dataAccess);
        when(dataAccess.fetchHeadToHead(anyString(), anyString(), anyInt()))
            .thenReturn(Mono.<Lookup<HeadToHead>>error(new IllegalStateException("connection reset")));
        when(dataAccess.fetchRestAndDensity(eq("t-den"), any()))
            .thenReturn(Mono.empty());
        EvaluationRequest request = OrchestratorFixtures.total(null, EVENT_ID);

        ContextAssembly assembly = assembler.assemble(request, null).block();

        assertThat(assembly.isUsable(request)).isTrue();
        assertThat(assembly.quality(request)).isEqualTo(DataQuality.PARTIAL);
        assertThat(assembly.missing()).containsExactlyInAnyOrder("headToHead", "sideB.rest");
        assertThat(assembly.headToHead()).isNull();
    }

    @Test
    @DisplayName("no event id → market is neither fetched nor reported missing")
    void noEventId() {
        OrchestratorFixtures.healthyWarehouse(dataAccess);

        ContextAssembly assembly = assembler.assemble(OrchestratorFixtures.total(220.5, null), null).block();

        assertThat(assembly.missing()).isEmpty();
        verify(dataAccess, never()).fetchMarketOdds(anyString(), any());
    }

    @Test
    @DisplayName("player props read rest from the player's team and need a stat line")
    void propNeedsStatLine() {
        EntityRef player = new EntityRef("p-7", "Jay Doe", EntityKind.PLAYER, "t-bos");
        EvaluationRequest request = new EvaluationRequest(BetType.PLAYER_PROP, "Jay Doe", null, true, "points",
                                                          25.5, null, null, GAME_DATE, Depth.STANDARD, 1L);
        when(dataAccess.resolveEntity("Jay Doe")).thenReturn(Mono.just(Lookup.found(player)));
        when(dataAccess.fetchRestAndDensity("t-bos", GAME_DATE))
            .thenReturn(Mono.just(Lookup.found(new RestProfile(1, false, 3, 7))));
        when(dataAccess.fetchPlayerStats("p-7", "points"))
            .thenReturn(Mono.just(Lookup.<PlayerStatLine>notFound("no games logged")));

        ContextAssembly assembly = assembler.assemble(request, null).block();

        assertThat(assembly.isUsable(request)).isFalse();
        assertThat(assembly.errors()).containsExactly("prop: no games logged");
        assertThat(assembly.sideA().rest().restDays()).isEqualTo(1);
        verify(dataAccess, never()).fetchAggregates(anyString(), any());
    }
}
