package com.wagerdesk.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wagerdesk.common.debate.DebateParameters;
import com.wagerdesk.common.edge.EdgeParameters;
import com.wagerdesk.common.projection.ProjectionParameters;
import com.wagerdesk.common.simulation.PropSimulationParameters;
import com.wagerdesk.common.simulation.SimulationParameters;
import com.wagerdesk.orchestrator.pipeline.PipelineRouter;
import com.wagerdesk.warehouse.WarehouseClientConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
@Import(WarehouseClientConfig.class)
public class OrchestratorConfig {

    @Bean
    public WebClient ledgerWebClient(WebClient.Builder builder, OrchestratorProperties props) {
        return builder.baseUrl(props.ledger().baseUrl()).build();
    }

    @Bean
    public PipelineRouter pipelineRouter(OrchestratorProperties props) {
        return new PipelineRouter(props.maxRetries());
    }

    @Bean
    public SimulationParameters simulationParameters(OrchestratorProperties props) {
        return props.simulation().toParameters();
    }

    @Bean
    public PropSimulationParameters propSimulationParameters() {
        return PropSimulationParameters.defaults();
    }

    @Bean
    public EdgeParameters edgeParameters(OrchestratorProperties props) {
        return props.edge().toParameters();
    }

    @Bean
    public ProjectionParameters projectionParameters(OrchestratorProperties props) {
        return props.projection().toParameters();
    }

    @Bean
    public DebateParameters debateParameters(OrchestratorProperties props) {
        return props.debate().toParameters();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
