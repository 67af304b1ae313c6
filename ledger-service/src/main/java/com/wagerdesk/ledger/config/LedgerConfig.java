package com.wagerdesk.ledger.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wagerdesk.ledger.analysis.LossAnalyzer;
import com.wagerdesk.ledger.analysis.ThresholdTable;
import com.wagerdesk.warehouse.WarehouseClientConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Import(WarehouseClientConfig.class)
public class LedgerConfig {

    @Bean
    public LossAnalyzer lossAnalyzer(LedgerProperties props) {
        return new LossAnalyzer(props.lossAnalysisConfidence());
    }

    @Bean
    public ThresholdTable thresholdTable() {
        return ThresholdTable.v1();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
