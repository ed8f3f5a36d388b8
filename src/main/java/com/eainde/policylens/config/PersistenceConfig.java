package com.eainde.policylens.config;

import com.eainde.policylens.store.AuditRecordStore;
import com.eainde.policylens.store.DecisionStore;
import com.eainde.policylens.store.JdbcAuditRecordStore;
import com.eainde.policylens.store.JdbcDecisionStore;
import com.eainde.policylens.store.JdbcPolicyDocumentStore;
import com.eainde.policylens.store.PolicyDocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class PersistenceConfig {

    @Bean
    public DecisionStore decisionStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcDecisionStore(jdbcTemplate, objectMapper);
    }

    @Bean
    public PolicyDocumentStore policyDocumentStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        return new JdbcPolicyDocumentStore(jdbcTemplate, transactionTemplate);
    }

    @Bean
    public AuditRecordStore auditRecordStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcAuditRecordStore(jdbcTemplate, objectMapper);
    }
}
