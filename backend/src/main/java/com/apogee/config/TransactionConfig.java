package com.apogee.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.support.TransactionTemplate;

@Slf4j
@Configuration
@EnableTransactionManagement
public class TransactionConfig {

    /** Audit writes commit on their own, independent of any surrounding transaction */
    @Bean("auditTransactionTemplate")
    public TransactionTemplate auditTransactionTemplate(
            PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setTimeout(10);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        log.debug("Audit transaction template configured with REQUIRES_NEW and 10s timeout");
        return template;
    }
}
