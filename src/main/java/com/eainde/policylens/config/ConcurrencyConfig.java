package com.eainde.policylens.config;

import com.eainde.policylens.thread.MdcAwareExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ConcurrencyConfig {

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor reevaluationWorkers(PolicyLensProperties properties) {
        return new MdcAwareExecutor(properties.getBatch().getWorkers(), "reevaluation-worker");
    }

    /** Coordinates asynchronous batch jobs; replays themselves run on the workers. */
    @Bean(destroyMethod = "close")
    public MdcAwareExecutor reevaluationJobs() {
        return new MdcAwareExecutor(1, "reevaluation-job");
    }
}
