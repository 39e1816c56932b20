package com.phillippitts.newwork.config.recovery;

import com.phillippitts.newwork.config.properties.RecoveryProperties;
import com.phillippitts.newwork.service.recovery.RestartDelayPolicy;
import com.phillippitts.newwork.service.recovery.RestartLimiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Recovery policy beans built from {@link RecoveryProperties}.
 */
@Configuration
public class RecoveryConfig {

    private static final Logger LOG = LogManager.getLogger(RecoveryConfig.class);

    @Bean
    public RestartLimiter restartLimiter(RecoveryProperties props) {
        LOG.info("Recovery limiter: {} attempts per {}s", props.getMaxAttempts(), props.getWindow().toSeconds());
        return new RestartLimiter(props.getMaxAttempts(), props.getWindow(), Clock.systemUTC());
    }

    @Bean
    public RestartDelayPolicy restartDelayPolicy(RecoveryProperties props) {
        RestartDelayPolicy policy = RestartDelayPolicy.from(props.getBackoff());
        LOG.info("Restart backoff: mode={}, base={}ms", policy.getMode(), props.getBackoff().getBaseDelay().toMillis());
        return policy;
    }
}
