package net.recache.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import net.recache.adapter.jdbc.repo.JdbcWorkQueuePublisher;
import net.recache.bootstrap.props.RecacheProperties;
import net.recache.core.model.RecoveryReport;
import net.recache.core.service.RecoveryCoordinator;
import net.recache.core.service.ResumeExecutor;
import net.recache.core.spi.Clock;
import net.recache.core.spi.CollectionSource;
import net.recache.core.spi.JobStateRepository;
import net.recache.core.spi.RecoveryListener;
import net.recache.core.spi.TxRunner;
import net.recache.core.spi.WorkQueuePublisher;
import net.recache.integration.spring.RecacheSpringConfig;
import net.recache.integration.spring.metrics.MicrometerRecoveryListener;
import net.recache.integration.spring.sched.RecacheSchedulers;
import net.recache.integration.spring.sched.StaleJobReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import javax.sql.DataSource;

@AutoConfiguration
@EnableConfigurationProperties(RecacheProperties.class)
@Import(RecacheSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class RecacheAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(RecacheAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(WorkQueuePublisher.class)
    public WorkQueuePublisher workQueuePublisher(DataSource ds,
                                                 ObjectProvider<ObjectMapper> mapper,
                                                 RecacheProperties props) {
        return new JdbcWorkQueuePublisher(ds, mapper.getIfAvailable(ObjectMapper::new),
                props.getQueue().getRoutingKey());
    }

    @Bean
    @ConditionalOnMissingBean(RecoveryListener.class)
    public RecoveryListener recoveryListener(ObjectProvider<MeterRegistry> registry) {
        MeterRegistry r = registry.getIfAvailable();
        return r == null ? RecoveryListener.NOOP : new MicrometerRecoveryListener(r);
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ResumeExecutor resumeExecutor(JobStateRepository jobs,
                                         CollectionSource collections,
                                         WorkQueuePublisher queue,
                                         TxRunner tx,
                                         Clock clock,
                                         RecoveryListener listener) {
        return new ResumeExecutor(jobs, collections, queue, tx, clock, listener);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RecoveryCoordinator recoveryCoordinator(JobStateRepository jobs,
                                                   ResumeExecutor executor,
                                                   TxRunner tx,
                                                   Clock clock,
                                                   RecoveryListener listener,
                                                   RecacheProperties props) {
        return new RecoveryCoordinator(jobs, executor, tx, clock, listener, props.getRecovery().getResumeTimeout());
    }

    // --- 스케줄러 등록 (주기는 recache.cleanup.delay-ms / recache.stale.delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "recache.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RecacheSchedulers recacheSchedulers(RecoveryCoordinator coordinator, RecacheProperties props) {
        var s = new RecacheSchedulers(coordinator);
        s.setRetentionDays(props.getCleanup().getRetentionDays());
        return s;
    }

    @Bean
    @ConditionalOnProperty(prefix = "recache.stale", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StaleJobReporter staleJobReporter(RecoveryCoordinator coordinator, RecacheProperties props) {
        var r = new StaleJobReporter(coordinator);
        r.setStaleThreshold(props.getStale().getThreshold());
        return r;
    }

    @Bean
    @ConditionalOnProperty(prefix = "recache.recovery", name = "on-startup", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner recoveryRunner(RecoveryCoordinator coordinator) {
        return args -> {
            RecoveryReport report = coordinator.recoverIncompleteJobs();
            log.info("Startup recovery finished: recovered={} failed={} timedOut={}",
                    report.recovered(), report.failed(), report.timedOut());
        };
    }
}
