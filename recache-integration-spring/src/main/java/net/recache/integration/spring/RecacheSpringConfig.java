package net.recache.integration.spring;

import net.recache.adapter.jdbc.repo.JdbcCollectionSource;
import net.recache.adapter.jdbc.repo.JdbcJobStateRepository;
import net.recache.core.spi.Clock;
import net.recache.core.spi.CollectionSource;
import net.recache.core.spi.JobStateRepository;
import net.recache.core.spi.TxRunner;
import net.recache.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** 저장소/트랜잭션/시계 배선. 작업 큐 발행기는 라우팅 키 설정이 필요해 부트스트랩에서 등록한다 */
@Configuration
public class RecacheSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean public JobStateRepository jobStateRepository(DataSource ds) { return new JdbcJobStateRepository(ds); }
    @Bean public CollectionSource collectionSource(DataSource ds) { return new JdbcCollectionSource(ds); }

    @Bean public Clock systemClock() { return Clock.system(); }
}
