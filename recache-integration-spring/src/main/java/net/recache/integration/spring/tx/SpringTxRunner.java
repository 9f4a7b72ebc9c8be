package net.recache.integration.spring.tx;

import net.recache.adapter.jdbc.TxContext;
import net.recache.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** 스프링 트랜잭션의 커넥션을 TxContext에 꽂아 JDBC 저장소가 그대로 쓰게 한다 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        // REQUIRES_NEW 면 바깥 TxContext 를 잠시 내려둔다
        Connection outer = TxContext.get();
        boolean suspend = propagation == TransactionDefinition.PROPAGATION_REQUIRES_NEW && outer != null;
        if (suspend) TxContext.clear();
        try {
            return tpl.execute(status -> {
                if (TxContext.get() != null) return call(body); // 중첩 REQUIRED: 같은 커넥션

                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedFailure f) {
            // 검사 예외는 롤백 후 원래 타입으로 되던진다
            throw f.cause;
        } finally {
            if (suspend) TxContext.set(outer);
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedFailure(e);
        }
    }

    private static final class CheckedFailure extends RuntimeException {
        final Exception cause;

        CheckedFailure(Exception cause) {
            super(cause);
            this.cause = cause;
        }
    }
}
