package net.recache.core.spi;

import java.util.concurrent.Callable;

/** 저장소 호출을 감싸는 트랜잭션 경계. JDBC/Spring 어댑터가 구현한다. */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;

    <T> T requiresNew(Callable<T> body) throws Exception;

    default void run(Body body) throws Exception {
        required(() -> { body.run(); return null; });
    }

    @FunctionalInterface
    interface Body {
        void run() throws Exception;
    }

    /** 트랜잭션이 필요 없는 저장소(인메모리 등)용 */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
