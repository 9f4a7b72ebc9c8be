package net.recache.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드의 트랜잭션 커넥션. 저장소는 여기서만 커넥션을 얻는다. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    /** 트랜잭션 밖에서 저장소를 부르면 즉시 실패 */
    public static Connection required() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}
