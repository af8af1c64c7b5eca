package net.jobsy.adapter.jdbc;

import java.sql.Connection;

/** Connection bound to the current thread by {@link JdbcTxRunner}. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    /** Repositories never open connections themselves. */
    public static Connection require() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}
