package com.tcrimer.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * Dynamic proxies that log every statement execution with its elapsed time to the {@code SQL} logger.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch");
    private static final int MAX_SQL_CHARS = 800;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                (proxy, method, args) -> {
                    Object out = invoke(delegate, method, args);
                    String name = method.getName();
                    if (out instanceof PreparedStatement ps && "prepareStatement".equals(name)
                            && args != null && args.length > 0 && args[0] instanceof String sql) {
                        return wrapStatement(ps, PreparedStatement.class, sql, logger);
                    }
                    if (out instanceof Statement st && "createStatement".equals(name)) {
                        return wrapStatement(st, Statement.class, null, logger);
                    }
                    return out;
                }
        );
    }

    private static <S extends Statement> S wrapStatement(S delegate, Class<S> type, String preparedSql, Logger logger) {
        InvocationHandler handler = new StatementHandler(delegate, preparedSql, logger);
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class[]{type}, handler));
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static final class StatementHandler implements InvocationHandler {
        private final Statement delegate;
        private final String preparedSql;
        private final Logger logger;
        private int pendingBatch;

        private StatementHandler(Statement delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if ("addBatch".equals(name)) {
                pendingBatch++;
            }
            if (!EXECUTE_METHODS.contains(name)) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql != null ? preparedSql
                    : args != null && args.length > 0 && args[0] instanceof String text ? text : "";
            if (name.endsWith("Batch")) {
                sql = sql + " [batch=" + pendingBatch + "]";
                pendingBatch = 0;
            }
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                if (logger.isInfoEnabled()) {
                    logger.info("SQL ok method={} elapsed_ms={}{} sql={}", name, millis(started), summary(out), normalize(sql));
                }
                return out;
            } catch (Throwable t) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}", name, millis(started), t.getMessage(), normalize(sql));
                throw t;
            }
        }
    }

    private static String millis(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String summary(Object result) {
        if (result instanceof Integer || result instanceof Long) {
            return " rows=" + result;
        }
        if (result instanceof int[] counts) {
            return " batch_size=" + counts.length;
        }
        if (result instanceof long[] counts) {
            return " batch_size=" + counts.length;
        }
        return "";
    }

    private static String normalize(String sql) {
        String normalized = sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= MAX_SQL_CHARS ? normalized : normalized.substring(0, MAX_SQL_CHARS) + "...";
    }
}
