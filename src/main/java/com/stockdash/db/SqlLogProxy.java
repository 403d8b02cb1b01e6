package com.stockdash.db;

import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

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
 * JDBC proxies that log every executed statement, tagged with the migration id
 * found in the log4j {@link ThreadContext} under {@link Database#LOG_CONTEXT_MIGRATION}.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch");
    private static final int MAX_SQL_LENGTH = 600;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return proxy(Connection.class, (self, method, args) -> {
            Object out = invoke(delegate, method, args);
            if ("prepareStatement".equals(method.getName()) && out instanceof PreparedStatement
                    && args != null && args.length > 0 && args[0] instanceof String) {
                return proxy(PreparedStatement.class, new StatementHandler(out, (String) args[0], logger));
            }
            if ("createStatement".equals(method.getName()) && out instanceof Statement) {
                return proxy(Statement.class, new StatementHandler(out, null, logger));
            }
            return out;
        });
    }

    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static final class StatementHandler implements InvocationHandler {
        private final Object delegate;
        private final String preparedSql;
        private final Logger logger;

        private StatementHandler(Object delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (!EXECUTE_METHODS.contains(method.getName())) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql;
            if (sql == null && args != null && args.length > 0 && args[0] instanceof String) {
                sql = (String) args[0];
            }
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                if (logger.isDebugEnabled()) {
                    logger.debug("SQL ok migration={} method={} elapsed_ms={} sql={}",
                            migrationTag(), method.getName(), elapsedMs(started), normalize(sql));
                }
                return out;
            } catch (Throwable error) {
                logger.warn("SQL fail migration={} method={} elapsed_ms={} err={} sql={}",
                        migrationTag(), method.getName(), elapsedMs(started), error.getMessage(), normalize(sql));
                throw error;
            }
        }
    }

    private static String migrationTag() {
        String id = ThreadContext.get(Database.LOG_CONTEXT_MIGRATION);
        return id == null ? "-" : id;
    }

    private static String elapsedMs(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String normalize(String sql) {
        if (sql == null) {
            return "";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= MAX_SQL_LENGTH ? oneLine : oneLine.substring(0, MAX_SQL_LENGTH) + "...";
    }
}
