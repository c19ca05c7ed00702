package com.tcrimer.db.mybatis;

import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Shared MyBatis factory. Sessions run on a connection the caller leased from the pool; closing
 * the session does not close that connection's lease.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(nonClosing(connection));
    }

    /**
     * MyBatis wraps driver errors in runtime exceptions; recover the driver error so the data layer
     * can classify and retry it.
     */
    public static SQLException toSqlException(PersistenceException e) {
        for (Throwable cur = e; cur != null; cur = cur.getCause()) {
            if (cur instanceof SQLException sql) {
                return sql;
            }
        }
        return new SQLException("mybatis failure: " + e.getMessage(), e);
    }

    private static Connection nonClosing(Connection connection) {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                (proxy, method, args) -> {
                    if ("close".equals(method.getName())) {
                        return null;
                    }
                    try {
                        return method.invoke(connection, args);
                    } catch (InvocationTargetException e) {
                        throw e.getTargetException();
                    }
                }
        );
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.addMapper(BacktestResultMapper.class);
        config.addMapper(MetadataMapper.class);
        return new SqlSessionFactoryBuilder().build(config);
    }
}
