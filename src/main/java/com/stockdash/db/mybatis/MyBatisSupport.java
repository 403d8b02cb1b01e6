package com.stockdash.db.mybatis;

import org.apache.ibatis.datasource.unpooled.UnpooledDataSource;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.transaction.managed.ManagedTransactionFactory;

import java.sql.Connection;
import java.util.Properties;

/**
 * Centralized MyBatis bootstrap for the migration engine mappers.
 * Sessions borrow the caller's connection and never close it.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        ManagedTransactionFactory transactions = new ManagedTransactionFactory();
        Properties transactionProps = new Properties();
        transactionProps.setProperty("closeConnection", "false");
        transactions.setProperties(transactionProps);

        Configuration config = new Configuration(new Environment("stockdash", transactions, new UnpooledDataSource()));
        config.setMapUnderscoreToCamelCase(true);

        config.addMapper(AppliedMigrationMapper.class);
        config.addMapper(MigrationLogMapper.class);
        config.addMapper(MigrationBackupMapper.class);
        config.addMapper(SchemaMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
