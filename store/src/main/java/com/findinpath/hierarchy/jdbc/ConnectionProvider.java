package com.findinpath.hierarchy.jdbc;

import com.findinpath.hierarchy.Utils;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * This class acts as a provider for a {@link Connection} from
 * {@link HikariDataSource}.
 */
public class ConnectionProvider implements AutoCloseable {

    private static final String POOL_NAME = "hierarchy-store";

    private final HikariDataSource dataSource;

    public ConnectionProvider(String driverClassName,
                              String jdbcUrl,
                              String username,
                              String password) {
        this(createConfig(driverClassName, jdbcUrl, username, password));
    }

    public ConnectionProvider(HikariConfig config) {
        if (config.getPoolName() == null) {
            config.setPoolName(POOL_NAME);
        }
        this.dataSource = new HikariDataSource(config);
    }

    /**
     * Creates a provider out of HikariCP properties (e.g. <code>jdbcUrl</code>, <code>username</code>,
     * <code>password</code>, <code>maximumPoolSize</code>).
     */
    public static ConnectionProvider fromProperties(Properties properties) {
        return new ConnectionProvider(new HikariConfig(properties));
    }

    /**
     * Creates a provider out of a HikariCP properties file found on the classpath.
     */
    public static ConnectionProvider fromClasspathResource(String resourceName) {
        var properties = new Properties();
        try (InputStream inputStream = ConnectionProvider.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("The resource " + resourceName + " can not be found on the classpath");
            }
            properties.load(inputStream);
        } catch (IOException e) {
            Utils.sneakyThrow(e);
        }
        return fromProperties(properties);
    }

    private static HikariConfig createConfig(String driverClassName,
                                             String jdbcUrl,
                                             String username,
                                             String password) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setDriverClassName(driverClassName);
        config.setUsername(username);
        config.setPassword(password);
        return config;
    }

    public Connection getConnection() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            Utils.sneakyThrow(e);
            return null;
        }
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
