package co.deferworks.lode.driver;

import co.deferworks.lode.db.DatabaseMigrations;
import org.h2.jdbcx.JdbcDataSource;

import java.sql.SQLException;
import java.util.UUID;

final class H2Databases {

    private H2Databases() {
    }

    /**
     * A fresh in-memory database with the job tables in place.
     */
    static JdbcDataSource migrated() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        DatabaseMigrations.runMigrations(dataSource);
        return dataSource;
    }

    static long count(JdbcDataSource dataSource, String sql) throws SQLException {
        try (var connection = dataSource.getConnection();
             var statement = connection.createStatement();
             var resultSet = statement.executeQuery(sql)) {
            resultSet.next();
            return resultSet.getLong(1);
        }
    }
}
