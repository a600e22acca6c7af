package co.deferworks.lode.driver;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;

/**
 * Picks the {@link JobStore} implementation matching a database.
 *
 * <pre>{@code
 * AbstractJdbcJobStore store = JobStores.forDataSource(dataSource);
 * AbstractJdbcJobStore store = JobStores.forJdbcUrl("jdbc:postgresql://localhost/app", dataSource);
 * }</pre>
 */
public final class JobStores {

    private JobStores() {
    }

    /**
     * Detects the database behind {@code dataSource} from its connection metadata.
     *
     * @throws IllegalArgumentException if the database is not supported
     */
    public static AbstractJdbcJobStore forDataSource(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        String url;
        try (var connection = dataSource.getConnection()) {
            url = connection.getMetaData().getURL();
        } catch (SQLException e) {
            throw new JobStoreException("Error reading database metadata", e);
        }
        return forJdbcUrl(url, dataSource);
    }

    /**
     * @throws IllegalArgumentException if the URL does not name a supported database
     */
    public static AbstractJdbcJobStore forJdbcUrl(String jdbcUrl, DataSource dataSource) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        var url = jdbcUrl.toLowerCase(Locale.ROOT);
        if (url.startsWith("jdbc:postgresql:")) {
            return new PostgresJobStore(dataSource);
        }
        if (url.startsWith("jdbc:h2:")) {
            return new H2JobStore(dataSource);
        }
        throw new IllegalArgumentException("Unsupported database: " + jdbcUrl
                + ". Supported: jdbc:postgresql:, jdbc:h2:");
    }
}
