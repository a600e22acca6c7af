package co.deferworks.lode.driver;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * H2 job store. Uses the portable claim-by-conditional-update reservation; H2 reports a
 * concurrent update of the same row as error 90131, which only ends one claim attempt.
 */
public class H2JobStore extends AbstractJdbcJobStore {

    private static final int CONCURRENT_UPDATE = 90131;

    public H2JobStore(DataSource dataSource) {
        super(dataSource);
    }

    public H2JobStore(DataSource dataSource, String jobsTable, String failedJobsTable) {
        super(dataSource, jobsTable, failedJobsTable);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    protected boolean isLostRace(SQLException e) {
        return e.getErrorCode() == CONCURRENT_UPDATE || super.isLostRace(e);
    }
}
