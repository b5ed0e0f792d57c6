package peopleops.compensation.testing;

import io.quarkus.test.common.QuarkusTestResourceLifecycleManager;

import java.util.Map;

/**
 * Points Quarkus tests at an in-memory H2 database running in PostgreSQL mode.
 *
 * <p>
 * {@code LOCK_TIMEOUT} is raised so concurrent claim tests wait on row locks instead of failing immediately.
 */
public class H2TestResource implements QuarkusTestResourceLifecycleManager {

    private static final String JDBC_URL = "jdbc:h2:mem:compensation-tests;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;"
            + "DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";

    @Override
    public Map<String, String> start() {
        return Map.of("quarkus.datasource.username", "sa", "quarkus.datasource.password", "sa",
                "quarkus.datasource.jdbc.url", JDBC_URL, "quarkus.datasource.jdbc.driver", "org.h2.Driver",
                "quarkus.datasource.devservices.enabled", "false");
    }

    @Override
    public void stop() {
        // In-memory database is discarded when the JVM exits
    }
}
