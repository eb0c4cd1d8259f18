package fpt.com.patientrecordservices.common.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AsyncConfigTest {

    private static final Path MAIN_PROPERTIES = Path.of("src/main/resources/application.properties");

    @Test
    void profileQueryExecutor_withDefaults_shouldMatchShippedConfiguration() throws Exception {
        ProfileProperties defaults = new ProfileProperties();
        Properties shipped = new Properties();
        try (Reader reader = Files.newBufferedReader(MAIN_PROPERTIES)) {
            shipped.load(reader);
        }

        assertEquals(Integer.parseInt(shipped.getProperty("app.profile.core-pool-size")), defaults.getCorePoolSize());
        assertEquals(Integer.parseInt(shipped.getProperty("app.profile.max-pool-size")), defaults.getMaxPoolSize());
    }

    @Test
    void profileQueryExecutor_withDefaults_shouldNotOutgrowConnectionPool() throws Exception {
        Properties shipped = new Properties();
        try (Reader reader = Files.newBufferedReader(MAIN_PROPERTIES)) {
            shipped.load(reader);
        }
        // ${DATABASE_POOL_SIZE:20}
        String hikari = shipped.getProperty("spring.datasource.hikari.maximum-pool-size");
        int connections = Integer.parseInt(hikari.substring(hikari.indexOf(':') + 1, hikari.indexOf('}')));

        ThreadPoolTaskExecutor executor = new AsyncConfig().profileQueryExecutor(new ProfileProperties());
        try {
            assertTrue(executor.getMaxPoolSize() <= connections);
            assertTrue(executor.getCorePoolSize() <= executor.getMaxPoolSize());
            assertEquals("profile-query-", executor.getThreadNamePrefix());
        } finally {
            executor.shutdown();
        }
    }
}
