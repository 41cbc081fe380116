package io.concourse.driver;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.builder().build();

        assertEquals(Config.DEFAULT_HOST, config.getHost());
        assertEquals(Config.DEFAULT_PORT, config.getPort());
        assertEquals("http://localhost:1717", config.getBaseUrl());
        assertEquals(Config.DEFAULT_USERNAME, config.getUsername());
        assertEquals(Config.DEFAULT_PASSWORD, config.getPassword());
        assertEquals("", config.getEnvironment());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertTrue(config.isLogoutOnClose());
        assertNull(config.getHttpClient());
    }

    @Test
    void derivesBaseUrlFromHostAndPort() {
        Config config = Config.builder()
            .host(" db.internal ")
            .port(8080)
            .environment(" staging ")
            .build();

        assertEquals("http://db.internal:8080", config.getBaseUrl());
        assertEquals("staging", config.getEnvironment());
    }

    @Test
    void explicitBaseUrlWinsAndLosesTrailingSlash() {
        Config config = Config.builder()
            .host("ignored")
            .baseUrl("https://concourse.example.com/api/")
            .build();

        assertEquals("https://concourse.example.com/api", config.getBaseUrl());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().baseUrl("invalid").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().port(70000).build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().username("  ").build());
    }

    @Test
    void honoursCustomTimeoutAndIgnoresNonPositiveOnes() {
        Config custom = Config.builder()
            .httpTimeout(Duration.ofSeconds(5))
            .logoutOnClose(false)
            .build();
        assertEquals(Duration.ofSeconds(5), custom.getHttpTimeout());
        assertFalse(custom.isLogoutOnClose());

        Config zero = Config.builder().httpTimeout(Duration.ZERO).build();
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, zero.getHttpTimeout());
    }

    @Test
    void toStringOmitsPassword() {
        Config config = Config.builder().password("s3cret").build();

        assertFalse(config.toString().contains("s3cret"));
    }
}
