package plantcare.engine;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LimiterConfigTest {

    @Test
    void testDefaults() {
        LimiterConfig config = LimiterConfig.defaults();

        assertEquals(100, config.maxCalls());
        assertEquals(60, config.windowSeconds());
        assertEquals(60_000L, config.windowMillis());
        assertEquals(10_000, config.maxClients());
        assertTrue(config.isExempt("/health"));
        assertTrue(config.isExempt("/health/detailed"));
        assertFalse(config.isExempt("/api/v1/health"));
        assertFalse(config.isExempt(null));
    }

    @Test
    void testExemptPaths_areCopiedDefensively() {
        Set<String> paths = new HashSet<>(Set.of("/status"));
        LimiterConfig config = LimiterConfig.of(10, 10).withExemptPaths(paths);

        paths.add("/late");

        assertTrue(config.isExempt("/status"));
        assertFalse(config.isExempt("/late"));
        assertThrows(UnsupportedOperationException.class, () -> config.exemptPaths().add("/x"));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> LimiterConfig.of(0, 60));
        assertThrows(IllegalArgumentException.class, () -> LimiterConfig.of(10, 0));
        assertThrows(IllegalArgumentException.class, () -> LimiterConfig.of(10, 60).withMaxClients(0));
        assertThrows(IllegalArgumentException.class, () -> LimiterConfig.of(10, 60).withExemptPaths(null));
    }
}
