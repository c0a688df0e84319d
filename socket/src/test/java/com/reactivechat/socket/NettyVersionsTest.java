package com.reactivechat.socket;

import io.netty.util.Version;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Reactor Netty and Lettuce share Netty; mixed module versions fail at request time.
 */
class NettyVersionsTest {

    @Test
    void testAllNettyModulesShareOneVersion() {
        Map<String, Version> modules = Version.identify();
        assertTrue(modules.containsKey("netty-common"));
        assertTrue(modules.containsKey("netty-codec-http"));

        // tcnative has its own release line
        Set<String> versions = modules.values().stream()
            .filter(version -> !version.artifactId().startsWith("netty-tcnative"))
            .map(Version::artifactVersion)
            .collect(Collectors.toSet());

        assertEquals(1, versions.size(), "Netty modules on the classpath: " + modules);
    }
}
