package org.relua.resolver.discovery;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class DiscoveryOptionsTest {

    @Test
    void readsBuiltInDefaults() {
        ConfigFactory.invalidateCaches();
        DiscoveryOptions options = DiscoveryOptions.fromConfig(ConfigFactory.defaultReference());

        assertThat(options.searchRoots()).containsExactly(Path.of("."));
        assertThat(options.extensions()).containsExactly(".lua.unluac", ".lua");
        assertThat(options.readTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(options.workers()).isEqualTo(4);
        assertThat(options.maxDepth()).isZero();
    }

    @Test
    void overridesWinOverDefaults() {
        Config config = ConfigFactory.parseString("relua.discovery { workers = 1, read-timeout = 250ms }")
            .withFallback(ConfigFactory.defaultReference());

        DiscoveryOptions options = DiscoveryOptions.fromConfig(config);

        assertThat(options.workers()).isEqualTo(1);
        assertThat(options.readTimeout()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void missingBlockFailsFast() {
        assertThatThrownBy(() -> DiscoveryOptions.fromConfig(ConfigFactory.empty()))
            .isInstanceOf(ConfigException.Missing.class);
    }

    @Test
    void rejectsInvalidValues() {
        List<Path> roots = List.of(Path.of("."));
        List<String> extensions = List.of(".lua");
        Duration timeout = Duration.ofSeconds(1);

        assertThatThrownBy(() -> new DiscoveryOptions(roots, List.of(), timeout, 1, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DiscoveryOptions(roots, List.of("lua"), timeout, 1, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DiscoveryOptions(roots, extensions, Duration.ZERO, 1, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DiscoveryOptions(roots, extensions, timeout, 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DiscoveryOptions(roots, extensions, timeout, 1, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void depthLimitZeroMeansUnlimited() {
        DiscoveryOptions unlimited = new DiscoveryOptions(List.of(), List.of(".lua"), Duration.ofSeconds(1), 1, 0);
        DiscoveryOptions limited = unlimited.withMaxDepth(2);

        assertThat(unlimited.followsReferencesAt(1_000)).isTrue();
        assertThat(limited.followsReferencesAt(1)).isTrue();
        assertThat(limited.followsReferencesAt(2)).isFalse();
    }
}
