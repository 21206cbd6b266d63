package io.relayq.config.impl;

import io.relayq.config.type.LogLevel;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Immutable config holder, loaded from broker.yaml or built in code.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BrokerConfig {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8888;

    @Builder.Default private String host = DEFAULT_HOST;
    @Builder.Default private int port = DEFAULT_PORT;
    @Builder.Default private LogLevel logLevel = LogLevel.INFO;
    @Builder.Default private boolean deadLetterEnabled = true;
    @Builder.Default private long shutdownGraceMillis = 5_000L;

    public static BrokerConfig defaults() {
        return BrokerConfig.builder().build();
    }

    /**
     * Reads a YAML file. Every key is optional and falls back to its default.
     */
    public static BrokerConfig load(final String path) throws IOException {
        final Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = yaml.load(in);
            if (m == null) return defaults();

            final BrokerConfigBuilder b = BrokerConfig.builder();

            if (m.containsKey("host"))                b.host(String.valueOf(m.get("host")));
            if (m.containsKey("port"))                b.port(validPort(((Number) m.get("port")).intValue()));
            if (m.containsKey("logLevel"))            b.logLevel(LogLevel.parse(String.valueOf(m.get("logLevel"))));
            if (m.containsKey("deadLetterQueue"))     b.deadLetterEnabled((Boolean) m.get("deadLetterQueue"));
            if (m.containsKey("shutdownGraceMillis")) b.shutdownGraceMillis(((Number) m.get("shutdownGraceMillis")).longValue());

            return b.build();
        } catch (final ClassCastException e) {
            throw new IllegalArgumentException("Malformed broker config " + path + ": " + e.getMessage(), e);
        }
    }

    public static int validPort(final int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port must be within 0..65535 but was " + port);
        }
        return port;
    }
}
