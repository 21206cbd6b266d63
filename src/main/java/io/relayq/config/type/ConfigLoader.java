package io.relayq.config.type;

import io.relayq.config.impl.BrokerConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads broker configuration from a YAML file by delegating to {@link BrokerConfig#load(String)}.
     *
     * @param path the path to the broker YAML configuration file
     * @return a populated {@link BrokerConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static BrokerConfig load(final String path) throws IOException {
        return BrokerConfig.load(path);
    }

    /**
     * Builds a config from command-line flags.
     * <p>
     * {@code -c/--config <file>} selects a YAML base file; the remaining flags override it:
     * <pre>
     * --host &lt;addr&gt;
     * -p, --port &lt;n&gt;
     * -ll, --loglevel &lt;fail|warn|info|dbug&gt;
     * -ndlq, --no-dead-letter-queue
     * </pre>
     * {@code -v/--version} and {@code -h/--help} are handled by the entry point and skipped here.
     *
     * @throws IllegalArgumentException on unknown flags or missing/invalid values
     * @throws IOException if the referenced config file cannot be read
     */
    public static BrokerConfig fromArgs(final String... args) throws IOException {
        String configPath = null;
        for (int i = 0; i < args.length; i++) {
            if ("-c".equals(args[i]) || "--config".equals(args[i])) {
                configPath = value(args, i);
            }
        }

        final BrokerConfig.BrokerConfigBuilder b = configPath == null
                ? BrokerConfig.builder()
                : load(configPath).toBuilder();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-c", "--config" -> i++;
                case "--host" -> b.host(value(args, i++));
                case "-p", "--port" -> b.port(BrokerConfig.validPort(parsePort(value(args, i++))));
                case "-ll", "--loglevel" -> b.logLevel(LogLevel.parse(value(args, i++)));
                case "-ndlq", "--no-dead-letter-queue" -> b.deadLetterEnabled(false);
                case "-v", "--version", "-h", "--help" -> {
                    // entry point concerns
                }
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        return b.build();
    }

    private static String value(final String[] args, final int flagIndex) {
        if (flagIndex + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[flagIndex]);
        }
        return args[flagIndex + 1];
    }

    private static int parsePort(final String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("port must be a number but was " + raw, e);
        }
    }
}
