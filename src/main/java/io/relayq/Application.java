package io.relayq;

import ch.qos.logback.classic.Logger;
import io.relayq.broker.Broker;
import io.relayq.config.impl.BrokerConfig;
import io.relayq.config.type.ConfigLoader;
import io.relayq.config.type.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Main class to start the RelayQ broker.
 */
@Slf4j
public class Application {

    static final String VERSION = "0.2.0";

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: java -jar relayq.jar [options]",
            "  -c,    --config <file>           YAML config file; flags below override it",
            "         --host <host>             address to listen on, 0.0.0.0 makes the broker public (default "
                    + BrokerConfig.DEFAULT_HOST + ")",
            "  -p,    --port <port>             port to listen on (default " + BrokerConfig.DEFAULT_PORT + ")",
            "  -ll,   --loglevel <level>        fail | warn | info | dbug (default info)",
            "  -ndlq, --no-dead-letter-queue    drop messages whose retries ran out instead of dead-lettering them",
            "  -v,    --version                 print the version and exit",
            "  -h,    --help                    print this help and exit");

    public static void main(final String[] args) throws Exception {
        final List<String> argList = Arrays.asList(args);
        if (argList.contains("-h") || argList.contains("--help")) {
            System.out.println(USAGE);
            return;
        }
        if (argList.contains("-v") || argList.contains("--version")) {
            System.out.println("relayq v." + VERSION);
            return;
        }

        final BrokerConfig cfg;
        try {
            cfg = ConfigLoader.fromArgs(args);
        } catch (final IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }

        applyLogLevel(cfg.getLogLevel());

        final Broker broker = new Broker(cfg);
        broker.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down RelayQ...");
                broker.close();
                log.info("Shutdown complete.");
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted during shutdown", e);
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            }
        }));
    }

    static void applyLogLevel(final LogLevel level) {
        final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(level.toLogbackLevel());
        final Logger broker = (Logger) LoggerFactory.getLogger("io.relayq");
        broker.setLevel(level.toLogbackLevel());
    }
}
