package org.tsappend.cli.config;

import java.net.URL;
import java.util.Map;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

/**
 * Applies the {@code tsappend.logging} block to Logback.
 * <pre>
 * tsappend.logging {
 *   format = COLOR            # or PLAIN
 *   level = INFO              # root level
 *   loggers {                 # per-logger overrides
 *     "org.tsappend.datapipeline.merge" = DEBUG
 *   }
 * }
 * </pre>
 * {@code logback.xml} picks its console appender from the {@value #FORMAT_PROPERTY} system
 * property, so a format change reloads the Logback configuration.
 */
public final class LoggingConfigurator {

    static final String FORMAT_PROPERTY = "tsappend.logging.appender";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath("tsappend.logging")) {
            return;
        }
        Config logging = config.getConfig("tsappend.logging");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath("format")) {
            String appender = "PLAIN".equalsIgnoreCase(logging.getString("format")) ? "STDOUT_PLAIN" : "STDOUT";
            if (!appender.equals(System.getProperty(FORMAT_PROPERTY, "STDOUT"))) {
                System.setProperty(FORMAT_PROPERTY, appender);
                reload(context);
            }
        }
        if (logging.hasPath("level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(logging.getString("level"), Level.INFO));
        }
        if (logging.hasPath("loggers")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getObject("loggers").entrySet()) {
                String name = entry.getKey().replace("\"", "");
                context.getLogger(name).setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            }
        }
    }

    private static void reload(LoggerContext context) {
        URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
