package nl.nfi.probregex.common.logger;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.tyler.TylerConfiguratorBase;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeAndTimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;

import static nl.nfi.probregex.common.HostUtils.hostname;

// file logging only when a log directory is given, otherwise the root logger stays without appenders
public final class LoggerConfigurator extends TylerConfiguratorBase implements Configurator {

    static {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
    }

    public static final String LOG_DIRECTORY_PROPERTY = "LOG_DIRECTORY_PATH";

    private static final String LOG_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

    @Override
    public ExecutionStatus configure(final LoggerContext loggerContext) {
        final String logDirectoryPath = System.getProperty(LOG_DIRECTORY_PROPERTY);
        if (logDirectoryPath == null) {
            return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
        }

        setContext(loggerContext);

        final Appender<ILoggingEvent> appender = createFileAppender(logDirectoryPath);
        final Logger root = setupLogger("ROOT", "INFO", null);
        root.addAppender(appender);
        setupLogger("nl.nfi.probregex", "DEBUG", null);

        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    private Appender<ILoggingEvent> createFileAppender(final String logDirectoryPath) {
        final String logFilePath = logDirectoryPath + "/prob_regex-" + hostname() + ".log";
        final String rollPathPattern = logDirectoryPath + "/prob_regex-" + hostname() + ".%d{yyyy-MM-dd}.%i.gz";

        final RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName("FILE");
        appender.setFile(logFilePath);

        final SizeAndTimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new SizeAndTimeBasedRollingPolicy<>();
        rollingPolicy.setContext(context);
        rollingPolicy.setFileNamePattern(rollPathPattern);
        rollingPolicy.setMaxFileSize(FileSize.valueOf("100MB"));
        rollingPolicy.setMaxHistory(14);
        rollingPolicy.setTotalSizeCap(FileSize.valueOf("1GB"));
        rollingPolicy.setParent(appender);
        rollingPolicy.start();

        appender.setRollingPolicy(rollingPolicy);

        final PatternLayoutEncoder layoutEncoder = new PatternLayoutEncoder();
        layoutEncoder.setContext(context);
        layoutEncoder.setPattern(LOG_PATTERN);
        layoutEncoder.setParent(appender);
        layoutEncoder.start();

        appender.setEncoder(layoutEncoder);

        appender.start();
        return appender;
    }
}
