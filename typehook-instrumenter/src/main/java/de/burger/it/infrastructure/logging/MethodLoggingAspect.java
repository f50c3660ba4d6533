package de.burger.it.infrastructure.logging;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.AfterThrowing;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.annotation.Pointcut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logs entry, exit and failure of the engine's public operations under the target class logger.
 * Active only where the aspect is woven (load-time weaving in tests, or a consumer's own build);
 * without weaving the engine logs through its own loggers only.
 */
@SuppressWarnings("AspectJ") // weaving is opt-in, the IDE cannot see it
@Aspect
public class MethodLoggingAspect {

    // Code-style accessors expected by load-time weaving of an annotation-style aspect.
    private static final MethodLoggingAspect INSTANCE = new MethodLoggingAspect();
    public static MethodLoggingAspect aspectOf() { return INSTANCE; }
    public static boolean hasAspect() { return true; }

    private static final Logger LOG = LoggerFactory.getLogger(MethodLoggingAspect.class);
    private static final Map<Class<?>, Logger> PER_CLASS_LOGGERS = new ConcurrentHashMap<>();
    private static final ThreadLocal<Long> START_NS = new ThreadLocal<>();
    private static final String CID = "cid";

    // Optional file mirror, independent of the SLF4J provider.
    static final String LOG_FILE_PROP = "typehook.logFile";
    static final String LOG_TO_FILE_PROP = "typehook.logToFile";
    private static final String DEFAULT_LOG_FILE = "logs/typehook.log";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    @Pointcut("execution(public * de.burger.typehook.TypeHookEngine.*(..))")
    public void engineOps() {}

    @Before("engineOps() && !@annotation(de.burger.it.infrastructure.logging.SuppressLogging)")
    public void onEnter(final JoinPoint jp) {
        MDC.put(CID, Optional.ofNullable(MDC.get(CID))
                .filter(s -> !s.isBlank())
                .orElseGet(() -> UUID.randomUUID().toString()));
        START_NS.set(System.nanoTime());

        final String msg = String.format("→ %s %s", shortSig(jp), argsOf(jp));
        loggerFor(jp).debug(msg);
        fileLog("DEBUG", msg);
    }

    @AfterReturning("engineOps() && !@annotation(de.burger.it.infrastructure.logging.SuppressLogging)")
    public void onReturn(final JoinPoint jp) {
        final String msg = String.format("← %s OK in %d ms", shortSig(jp), elapsedMillis());
        loggerFor(jp).debug(msg);
        fileLog("DEBUG", msg);
    }

    @AfterThrowing(pointcut = "engineOps() && !@annotation(de.burger.it.infrastructure.logging.SuppressLogging)", throwing = "ex")
    public void onThrow(final JoinPoint jp, final Throwable ex) {
        final String msg = String.format("✖ %s failed in %d ms: %s", shortSig(jp), elapsedMillis(), ex.getMessage());
        loggerFor(jp).error(msg, ex);
        fileLog("ERROR", msg + " (see stacktrace in console)");
    }

    private long elapsedMillis() {
        final Long started = START_NS.get();
        START_NS.remove();
        final long now = System.nanoTime();
        return TimeUnit.NANOSECONDS.toMillis(now - (started != null ? started : now));
    }

    private Logger loggerFor(JoinPoint jp) {
        final Class<?> type = jp.getSignature().getDeclaringType();
        return PER_CLASS_LOGGERS.computeIfAbsent(type, LoggerFactory::getLogger);
    }

    private String shortSig(JoinPoint jp) {
        return jp.getSignature().toShortString();
    }

    /** Arguments rendered by type only; syntax trees are far too large to print per call. */
    private String argsOf(JoinPoint jp) {
        return Arrays.stream(jp.getArgs())
                .map(this::describe)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private String describe(Object o) {
        if (o instanceof CharSequence text) {
            return "'" + text + "'";
        }
        return Optional.ofNullable(o).map(v -> v.getClass().getSimpleName()).orElse("null");
    }

    static void fileLog(String level, String message) {
        if (!Boolean.parseBoolean(System.getProperty(LOG_TO_FILE_PROP, "false"))) {
            return;
        }
        final File file = new File(System.getProperty(LOG_FILE_PROP, DEFAULT_LOG_FILE));
        final File parent = file.getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            LOG.debug("Cannot create log directory {}", parent);
            return;
        }
        final String cid = Objects.requireNonNullElse(MDC.get(CID), "-");
        final String line = TIMESTAMP.format(LocalDateTime.now()) + " [" + level + "] [cid=" + cid + "] " + message + "\n";
        try (FileWriter fw = new FileWriter(file, StandardCharsets.UTF_8, true)) {
            fw.write(line);
        } catch (IOException e) {
            // The mirror is a convenience; the SLF4J line has already been written.
            LOG.debug("File log mirror {} not writable", file, e);
        }
    }
}
