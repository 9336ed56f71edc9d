package com.newscorpus.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정 + 사이즈 롤링(기본 2MB x 5).
 * SLF4J 호출은 slf4j-jdk14 바인딩을 통해 여기 설정된 핸들러로 간다.
 * - configure(outRoot): outRoot/logs 기준 초기화
 * - init(logDir): logs 디렉터리를 직접 넘겨 초기화
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /** outRoot/logs/harvest-%g.log 로 저장. System props:
     *  -Dnc.log.level=FINE|INFO|WARNING|SEVERE
     *  -Dnc.log.sizeMb=2
     *  -Dnc.log.files=5
     *  -Dnc.log.console=true|false (기본 true)
     */
    public static synchronized void configure(Path outRoot) {
        init(outRoot.resolve("logs"));
    }

    public static synchronized void init(Path logDir) {
        if (initialized) return;
        initialized = true;

        Level level = levelOf(System.getProperty("nc.log.level", "INFO"));
        int sizeMb  = parseInt(System.getProperty("nc.log.sizeMb"), 2);
        int fileCnt = parseInt(System.getProperty("nc.log.files"), 5);
        boolean toConsole = !"false".equalsIgnoreCase(System.getProperty("nc.log.console", "true"));

        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");
        root.setLevel(level);

        if (toConsole) {
            ConsoleHandler console = new ConsoleHandler();
            console.setLevel(level);
            console.setFormatter(LINE_FORMATTER);
            root.addHandler(console);
        }

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("harvest-%g.log").toString();
            FileHandler file = new FileHandler(pattern, sizeMb * 1024 * 1024, fileCnt, true);
            file.setLevel(level);
            file.setFormatter(LINE_FORMATTER);
            root.addHandler(file);

            Logger.getLogger(LogSetup.class.getName()).log(Level.CONFIG,
                    () -> "Log initialized. dir=" + logDir.toAbsolutePath() + ", level=" + level.getName());
        } catch (IOException e) {
            // 파일 로그 없이 콘솔만으로 진행
            Logger.getLogger(LogSetup.class.getName())
                    .log(Level.WARNING, "File logging disabled: " + e.getMessage(), e);
        }
    }

    /** 문자열을 Level로(실패 시 INFO). DEBUG/WARN 같은 SLF4J 이름도 받는다. */
    public static Level levelOf(String name) {
        String s = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "TRACE": return Level.FINEST;
            case "DEBUG": return Level.FINE;
            case "WARN":  return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(s); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
