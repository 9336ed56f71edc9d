package com.newscorpus.core.parser;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * 사이트에 표시된 날짜 문자열 → LocalDateTime.
 *
 * 지원 형식:
 * <ul>
 *   <li>ISO-8601: {@code 2024-03-12T10:15:00+02:00}, {@code 2024-03-12T10:15}, {@code 2024-03-12}</li>
 *   <li>{@code 12.03.2024}, {@code 12.03.2024 10:15}, {@code 12.03.2024, 10:15}</li>
 *   <li>{@code 12 марта 2024}, {@code 12 марта 2024, 10:15}, {@code 12 March 2024 10:15}</li>
 *   <li>시각이 앞에 오는 형태: {@code 10:15, 12 марта 2024}</li>
 *   <li>{@code сегодня, 10:15} / {@code вчера в 10:15} (주입된 Clock 기준)</li>
 * </ul>
 * 해석 불가 입력은 empty. 연도가 빠진 날짜 등 추측이 필요한 값은 만들지 않는다.
 */
public final class DateNormalizer {

    private static final String TIME = "(?:[,\\s]+(?:в\\s+|at\\s+)?(\\d{1,2}):(\\d{2}))?";

    private static final Pattern NUMERIC = Pattern.compile(
            "^(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4})" + TIME + "$");
    private static final Pattern WORDY = Pattern.compile(
            "^(\\d{1,2})\\s+(\\p{L}+)\\.?\\s+(\\d{4})(?:\\s*г\\.?)?" + TIME + "$");
    private static final Pattern TIME_FIRST = Pattern.compile(
            "^(\\d{1,2}):(\\d{2})[,\\s]+(.+)$");
    private static final Pattern RELATIVE = Pattern.compile(
            "^(сегодня|вчера|today|yesterday)" + TIME + "$");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            // 생격(날짜 표기에서 쓰는 형태)
            entry("января", 1), entry("февраля", 2), entry("марта", 3), entry("апреля", 4),
            entry("мая", 5), entry("июня", 6), entry("июля", 7), entry("августа", 8),
            entry("сентября", 9), entry("октября", 10), entry("ноября", 11), entry("декабря", 12),
            // 주격
            entry("январь", 1), entry("февраль", 2), entry("март", 3), entry("апрель", 4),
            entry("май", 5), entry("июнь", 6), entry("июль", 7), entry("август", 8),
            entry("сентябрь", 9), entry("октябрь", 10), entry("ноябрь", 11), entry("декабрь", 12),
            // 약어
            entry("янв", 1), entry("фев", 2), entry("мар", 3), entry("апр", 4),
            entry("июн", 6), entry("июл", 7), entry("авг", 8), entry("сен", 9),
            entry("окт", 10), entry("ноя", 11), entry("дек", 12),
            // 영어
            entry("january", 1), entry("february", 2), entry("march", 3), entry("april", 4),
            entry("june", 6), entry("july", 7), entry("august", 8), entry("september", 9),
            entry("october", 10), entry("november", 11), entry("december", 12),
            entry("may", 5), entry("jan", 1), entry("feb", 2), entry("apr", 4), entry("jun", 6), entry("jul", 7),
            entry("aug", 8), entry("sep", 9), entry("sept", 9), entry("oct", 10), entry("nov", 11),
            entry("dec", 12));

    private final Clock clock;

    public DateNormalizer() {
        this(Clock.systemDefaultZone());
    }

    public DateNormalizer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Optional<LocalDateTime> normalize(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.replace('\u00A0', ' ').trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (s.isEmpty()) return Optional.empty();
        try {
            return Optional.ofNullable(parse(s, true));
        } catch (DateTimeException e) {
            // 31.02.2024 같은 잘못된 달력 값
            return Optional.empty();
        }
    }

    private LocalDateTime parse(String s, boolean allowTimeFirst) {
        LocalDateTime iso = parseIso(s);
        if (iso != null) return iso;

        Matcher m = NUMERIC.matcher(s);
        if (m.matches()) {
            return at(LocalDate.of(num(m, 3), num(m, 2), num(m, 1)), m, 4);
        }

        m = WORDY.matcher(s);
        if (m.matches()) {
            Integer month = MONTHS.get(m.group(2));
            if (month == null) return null;
            return at(LocalDate.of(num(m, 3), month, num(m, 1)), m, 4);
        }

        m = RELATIVE.matcher(s);
        if (m.matches()) {
            LocalDate today = LocalDate.now(clock);
            String word = m.group(1);
            LocalDate day = (word.equals("вчера") || word.equals("yesterday")) ? today.minusDays(1) : today;
            return at(day, m, 2);
        }

        if (allowTimeFirst) {
            m = TIME_FIRST.matcher(s);
            if (m.matches()) {
                LocalDateTime date = parse(m.group(3).trim(), false);
                if (date == null) return null;
                return date.toLocalDate().atTime(LocalTime.of(num(m, 1), num(m, 2)));
            }
        }
        return null;
    }

    private static LocalDateTime parseIso(String s) {
        String u = s.toUpperCase(Locale.ROOT);
        try { return OffsetDateTime.parse(u).toLocalDateTime(); } catch (DateTimeParseException ignore) { /* 다음 형식 */ }
        try { return LocalDateTime.parse(u); } catch (DateTimeParseException ignore) { /* 다음 형식 */ }
        try { return LocalDate.parse(u).atStartOfDay(); } catch (DateTimeParseException ignore) { /* 다음 형식 */ }
        return null;
    }

    /** hourGroup 위치에 시각이 있으면 적용, 없으면 00:00 */
    private static LocalDateTime at(LocalDate date, Matcher m, int hourGroup) {
        if (m.group(hourGroup) == null) return date.atStartOfDay();
        return date.atTime(LocalTime.of(num(m, hourGroup), num(m, hourGroup + 1)));
    }

    private static int num(Matcher m, int group) {
        return Integer.parseInt(m.group(group));
    }
}
