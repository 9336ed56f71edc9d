package com.newscorpus.core.storage;

import java.nio.file.Path;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 코퍼스 디렉터리 안의 파일 이름 규칙: {@code <id>_raw.txt}, {@code <id>_meta.json}, {@code <id>_cleaned.txt} */
public final class ArticleNaming {

    public static final String RAW_SUFFIX = "_raw";
    public static final String META_SUFFIX = "_meta";
    public static final String CLEANED_SUFFIX = "_cleaned";
    public static final String TEXT_EXT = "txt";
    public static final String META_EXT = "json";

    private ArticleNaming() {}

    public static String rawName(int id) { return id + RAW_SUFFIX + "." + TEXT_EXT; }
    public static String metaName(int id) { return id + META_SUFFIX + "." + META_EXT; }
    public static String cleanedName(int id) { return id + CLEANED_SUFFIX + "." + TEXT_EXT; }

    public static Path rawPath(Path dir, int id) { return dir.resolve(rawName(id)); }
    public static Path metaPath(Path dir, int id) { return dir.resolve(metaName(id)); }
    public static Path cleanedPath(Path dir, int id) { return dir.resolve(cleanedName(id)); }

    /** {@code <id>_raw.<ext>} 형태의 파일 이름을 받는 패턴. id 그룹은 1번. */
    public static Pattern rawPattern(String ext) {
        return Pattern.compile("^(\\d+)" + Pattern.quote(RAW_SUFFIX + "." + ext) + "$");
    }

    /** 숫자 범위와 무관하게 이름이 {@code <id>_raw.<ext>} 형태인지 */
    public static boolean isRawName(String fileName, String ext) {
        return fileName != null && rawPattern(ext).matcher(fileName).matches();
    }

    /**
     * 이름이 {@code <id>_raw.<ext>} 이면 id, 아니면 empty.
     * 숫자가 int 범위를 넘어도 empty 이므로 형태 판정은 {@link #isRawName} 으로 따로 한다.
     */
    public static OptionalInt parseRawId(String fileName, String ext) {
        if (fileName == null) return OptionalInt.empty();
        Matcher m = rawPattern(ext).matcher(fileName);
        if (!m.matches()) return OptionalInt.empty();
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
