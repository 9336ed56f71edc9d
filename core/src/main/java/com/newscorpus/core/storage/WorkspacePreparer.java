package com.newscorpus.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 실행 전 출력 디렉터리 준비: 기존 트리를 통째로 지우고 빈 디렉터리를 다시 만든다.
 * 실행은 증분이 아니다. 실패는 IOException 으로 올라가며 호출자는 실행을 중단해야 한다.
 */
public final class WorkspacePreparer {

    private static final Logger LOG = LoggerFactory.getLogger(WorkspacePreparer.class);

    private WorkspacePreparer() {}

    public static Path prepare(Path dir) throws IOException {
        if (dir == null) throw new IOException("workspace directory is null");
        if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            deleteTree(dir);
            LOG.info("Workspace cleared: {}", dir.toAbsolutePath());
        }
        Files.createDirectories(dir);
        return dir;
    }

    private static void deleteTree(Path root) throws IOException {
        if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
            Files.delete(root);
            return;
        }
        List<Path> all;
        try (Stream<Path> walk = Files.walk(root)) {
            // 깊은 경로부터 지워야 디렉터리가 비어 있다
            all = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        for (Path p : all) {
            Files.delete(p);
        }
    }
}
