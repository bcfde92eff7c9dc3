package com.ryuqq.contentflow.adapter.filesystem.output;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 디렉토리 트리 유틸리티.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public final class FileTrees {

    private FileTrees() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 디렉토리를 내용과 함께 삭제.
     *
     * <p>심볼릭 링크는 따라가지 않고 링크 자체만 삭제합니다. 경로가 없으면 아무 동작도 하지 않습니다.</p>
     *
     * @param root 삭제할 경로
     * @throws IOException 삭제 실패 시
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root, java.nio.file.LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
