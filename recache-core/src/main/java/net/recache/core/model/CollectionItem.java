package net.recache.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 컬렉션 구성 요소(이미지) 1건.
 * relativePath는 컬렉션 루트 기준 경로이며, 압축 파일 내부 항목은 "archive.zip#entry.jpg" 형식이다.
 */
public record CollectionItem(
        String id,
        String relativePath,
        String filename
) {
    public static final char ARCHIVE_ENTRY_SEPARATOR = '#';

    public CollectionItem {
        Objects.requireNonNull(id, "id");
        if (relativePath == null || relativePath.isEmpty()) relativePath = filename;
        Objects.requireNonNull(relativePath, "relativePath");
    }

    /** 원본 이미지의 전체 경로. 루트가 비어 있으면 상대 경로 그대로. */
    public String fullPath(String collectionRoot) {
        if (collectionRoot == null || collectionRoot.isEmpty()) return relativePath;

        int sep = relativePath.indexOf(ARCHIVE_ENTRY_SEPARATOR);
        if (sep >= 0) {
            String archive = relativePath.substring(0, sep);
            String entry = relativePath.substring(sep + 1);
            return resolve(collectionRoot, archive) + ARCHIVE_ENTRY_SEPARATOR + entry;
        }
        return resolve(collectionRoot, relativePath);
    }

    private static String resolve(String root, String path) {
        Path p = Path.of(path);
        if (p.isAbsolute()) return path;
        return Path.of(root).resolve(p).toString();
    }
}
