package net.recache.core.path;

import java.nio.file.Path;
import java.util.Locale;

/**
 * 캐시 파일 경로 계산. 최초 제출과 재개가 같은 함수를 써야 "이미 처리됨" 판정이 유지된다.
 * 결과: {cacheRoot}/cache/{collectionId}/{itemId}_cache_{W}x{H}{ext}
 */
public final class CachePathResolver {
    public static final String CACHE_DIR = "cache";
    public static final String DEFAULT_EXTENSION = ".jpg";

    private CachePathResolver() {}

    public static String resolve(String cacheRoot,
                                 String collectionId,
                                 String itemId,
                                 int width,
                                 int height,
                                 String format) {
        if (collectionId == null || collectionId.isBlank()) throw new IllegalArgumentException("collectionId is required");
        if (itemId == null || itemId.isBlank()) throw new IllegalArgumentException("itemId is required");

        String fileName = itemId + "_cache_" + width + "x" + height + extensionOf(format);
        Path root = Path.of(cacheRoot == null ? "" : cacheRoot);
        return root.resolve(CACHE_DIR).resolve(collectionId).resolve(fileName).toString();
    }

    /** 알 수 없는 포맷은 jpeg와 같은 확장자 */
    public static String extensionOf(String format) {
        if (format == null) return DEFAULT_EXTENSION;
        return switch (format.trim().toLowerCase(Locale.ROOT)) {
            case "png" -> ".png";
            case "webp" -> ".webp";
            default -> DEFAULT_EXTENSION; // jpeg, jpg 포함
        };
    }
}
