package net.recache.core.spi;

import net.recache.core.model.SourceCollection;

import java.util.Optional;

public interface CollectionSource {
    /**
     * 비어 있으면 "컬렉션이 실제로 없음"(재개 영구 차단 사유).
     * 일시적 조회 실패는 반드시 예외로 알려야 한다.
     */
    Optional<SourceCollection> findById(String collectionId) throws Exception;
}
