package net.recache.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** 잡 대상 컬렉션의 현재 구성. 재개 때마다 새로 읽는다. */
public record SourceCollection(
        String id,
        String name,
        String rootPath,
        List<CollectionItem> items
) {
    public SourceCollection {
        Objects.requireNonNull(id, "id");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public Optional<CollectionItem> findItem(String itemId) {
        for (CollectionItem item : items) {
            if (item.id().equals(itemId)) return Optional.of(item);
        }
        return Optional.empty();
    }

    /** ID → 아이템. 중복 ID는 먼저 나온 것이 이긴다(findItem 과 같은 규칙) */
    public Map<String, CollectionItem> itemsById() {
        Map<String, CollectionItem> byId = new LinkedHashMap<>(items.size() * 2);
        for (CollectionItem item : items) byId.putIfAbsent(item.id(), item);
        return byId;
    }

    /** 순서 유지, 중복 제거 */
    public List<String> itemIds() {
        var ids = new LinkedHashSet<String>();
        for (CollectionItem item : items) ids.add(item.id());
        return new ArrayList<>(ids);
    }
}
