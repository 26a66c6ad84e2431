package com.hive.graph.load;

import java.util.Optional;

/**
 * Cache-side source for graph JSON (e.g. Redis). Implementations are provided by the runtime.
 */
@FunctionalInterface
public interface GraphSource {

    /**
     * @param key full key (see {@link GraphKeyBuilder#cacheKey(String, String)})
     * @return graph JSON if present
     */
    Optional<String> getFromCache(String key);

    /** Source that never has anything. */
    static GraphSource empty() {
        return key -> Optional.empty();
    }
}
