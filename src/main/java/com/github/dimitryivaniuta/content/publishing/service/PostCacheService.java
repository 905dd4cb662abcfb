package com.github.dimitryivaniuta.content.publishing.service;

import static com.github.dimitryivaniuta.content.publishing.config.CacheConfig.POST_CACHE;

import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

/**
 * Evicts cached post snapshots.
 *
 * <p>A separate bean so the cache proxy applies when lifecycle code calls it. With the
 * transaction-aware cache manager the eviction runs after commit.</p>
 */
@Service
public class PostCacheService {

    /**
     * Drops the snapshot of one post.
     *
     * @param postId post id
     */
    @CacheEvict(cacheNames = POST_CACHE, key = "#postId")
    public void evict(String postId) {
        // Spring Cache performs the eviction.
    }
}
