package com.findinpath.hierarchy.service;

import com.findinpath.hierarchy.model.HierarchyChangedEvent;
import com.findinpath.hierarchy.model.HierarchyKind;
import com.findinpath.hierarchy.model.TreeNode;
import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Keeps in memory the forest of trees of every kind which has been requested.
 * The cached forest of a kind is dropped as soon as a {@link HierarchyChangedEvent}
 * for that kind is posted on the event bus.
 * <p>
 * Every cached forest remembers the version of its kind it was loaded at. A forest loaded before
 * the latest change of its kind is never handed out, even when the change was posted while the
 * forest was still being loaded.
 */
public class HierarchyTreeCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(HierarchyTreeCache.class);

    private final LoadingCache<HierarchyKind, VersionedTree> treeCache;
    private final Map<HierarchyKind, AtomicLong> versions = new EnumMap<>(HierarchyKind.class);

    /**
     * @param treeLoader builds the forest of a kind from the persistence, usually {@link HierarchyStore#getTree(HierarchyKind)}
     * @param eventBus   the event bus on which the hierarchy changes are posted
     */
    public HierarchyTreeCache(Function<HierarchyKind, List<TreeNode>> treeLoader,
                              EventBus eventBus) {
        for (var kind : HierarchyKind.values()) {
            versions.put(kind, new AtomicLong());
        }
        treeCache = CacheBuilder.newBuilder()
                .build(
                        new CacheLoader<>() {
                            @Override
                            public VersionedTree load(HierarchyKind kind) {
                                // read before loading, a change during the load makes the tree outdated
                                var version = versions.get(kind).get();
                                return new VersionedTree(version, List.copyOf(treeLoader.apply(kind)));
                            }
                        }
                );
        eventBus.register(this);
    }

    /**
     * The returned forest is shared by all the callers and can not be modified.
     */
    public List<TreeNode> getTree(HierarchyKind kind) {
        while (true) {
            VersionedTree versionedTree;
            try {
                versionedTree = treeCache.getUnchecked(kind);
            } catch (UncheckedExecutionException e) {
                Throwables.throwIfUnchecked(e.getCause());
                throw e;
            }
            if (versionedTree.version == versions.get(kind).get()) {
                return versionedTree.tree;
            }
            LOGGER.debug("The {} hierarchy changed while its tree was being loaded, loading it again", kind);
            treeCache.asMap().remove(kind, versionedTree);
        }
    }

    @Subscribe
    public void onHierarchyChanged(HierarchyChangedEvent event) {
        LOGGER.debug("Invalidating the cached {} tree after {}", event.getKind(), event);
        versions.get(event.getKind()).incrementAndGet();
        treeCache.invalidate(event.getKind());
    }

    private static class VersionedTree {
        private final long version;
        private final List<TreeNode> tree;

        private VersionedTree(long version, List<TreeNode> tree) {
            this.version = version;
            this.tree = tree;
        }
    }
}
