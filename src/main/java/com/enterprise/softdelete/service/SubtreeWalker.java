package com.enterprise.softdelete.service;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.service.hierarchy.HierarchyNode;
import com.enterprise.softdelete.service.hierarchy.HierarchyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Subtree Walker
 *
 * 5W1H Analysis:
 * WHO: Cascade executor
 * WHAT: Breadth-first, level-by-level visit of a subtree
 * WHEN: Once to count remaining entities, once to delete them
 * WHERE: Reads children through the HierarchyStore
 * WHY: Depth is unbounded, so no recursion and no whole-tree load
 * HOW: Explicit frontier, children fetched in pages before the level is visited
 *
 * Deleted nodes are visited too, so survivors below them are still reached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubtreeWalker {

    private final HierarchyStore hierarchyStore;
    private final CascadeDeleteProperties properties;

    /**
     * Visit the subtree one level at a time, root level first.
     * With cascade=false only the root level is visited.
     */
    public void walk(UUID containerId, HierarchyNode root, boolean cascade, Consumer<List<HierarchyNode>> levelVisitor) {
        walk(containerId, root, cascade, levelVisitor, () -> { });
    }

    /**
     * Same walk, calling {@code onPage} after every page of children read
     */
    public void walk(
        UUID containerId,
        HierarchyNode root,
        boolean cascade,
        Consumer<List<HierarchyNode>> levelVisitor,
        Runnable onPage
    ) {
        List<HierarchyNode> frontier = List.of(root);
        int depth = 0;

        while (!frontier.isEmpty()) {
            List<HierarchyNode> next = cascade ? fetchChildren(containerId, root.getId(), frontier, onPage) : List.of();

            levelVisitor.accept(frontier);

            log.trace("Visited level: containerId={}, rootId={}, depth={}, size={}",
                containerId, root.getId(), depth, frontier.size());

            frontier = next;
            depth++;
        }
    }

    /**
     * Number of entities in the subtree that are not deleted yet
     */
    public int countRemaining(UUID containerId, HierarchyNode root, boolean cascade) {
        return countRemaining(containerId, root, cascade, () -> { });
    }

    public int countRemaining(UUID containerId, HierarchyNode root, boolean cascade, Runnable onPage) {
        int[] remaining = {0};
        walk(containerId, root, cascade, level -> {
            for (HierarchyNode node : level) {
                if (!node.isDeleted()) {
                    remaining[0]++;
                }
            }
        }, onPage);
        return remaining[0];
    }

    private List<HierarchyNode> fetchChildren(UUID containerId, UUID rootId, List<HierarchyNode> parents, Runnable onPage) {
        int pageSize = Math.max(1, properties.getChildPageSize());
        List<HierarchyNode> children = new ArrayList<>();
        Set<UUID> levelIds = new HashSet<>();

        for (int from = 0; from < parents.size(); from += pageSize) {
            List<UUID> chunk = parents.subList(from, Math.min(from + pageSize, parents.size()))
                .stream()
                .map(HierarchyNode::getId)
                .toList();

            int page = 0;
            List<HierarchyNode> batch;
            do {
                batch = hierarchyStore.findChildren(containerId, chunk, page++, pageSize);
                for (HierarchyNode child : batch) {
                    // One parent per entity: a revisit can only come through a loop back to the root
                    if (!child.getId().equals(rootId) && levelIds.add(child.getId())) {
                        children.add(child);
                    }
                }
                onPage.run();
            } while (batch.size() == pageSize);
        }
        return children;
    }
}
