package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderLink;
import org.qbitspark.knowledgefoldersbackend.folders_mng_service.repo.FolderSourceCount;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Direct and recursive counts for every folder, computed from one flat list of
 * folder links and one grouped source count.
 *
 * <p>Folders are held in arrays addressed by index; parent and child relations are
 * indices too. A folder whose parent id does not resolve counts as a root. Totals
 * are summed bottom-up over a breadth-first order from the roots, so the cost is
 * linear in the number of folders.
 */
public final class FolderCountSnapshot {

    private static final int NO_PARENT = -1;

    private final Map<UUID, Integer> indexById;
    private final long[] directSources;
    private final long[] directSubfolders;
    private final long[] totalSources;

    private FolderCountSnapshot(Map<UUID, Integer> indexById, long[] directSources,
                                long[] directSubfolders, long[] totalSources) {
        this.indexById = indexById;
        this.directSources = directSources;
        this.directSubfolders = directSubfolders;
        this.totalSources = totalSources;
    }

    public static FolderCountSnapshot of(List<? extends FolderLink> links, Collection<? extends FolderSourceCount> sourceCounts) {
        int size = links.size();
        Map<UUID, Integer> indexById = new HashMap<>(size * 2);
        for (int i = 0; i < size; i++) {
            indexById.put(links.get(i).getFolderId(), i);
        }

        long[] direct = new long[size];
        for (FolderSourceCount count : sourceCounts) {
            Integer index = indexById.get(count.getFolderId());
            if (index != null && count.getSourceCount() != null) {
                direct[index] += count.getSourceCount();
            }
        }

        int[] parent = new int[size];
        int[] childCount = new int[size];
        for (int i = 0; i < size; i++) {
            UUID parentId = links.get(i).getParentId();
            Integer parentIndex = parentId != null ? indexById.get(parentId) : null;
            parent[i] = parentIndex != null ? parentIndex : NO_PARENT;
            if (parent[i] != NO_PARENT) {
                childCount[parent[i]]++;
            }
        }

        int[][] children = new int[size][];
        int[] fill = new int[size];
        for (int i = 0; i < size; i++) {
            children[i] = new int[childCount[i]];
        }
        for (int i = 0; i < size; i++) {
            if (parent[i] != NO_PARENT) {
                children[parent[i]][fill[parent[i]]++] = i;
            }
        }

        long[] subfolders = new long[size];
        for (int i = 0; i < size; i++) {
            subfolders[i] = childCount[i];
        }

        long[] totals = sumBottomUp(parent, children, direct);
        return new FolderCountSnapshot(indexById, direct, subfolders, totals);
    }

    private static long[] sumBottomUp(int[] parent, int[][] children, long[] direct) {
        int size = parent.length;
        int[] order = new int[size];
        boolean[] reached = new boolean[size];
        int head = 0;
        int tail = 0;
        for (int i = 0; i < size; i++) {
            if (parent[i] == NO_PARENT) {
                order[tail++] = i;
                reached[i] = true;
            }
        }
        while (head < tail) {
            int node = order[head++];
            for (int child : children[node]) {
                if (!reached[child]) {
                    reached[child] = true;
                    order[tail++] = child;
                }
            }
        }

        long[] totals = Arrays.copyOf(direct, size);
        for (int i = tail - 1; i >= 0; i--) {
            int node = order[i];
            if (parent[node] != NO_PARENT) {
                totals[parent[node]] += totals[node];
            }
        }

        // Folders on a stored cycle are unreachable from any root; sum their subtree with a visited set.
        for (int i = 0; i < size; i++) {
            if (!reached[i]) {
                totals[i] = sumSubtree(i, children, direct);
            }
        }
        return totals;
    }

    private static long sumSubtree(int start, int[][] children, long[] direct) {
        boolean[] visited = new boolean[direct.length];
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(start);
        visited[start] = true;
        long total = 0;
        while (!pending.isEmpty()) {
            int node = pending.pop();
            total += direct[node];
            for (int child : children[node]) {
                if (!visited[child]) {
                    visited[child] = true;
                    pending.push(child);
                }
            }
        }
        return total;
    }

    public boolean contains(UUID folderId) {
        return indexById.containsKey(folderId);
    }

    public long directSources(UUID folderId) {
        Integer index = indexById.get(folderId);
        return index != null ? directSources[index] : 0L;
    }

    public long directSubfolders(UUID folderId) {
        Integer index = indexById.get(folderId);
        return index != null ? directSubfolders[index] : 0L;
    }

    public long totalSources(UUID folderId) {
        Integer index = indexById.get(folderId);
        return index != null ? totalSources[index] : 0L;
    }

    public int folderCount() {
        return indexById.size();
    }
}
