package io.snapshots.core;

/**
 * Row counts reported by a loader. {@code updated} counts keys that already had a stored row.
 */
public record LoadResult(int inserted, int updated, int skipped) {
    public static LoadResult empty() { return new LoadResult(0, 0, 0); }
    public static LoadResult inserted(int n) { return new LoadResult(n, 0, 0); }

    public int written() { return inserted + updated; }

    public LoadResult plus(LoadResult o) {
        return new LoadResult(inserted + o.inserted, updated + o.updated, skipped + o.skipped);
    }
}
