package dev.sitedigest.crawl;

import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.jspecify.annotations.Nullable;

/**
 * FIFO queue of {@link FrontierEntry} plus the visited set of one crawl run.
 *
 * <p>Entries are dequeued in insertion order, which gives breadth-first traversal: every page at
 * depth {@code d} that was discovered before a page at depth {@code d + 1} is fetched first. The
 * visited set only grows. {@link #markVisited(String)} is the single atomic check-and-mark, so a
 * URL can be claimed for fetching at most once even if several workers drain the same frontier.
 */
public final class Frontier {

  private final Queue<FrontierEntry> queue = new ConcurrentLinkedQueue<>();
  private final Set<String> visited = ConcurrentHashMap.newKeySet();

  /**
   * Create a frontier holding only the seed at depth 0.
   *
   * @param seedUrl normalized seed URL
   * @return a new frontier owned by one crawl run
   */
  public static Frontier seededWith(String seedUrl) {
    Frontier frontier = new Frontier();
    frontier.enqueue(new FrontierEntry(seedUrl, 0));
    return frontier;
  }

  public void enqueue(FrontierEntry entry) {
    queue.add(entry);
  }

  /**
   * Enqueue a URL unless it has already been visited. Re-queueing a pending URL is harmless: the
   * duplicate is discarded when it reaches the head and fails {@link #markVisited(String)}.
   *
   * @return true if the entry was added
   */
  public boolean enqueueIfUnvisited(String url, int depth) {
    if (visited.contains(url)) {
      return false;
    }
    queue.add(new FrontierEntry(url, depth));
    return true;
  }

  /** Remove and return the head entry, or {@code null} if the frontier is drained. */
  public @Nullable FrontierEntry poll() {
    return queue.poll();
  }

  /**
   * Atomically mark a URL as visited.
   *
   * @return true if this call claimed the URL, false if it was already visited
   */
  public boolean markVisited(String url) {
    return visited.add(url);
  }

  public boolean isVisited(String url) {
    return visited.contains(url);
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public int pendingCount() {
    return queue.size();
  }

  public int visitedCount() {
    return visited.size();
  }
}
