package org.qdag.util;

/** Objects numbered in creation order.
 * Each implementing class keeps its own counter, so ids are unique per class. */
public interface IHasId {
    long getId();
}
