package org.digraph.search;

import lombok.experimental.StandardException;

/**
 * Raised by {@link FrontierQueue#extractMin()} and {@link FrontierQueue#peek()} when the
 * frontier holds no entries.
 */
@StandardException
public class EmptyQueueException extends IllegalStateException {
}
