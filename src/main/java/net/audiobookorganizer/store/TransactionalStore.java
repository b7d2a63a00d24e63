package net.audiobookorganizer.store;

import java.util.function.Supplier;

/**
 * Capability of engines that can run several store calls as one atomic unit. Store calls made
 * inside {@code work} join the surrounding transaction.
 */
public interface TransactionalStore {

    <T> T executeInTransaction(Supplier<T> work);
}
