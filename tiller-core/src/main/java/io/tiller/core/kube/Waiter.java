package io.tiller.core.kube;

import java.time.Duration;

/// Blocks until resources reach a desired state.
///
/// A timeout and a terminal resource failure are reported the same way: the call
/// throws {@link ResourceException}. Waits are not interruptible by the caller; once
/// issued, a call runs until the condition holds or the timeout elapses.
///
/// @see ResourceClient#getWaiter(WaitStrategy)
public interface Waiter {

    /// Waits until every resource reports ready.
    void waitUntilReady(ResourceList resources, Duration timeout) throws ResourceException;

    /// Watches hook resources until they complete.
    ///
    /// Jobs must succeed and pods must terminate successfully; other kinds count as
    /// complete once they exist.
    void watchUntilReady(ResourceList resources, Duration timeout) throws ResourceException;

    /// Waits until every resource is gone from the cluster.
    void waitForDelete(ResourceList resources, Duration timeout) throws ResourceException;
}
