package com.consullo.sessions;

import org.apache.commons.lang3.Validate;

/**
 * Binds a set of components to one thread.
 *
 * <p>
 * The coordinator binds its confinement in {@link SessionCoordinator#init()};
 * the registries and the workspace manager call {@link #check()} at every
 * mutation, so a call from any other thread fails with
 * {@link IllegalStateException} instead of racing the coordinating thread.
 * </p>
 *
 * @since 1.0
 */
public final class ThreadConfinement {

  private volatile Thread owner;

  /**
   * Makes the calling thread the owner.
   *
   * @throws IllegalStateException if already bound
   */
  public void bindToCurrentThread() {
    Thread current = owner;
    Validate.validState(current == null, "already bound to %s", current);
    owner = Thread.currentThread();
  }

  /**
   * @throws IllegalStateException if unbound or called from a thread other than the owner
   */
  public void check() {
    Thread current = owner;
    Validate.validState(current != null, "coordinator not initialized");
    Validate.validState(current == Thread.currentThread(),
            "must be called on the coordinating thread %s", current.getName());
  }

  /**
   * @return the owning thread, or null before binding
   */
  public Thread owner() {
    return owner;
  }
}
