/**
 * Task orchestration package.
 *
 * <p>{@link io.courier.runtime.TaskScheduler} owns state transitions and the blocking
 * priority dequeue. {@link io.courier.runtime.TaskExecutor} claims work and dispatches
 * it to an {@link io.courier.runtime.ExecutionStrategy} per task mode.
 * {@link io.courier.runtime.CourierRuntime} wires both to storage, settings and audit.
 */
package io.courier.runtime;
