/**
 * Courier source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.courier.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.courier.cli.CourierCommand} maps commands to the tool surface and runtime.</li>
 *   <li>{@code io.courier.conversation.ConversationManager} runs the per-conversation debounce and interrupt loop.</li>
 *   <li>{@code io.courier.runtime.TaskScheduler} and {@code io.courier.runtime.TaskExecutor} own task lifecycle.</li>
 *   <li>{@code io.courier.storage.TaskStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.courier;
