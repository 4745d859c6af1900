package io.courier.runtime;

/**
 * One way of carrying out a claimed task. Implementations call
 * {@link ExecutionContext#checkpoint(double, String)} at each milestone and
 * return the task result.
 */
public interface ExecutionStrategy {
    String execute(ExecutionContext context) throws Exception;
}
