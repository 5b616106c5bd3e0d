package com.openforge.physiomate.agent.tool;

import java.util.concurrent.CompletableFuture;

/**
 * A natively asynchronous tool. The dispatcher awaits the returned future
 * directly instead of offloading the call to the worker pool.
 */
@FunctionalInterface
public interface AsyncToolCallable extends ToolCallable {

    CompletableFuture<String> callAsync(ToolInvocation invocation);

    @Override
    default String call(ToolInvocation invocation) throws Exception {
        return callAsync(invocation).get();
    }
}
