package com.openforge.physiomate.agent.tool;

/**
 * A blocking tool implementation. The dispatcher runs it on the tool worker
 * pool and waits for the result.
 */
@FunctionalInterface
public interface ToolCallable {

    /**
     * @return the text fed back to the model
     * @throws Exception any failure; reported to the model as "Tool error: &lt;message&gt;"
     */
    String call(ToolInvocation invocation) throws Exception;
}
