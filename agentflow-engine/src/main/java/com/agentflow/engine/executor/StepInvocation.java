package com.agentflow.engine.executor;

import com.agentflow.core.context.ContextAppender;
import com.agentflow.core.context.ContextView;
import com.agentflow.core.model.Step;

/**
 * Everything the step executor needs to run one step.
 *
 * @param context  read-only view handed to the provider
 * @param appender the only way the attempt loop may change the context
 */
public record StepInvocation(
    String executionId,
    String workflowId,
    Step step,
    ContextView context,
    ContextAppender appender,
    CancellationToken cancellation,
    StepListener listener
) {
    public StepInvocation {
        if (cancellation == null) {
            cancellation = new CancellationToken();
        }
        if (listener == null) {
            listener = StepListener.NONE;
        }
    }
}
