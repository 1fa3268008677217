package com.javis.agents;

import com.javis.shared.model.Result;
import com.javis.shared.model.Task;

import java.util.Set;

/**
 * An executor for one or more task types. Implementations are opaque to the
 * orchestrator: it only routes by {@link #capabilities()} and calls
 * {@link #execute}.
 *
 * <p>{@code execute} may return a failure {@link Result} or throw; both count as
 * a failed attempt. Long-running agents should poll the token between steps.
 */
public interface Agent {
    String id();
    Set<Capability> capabilities();
    Result execute(Task task, CancellationToken cancellation) throws Exception;
}
