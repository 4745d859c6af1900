package io.courier.tools;

import io.courier.transport.NoticeSink;

/**
 * Who is calling a task tool and where notices for the call should go. Passed
 * explicitly on each call.
 */
public record ToolContext(String actor, String conversationId, NoticeSink noticeSink) {
    public ToolContext {
        actor = actor == null || actor.isBlank() ? "agent" : actor;
        noticeSink = noticeSink == null ? NoticeSink.NONE : noticeSink;
    }

    public static ToolContext agent(String conversationId, NoticeSink noticeSink) {
        return new ToolContext("agent", conversationId, noticeSink);
    }

    public static ToolContext anonymous() {
        return new ToolContext("agent", null, NoticeSink.NONE);
    }
}
