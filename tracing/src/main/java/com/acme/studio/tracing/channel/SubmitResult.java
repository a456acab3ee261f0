package com.acme.studio.tracing.channel;

public sealed interface SubmitResult permits SubmitResult.Accepted, SubmitResult.Dropped {
    record Accepted(long queueBytes) implements SubmitResult {}
    record Dropped(long queueBytes, long maxQueueBytes) implements SubmitResult {}
}
