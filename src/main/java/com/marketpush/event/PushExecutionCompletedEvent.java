package com.marketpush.event;

import com.marketpush.domain.model.ExecutionRun;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every finished push execution, including aborted ones.
 * Skipped ticks publish with a null run and {@code skipped = true}.
 */
public class PushExecutionCompletedEvent extends ApplicationEvent {

    private final ExecutionRun run;
    private final boolean skipped;

    public PushExecutionCompletedEvent(Object source, ExecutionRun run, boolean skipped) {
        super(source);
        this.run = run;
        this.skipped = skipped;
    }

    public ExecutionRun getRun() {
        return run;
    }

    public boolean isSkipped() {
        return skipped;
    }
}
