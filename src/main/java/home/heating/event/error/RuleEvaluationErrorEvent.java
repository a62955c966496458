package home.heating.event.error;

import org.springframework.context.ApplicationEvent;

public class RuleEvaluationErrorEvent extends ApplicationEvent {
    String channel;

    Throwable error;

    public RuleEvaluationErrorEvent(Object source, String channel, Throwable error) {
        super(source);
        this.channel = channel;
        this.error = error;
    }

    public String getChannel() {
        return channel;
    }

    public Throwable getError() {
        return error;
    }
}
