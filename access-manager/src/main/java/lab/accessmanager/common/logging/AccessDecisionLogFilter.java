package lab.accessmanager.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

/**
 * Accepts only structured access-manager events ({@code event=access.*}).
 * Backs the decisions appender so grants, schedules and lock updates can be read without request noise.
 */
public class AccessDecisionLogFilter extends Filter<ILoggingEvent> {

    private static final String EVENT_PREFIX = "event=access.";

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null || event.getMessage() == null) {
            return FilterReply.DENY;
        }
        return event.getMessage().startsWith(EVENT_PREFIX) ? FilterReply.NEUTRAL : FilterReply.DENY;
    }
}
