package papyri.d5.converter.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * One JSON object per log event, MDC entries (such as the TM number being processed) included.
 */
public class JsonLogLayout extends LayoutBase<ILoggingEvent> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        node.put("level", event.getLevel().toString());
        node.put("logger", event.getLoggerName());
        node.put("thread", event.getThreadName());
        node.put("message", event.getFormattedMessage());
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && !mdc.isEmpty()) {
            ObjectNode mdcNode = node.putObject("mdc");
            mdc.forEach(mdcNode::put);
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            node.put("exception", ThrowableProxyUtil.asString(throwable));
        }
        try {
            return MAPPER.writeValueAsString(node) + CoreConstants.LINE_SEPARATOR;
        } catch (JsonProcessingException ex) {
            addError("Failed to serialize log event", ex);
            return event.getFormattedMessage() + CoreConstants.LINE_SEPARATOR;
        }
    }
}
