package com.filelog.sdk.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * printf-style formatter.
 *
 * <p>When the first argument is a string it is scanned for directives:</p>
 * <ul>
 *   <li>{@code %s} - {@link String#valueOf(Object)}</li>
 *   <li>{@code %d}, {@code %i} - integer part of a number</li>
 *   <li>{@code %f} - floating point number</li>
 *   <li>{@code %j}, {@code %o} - JSON</li>
 *   <li>{@code %%} - a literal percent sign</li>
 * </ul>
 * <p>Directives without a matching argument are left as they are. Remaining
 * arguments are appended, separated by a space.</p>
 */
public class DefaultMessageFormatter implements MessageFormatter {

    private final ObjectMapper objectMapper;

    public DefaultMessageFormatter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS));
    }

    public DefaultMessageFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format(List<Object> args) {
        if (args == null || args.isEmpty()) {
            return "";
        }

        StringBuilder out = new StringBuilder();
        int next = 0;

        Object first = args.get(0);
        if (first instanceof String template) {
            next = 1;
            int len = template.length();
            for (int i = 0; i < len; i++) {
                char c = template.charAt(i);
                if (c != '%' || i + 1 >= len) {
                    out.append(c);
                    continue;
                }
                char directive = template.charAt(i + 1);
                if (directive == '%') {
                    out.append('%');
                    i++;
                    continue;
                }
                if ("sdifjo".indexOf(directive) < 0 || next >= args.size()) {
                    out.append(c);
                    continue;
                }
                out.append(render(directive, args.get(next++)));
                i++;
            }
        }

        for (; next < args.size(); next++) {
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(inspect(args.get(next)));
        }

        return out.toString();
    }

    private String render(char directive, Object arg) {
        switch (directive) {
            case 's':
                return String.valueOf(arg);
            case 'd':
            case 'i':
                if (arg instanceof Number number) {
                    return Long.toString(number.longValue());
                }
                return "NaN";
            case 'f':
                if (arg instanceof Number number) {
                    return Double.toString(number.doubleValue());
                }
                return "NaN";
            default:
                return toJson(arg);
        }
    }

    private String inspect(Object arg) {
        if (arg == null || arg instanceof CharSequence || arg instanceof Number
                || arg instanceof Boolean || arg instanceof Character || arg instanceof Enum) {
            return String.valueOf(arg);
        }
        if (arg instanceof Map || arg instanceof Collection || arg.getClass().isArray()) {
            return toJson(arg);
        }
        return String.valueOf(arg);
    }

    private String toJson(Object arg) {
        try {
            return objectMapper.writeValueAsString(arg);
        } catch (JsonProcessingException e) {
            return "[Unserializable " + arg.getClass().getSimpleName() + "]";
        }
    }
}
