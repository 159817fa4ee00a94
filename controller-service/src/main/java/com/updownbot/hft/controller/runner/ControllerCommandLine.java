package com.updownbot.hft.controller.runner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the controller's short flags onto their {@code hft.*} property names so Spring binds them
 * like any other property. Unknown arguments pass through untouched.
 */
public final class ControllerCommandLine {

    static final Map<String, String> SHORT_FLAGS;

    static {
        Map<String, String> flags = new LinkedHashMap<>();
        flags.put("interval", "hft.controller.interval-millis");
        flags.put("duration", "hft.controller.duration-millis");
        flags.put("vol-floor", "hft.controller.signal.vol-floor");
        flags.put("vol-multiplier", "hft.controller.signal.vol-multiplier");
        flags.put("window-seconds", "hft.feed.window-seconds");
        flags.put("z-clamp", "hft.controller.signal.z-clamp");
        SHORT_FLAGS = Map.copyOf(flags);
    }

    public static final String ONCE = "once";

    private ControllerCommandLine() {
    }

    public static String[] translate(String[] args) {
        if (args == null) {
            return new String[0];
        }
        List<String> out = new ArrayList<>(args.length);
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg == null || !arg.startsWith("--")) {
                out.add(arg);
                continue;
            }
            String body = arg.substring(2);
            int eq = body.indexOf('=');
            String name = eq < 0 ? body : body.substring(0, eq);
            String property = SHORT_FLAGS.get(name);
            if (property == null) {
                out.add(arg);
                continue;
            }
            String value;
            if (eq >= 0) {
                value = body.substring(eq + 1);
            } else if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                value = args[++i];
            } else {
                throw new IllegalArgumentException("missing value for --" + name);
            }
            out.add("--" + property + "=" + value);
        }
        return out.toArray(new String[0]);
    }
}
