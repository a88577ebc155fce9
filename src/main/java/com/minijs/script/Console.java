package com.minijs.script;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.minijs.script.parser.JsObject;
import com.minijs.script.parser.Value;

/** The {@code console} host object. */
public final class Console {

    private Console() {}

    public static Value create(PrintStream out) {
        return create(out, Value.DEFAULT_MAX_DISPLAY_LENGTH);
    }

    /** An object whose {@code log} prints its arguments, space separated, as one line. */
    public static Value create(PrintStream out, int maxDisplayLength) {
        JsObject console = new JsObject();
        console.put("log", Value.nativeFunction((thisValue, args) -> {
            out.print(format(args, maxDisplayLength) + "\n");
            out.flush();
            return Value.undefined();
        }));
        return Value.object(console);
    }

    static String format(List<Value> args, int maxDisplayLength) {
        List<String> parts = new ArrayList<>(args.size());
        for (Value v : args) parts.add(v.toDisplayString(maxDisplayLength));
        return String.join(" ", parts);
    }
}
