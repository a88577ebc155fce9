package com.minijs.script.parser;

import java.util.List;

/** Host callback callable from scripts. */
@FunctionalInterface
public interface NativeFunction {
    Value call(Value thisValue, List<Value> args);
}
