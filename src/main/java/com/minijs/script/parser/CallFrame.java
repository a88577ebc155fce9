package com.minijs.script.parser;

/** One active call, as reported in call-depth errors. */
final class CallFrame {
    final String functionName;
    final int argumentCount;

    CallFrame(String functionName, int argumentCount) {
        this.functionName = functionName;
        this.argumentCount = argumentCount;
    }

    @Override
    public String toString() {
        return functionName + "/" + argumentCount;
    }
}
