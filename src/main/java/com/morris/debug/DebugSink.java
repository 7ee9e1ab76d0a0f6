package com.morris.debug;

/** Pluggable log output target (SLF4J, stdout, test capture). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
