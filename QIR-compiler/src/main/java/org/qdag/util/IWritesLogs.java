package org.qdag.util;

/** Implemented by classes that write to the {@link Logger}.
 * The debug level is looked up by class, so it can be changed at runtime. */
public interface IWritesLogs {
    default int getDebugLevel() {
        return Logger.INSTANCE.getLoggingLevel(this.getClass());
    }
}
