package org.qdag.util;

/** Objects that render themselves onto an {@link IIndentStream}, e.g. in log messages. */
public interface ToIndentableString {
    /** Write this object to {@code stream}.
     * @return The same stream. */
    IIndentStream toString(IIndentStream stream);
}
