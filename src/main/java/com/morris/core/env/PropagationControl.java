package com.morris.core.env;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-variable gate for propagated updates, set with a {@code ~-N} or {@code ~+N} suffix.
 *
 * ~-N: the next N propagation attempts are ignored, then updates flow again.
 * ~+N: the next N propagated updates are applied, after which the variable ignores propagation.
 *
 * Direct writes are never gated.
 */
public final class PropagationControl {

    public static final long UNLIMITED = -1;

    private static final Pattern SUFFIX = Pattern.compile("^(.*?)\\s*~([+-])(\\d+)\\s*$", Pattern.DOTALL);

    private long skipRemaining;
    private long acceptRemaining;

    private PropagationControl(long skipRemaining, long acceptRemaining) {
        this.skipRemaining = skipRemaining;
        this.acceptRemaining = acceptRemaining;
    }

    public static PropagationControl open() {
        return new PropagationControl(0, UNLIMITED);
    }

    public static PropagationControl skipNext(long n) {
        return new PropagationControl(n, UNLIMITED);
    }

    public static PropagationControl acceptNext(long n) {
        return new PropagationControl(0, n);
    }

    /** Value text with its control suffix split off. */
    public static final class Suffixed {
        public final String text;
        public final PropagationControl control; // null when no suffix was present

        Suffixed(String text, PropagationControl control) {
            this.text = text;
            this.control = control;
        }
    }

    /** Strips trailing {@code ~-N} / {@code ~+N} markers. Both may be combined, e.g. {@code 5 ~-1 ~+3}. */
    public static Suffixed strip(String valueText) {
        String text = valueText;
        PropagationControl control = null;
        Matcher m = SUFFIX.matcher(text);
        while (m.matches() && !m.group(1).isEmpty()) {
            if (control == null) control = open();
            long n;
            try {
                n = Long.parseLong(m.group(3));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Propagation count too large: " + m.group(3), e);
            }
            if (m.group(2).equals("-")) control.skipRemaining = n;
            else control.acceptRemaining = n;
            text = m.group(1);
            m = SUFFIX.matcher(text);
        }
        return new Suffixed(text, control);
    }

    /** Consulted once per candidate propagated update; consumes one skip when skipping. */
    public boolean admit() {
        if (skipRemaining > 0) {
            skipRemaining--;
            return false;
        }
        return acceptRemaining != 0;
    }

    /** Called after an admitted update was written. */
    public void applied() {
        if (acceptRemaining > 0) acceptRemaining--;
    }

    public boolean isOpen() {
        return skipRemaining == 0 && acceptRemaining == UNLIMITED;
    }

    public long skipRemaining() {
        return skipRemaining;
    }

    public long acceptRemaining() {
        return acceptRemaining;
    }

    public PropagationControl copy() {
        return new PropagationControl(skipRemaining, acceptRemaining);
    }

    @Override
    public String toString() {
        if (isOpen()) return "open";
        StringBuilder sb = new StringBuilder();
        if (skipRemaining > 0) sb.append("~-").append(skipRemaining);
        if (acceptRemaining != UNLIMITED) {
            if (sb.length() > 0) sb.append(' ');
            sb.append("~+").append(acceptRemaining);
        }
        return sb.toString();
    }
}
