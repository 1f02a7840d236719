package com.suitemender.core.classifier;

import java.util.regex.Pattern;

/**
 * A named regular expression over a failure's kind, message and trace.
 */
public final class FailureSignature {

    private final String  name;
    private final Pattern pattern;
    private final String  reason;

    public FailureSignature(String name, String regex, String reason) {
        this.name    = name;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        this.reason  = reason;
    }

    public String getName()   { return name; }
    public String getReason() { return reason; }

    public boolean matches(String failureText) {
        return pattern.matcher(failureText).find();
    }

    @Override
    public String toString() {
        return name + " /" + pattern.pattern() + "/";
    }
}
