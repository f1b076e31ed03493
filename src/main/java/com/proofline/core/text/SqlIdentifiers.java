package com.proofline.core.text;

import com.proofline.core.model.TaskValidationException;

import java.util.regex.Pattern;

/**
 * Guards table and column names before they are interpolated into SQL.
 * Values are never interpolated; they are always bound parameters.
 */
public final class SqlIdentifiers {

    private static final Pattern ALLOWED = Pattern.compile("^[A-Za-z0-9_]+$");

    private SqlIdentifiers() {}

    public static String requireValid(String name) {
        if (name == null || !ALLOWED.matcher(name).matches()) {
            throw new TaskValidationException("Invalid SQL identifier: " + name);
        }
        return name;
    }
}
