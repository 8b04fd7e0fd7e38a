package io.xlsformem.core.engine;

/**
 * Field-name normalization shared by every rendering path. Expression Manager variable names
 * cannot contain underscores, so they are dropped: {@code user_first_name} becomes
 * {@code userfirstname}.
 */
public final class FieldNames {

    private FieldNames() {
        // utility
    }

    /** Strips every underscore from {@code name}. Returns {@code null} for {@code null}. */
    public static String sanitize(String name) {
        if (name == null || name.indexOf('_') < 0) {
            return name;
        }
        return name.replace("_", "");
    }
}
