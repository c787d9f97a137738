package com.example.fieldauthz.record;

/**
 * Construction options of a record instance.
 *
 * @param protect     whether the instance starts with authorization turned on
 * @param checkCreate whether every supplied field is checked for {@code create}
 */
public record RecordOptions(boolean protect, boolean checkCreate) {

    private static final RecordOptions DEFAULTS = new RecordOptions(true, false);

    public static RecordOptions defaults() {
        return DEFAULTS;
    }

    public RecordOptions withProtect(boolean protect) {
        return new RecordOptions(protect, checkCreate);
    }

    public RecordOptions withCheckCreate(boolean checkCreate) {
        return new RecordOptions(protect, checkCreate);
    }
}
