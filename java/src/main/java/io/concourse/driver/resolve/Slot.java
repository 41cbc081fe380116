package io.concourse.driver.resolve;

/**
 * A canonical parameter position of a remote operation variant. The fragment is the piece the slot contributes to
 * the variant name, for example {@code getKeyRecordTime}.
 */
public enum Slot {
    KEY("Key"),
    KEYS("Keys"),
    VALUE("Value"),
    RECORD("Record"),
    RECORDS("Records"),
    CCL("Ccl"),
    TIME("Time"),
    TIMESTR("Timestr"),
    START("Start"),
    STARTSTR("Startstr"),
    END("End"),
    ENDSTR("Endstr"),
    PHRASE("Phrase");

    private final String fragment;

    Slot(String fragment) {
        this.fragment = fragment;
    }

    public String fragment() {
        return fragment;
    }
}
