package io.concourse.driver.resolve;

import io.concourse.driver.UnsupportedShapeException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Closed set of argument shapes. Each shape is the ordered list of slots a remote variant takes, so the shape also
 * fixes the order parameters are sent in.
 */
public enum ShapeTag {
    NONE(),
    PHRASE(Slot.PHRASE),

    CCL(Slot.CCL),
    CCL_TIME(Slot.CCL, Slot.TIME),
    CCL_TIMESTR(Slot.CCL, Slot.TIMESTR),
    RECORD(Slot.RECORD),
    RECORD_TIME(Slot.RECORD, Slot.TIME),
    RECORD_TIMESTR(Slot.RECORD, Slot.TIMESTR),
    RECORDS(Slot.RECORDS),
    RECORDS_TIME(Slot.RECORDS, Slot.TIME),
    RECORDS_TIMESTR(Slot.RECORDS, Slot.TIMESTR),

    KEY_CCL(Slot.KEY, Slot.CCL),
    KEY_CCL_TIME(Slot.KEY, Slot.CCL, Slot.TIME),
    KEY_CCL_TIMESTR(Slot.KEY, Slot.CCL, Slot.TIMESTR),
    KEY_RECORD(Slot.KEY, Slot.RECORD),
    KEY_RECORD_TIME(Slot.KEY, Slot.RECORD, Slot.TIME),
    KEY_RECORD_TIMESTR(Slot.KEY, Slot.RECORD, Slot.TIMESTR),
    KEY_RECORDS(Slot.KEY, Slot.RECORDS),
    KEY_RECORDS_TIME(Slot.KEY, Slot.RECORDS, Slot.TIME),
    KEY_RECORDS_TIMESTR(Slot.KEY, Slot.RECORDS, Slot.TIMESTR),

    KEYS_CCL(Slot.KEYS, Slot.CCL),
    KEYS_CCL_TIME(Slot.KEYS, Slot.CCL, Slot.TIME),
    KEYS_CCL_TIMESTR(Slot.KEYS, Slot.CCL, Slot.TIMESTR),
    KEYS_RECORD(Slot.KEYS, Slot.RECORD),
    KEYS_RECORD_TIME(Slot.KEYS, Slot.RECORD, Slot.TIME),
    KEYS_RECORD_TIMESTR(Slot.KEYS, Slot.RECORD, Slot.TIMESTR),
    KEYS_RECORDS(Slot.KEYS, Slot.RECORDS),
    KEYS_RECORDS_TIME(Slot.KEYS, Slot.RECORDS, Slot.TIME),
    KEYS_RECORDS_TIMESTR(Slot.KEYS, Slot.RECORDS, Slot.TIMESTR),

    RECORD_START(Slot.RECORD, Slot.START),
    RECORD_STARTSTR(Slot.RECORD, Slot.STARTSTR),
    RECORD_START_END(Slot.RECORD, Slot.START, Slot.END),
    RECORD_STARTSTR_ENDSTR(Slot.RECORD, Slot.STARTSTR, Slot.ENDSTR),
    KEY_RECORD_START(Slot.KEY, Slot.RECORD, Slot.START),
    KEY_RECORD_STARTSTR(Slot.KEY, Slot.RECORD, Slot.STARTSTR),
    KEY_RECORD_START_END(Slot.KEY, Slot.RECORD, Slot.START, Slot.END),
    KEY_RECORD_STARTSTR_ENDSTR(Slot.KEY, Slot.RECORD, Slot.STARTSTR, Slot.ENDSTR),

    KEY_VALUE(Slot.KEY, Slot.VALUE),
    KEY_VALUE_RECORD(Slot.KEY, Slot.VALUE, Slot.RECORD),
    KEY_VALUE_RECORDS(Slot.KEY, Slot.VALUE, Slot.RECORDS);

    private static final Map<List<Slot>, ShapeTag> BY_SLOTS = new HashMap<>();

    static {
        for (ShapeTag tag : values()) {
            BY_SLOTS.put(tag.slots, tag);
        }
    }

    private final List<Slot> slots;

    ShapeTag(Slot... slots) {
        this.slots = List.of(slots);
    }

    public List<Slot> slots() {
        return slots;
    }

    /**
     * @return the concatenated slot fragments, e.g. {@code KeysRecordsTime}; empty for {@link #NONE}.
     */
    public String suffix() {
        return slots.stream().map(Slot::fragment).collect(Collectors.joining());
    }

    /**
     * @throws UnsupportedShapeException when no shape has exactly these slots in this order.
     */
    public static ShapeTag forSlots(List<Slot> slots) {
        ShapeTag tag = BY_SLOTS.get(List.copyOf(slots));
        if (tag == null) {
            throw new UnsupportedShapeException("any", String.valueOf(slots));
        }
        return tag;
    }
}
