package io.concourse.driver.dispatch;

import io.concourse.driver.UnsupportedShapeException;
import io.concourse.driver.resolve.OperationFamily;
import io.concourse.driver.resolve.ShapeTag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import static io.concourse.driver.resolve.OperationFamily.ABORT;
import static io.concourse.driver.resolve.OperationFamily.ADD;
import static io.concourse.driver.resolve.OperationFamily.AUDIT;
import static io.concourse.driver.resolve.OperationFamily.COMMIT;
import static io.concourse.driver.resolve.OperationFamily.GET;
import static io.concourse.driver.resolve.OperationFamily.SELECT;
import static io.concourse.driver.resolve.OperationFamily.SERVER_ENVIRONMENT;
import static io.concourse.driver.resolve.OperationFamily.SERVER_VERSION;
import static io.concourse.driver.resolve.OperationFamily.SET;
import static io.concourse.driver.resolve.OperationFamily.STAGE;
import static io.concourse.driver.resolve.OperationFamily.TIME;

/**
 * Lookup from (operation family, argument shape) to the remote variant that serves it.
 *
 * <p>
 * Entries are listed explicitly below so the mapping can be audited line by line. Registering the same shape twice
 * for a family fails when the table is built.
 * </p>
 */
public final class OperationDispatchTable {

    private static final OperationDispatchTable STANDARD = buildStandard();

    private final Map<OperationFamily, Map<ShapeTag, OperationDescriptor>> entries;

    private OperationDispatchTable(Map<OperationFamily, Map<ShapeTag, OperationDescriptor>> entries) {
        this.entries = entries;
    }

    /**
     * @return the shared table of every variant the server exposes.
     */
    public static OperationDispatchTable standard() {
        return STANDARD;
    }

    /**
     * @throws UnsupportedShapeException when the family has no variant for {@code shape}.
     */
    public OperationDescriptor lookup(OperationFamily family, ShapeTag shape) {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(shape, "shape");
        OperationDescriptor descriptor = entries.getOrDefault(family, Map.of()).get(shape);
        if (descriptor == null) {
            throw new UnsupportedShapeException(family.name(), shape.name());
        }
        return descriptor;
    }

    public Map<ShapeTag, OperationDescriptor> entries(OperationFamily family) {
        return entries.getOrDefault(family, Map.of());
    }

    private static OperationDispatchTable buildStandard() {
        Registrar r = new Registrar();

        r.register(GET, ShapeTag.CCL, "getCcl");
        r.register(GET, ShapeTag.CCL_TIME, "getCclTime");
        r.register(GET, ShapeTag.CCL_TIMESTR, "getCclTimestr");
        r.register(GET, ShapeTag.RECORD, "getRecord");
        r.register(GET, ShapeTag.RECORD_TIME, "getRecordTime");
        r.register(GET, ShapeTag.RECORD_TIMESTR, "getRecordTimestr");
        r.register(GET, ShapeTag.RECORDS, "getRecords");
        r.register(GET, ShapeTag.RECORDS_TIME, "getRecordsTime");
        r.register(GET, ShapeTag.RECORDS_TIMESTR, "getRecordsTimestr");
        r.register(GET, ShapeTag.KEY_CCL, "getKeyCcl");
        r.register(GET, ShapeTag.KEY_CCL_TIME, "getKeyCclTime");
        r.register(GET, ShapeTag.KEY_CCL_TIMESTR, "getKeyCclTimestr");
        r.register(GET, ShapeTag.KEY_RECORD, "getKeyRecord");
        r.register(GET, ShapeTag.KEY_RECORD_TIME, "getKeyRecordTime");
        r.register(GET, ShapeTag.KEY_RECORD_TIMESTR, "getKeyRecordTimestr");
        r.register(GET, ShapeTag.KEY_RECORDS, "getKeyRecords");
        r.register(GET, ShapeTag.KEY_RECORDS_TIME, "getKeyRecordsTime");
        r.register(GET, ShapeTag.KEY_RECORDS_TIMESTR, "getKeyRecordsTimestr");
        r.register(GET, ShapeTag.KEYS_CCL, "getKeysCcl");
        r.register(GET, ShapeTag.KEYS_CCL_TIME, "getKeysCclTime");
        r.register(GET, ShapeTag.KEYS_CCL_TIMESTR, "getKeysCclTimestr");
        r.register(GET, ShapeTag.KEYS_RECORD, "getKeysRecord");
        r.register(GET, ShapeTag.KEYS_RECORD_TIME, "getKeysRecordTime");
        r.register(GET, ShapeTag.KEYS_RECORD_TIMESTR, "getKeysRecordTimestr");
        r.register(GET, ShapeTag.KEYS_RECORDS, "getKeysRecords");
        r.register(GET, ShapeTag.KEYS_RECORDS_TIME, "getKeysRecordsTime");
        r.register(GET, ShapeTag.KEYS_RECORDS_TIMESTR, "getKeysRecordsTimestr");

        r.register(SELECT, ShapeTag.CCL, "selectCcl");
        r.register(SELECT, ShapeTag.CCL_TIME, "selectCclTime");
        r.register(SELECT, ShapeTag.CCL_TIMESTR, "selectCclTimestr");
        r.register(SELECT, ShapeTag.RECORD, "selectRecord");
        r.register(SELECT, ShapeTag.RECORD_TIME, "selectRecordTime");
        r.register(SELECT, ShapeTag.RECORD_TIMESTR, "selectRecordTimestr");
        r.register(SELECT, ShapeTag.RECORDS, "selectRecords");
        r.register(SELECT, ShapeTag.RECORDS_TIME, "selectRecordsTime");
        r.register(SELECT, ShapeTag.RECORDS_TIMESTR, "selectRecordsTimestr");
        r.register(SELECT, ShapeTag.KEY_CCL, "selectKeyCcl");
        r.register(SELECT, ShapeTag.KEY_CCL_TIME, "selectKeyCclTime");
        r.register(SELECT, ShapeTag.KEY_CCL_TIMESTR, "selectKeyCclTimestr");
        r.register(SELECT, ShapeTag.KEY_RECORD, "selectKeyRecord");
        r.register(SELECT, ShapeTag.KEY_RECORD_TIME, "selectKeyRecordTime");
        r.register(SELECT, ShapeTag.KEY_RECORD_TIMESTR, "selectKeyRecordTimestr");
        r.register(SELECT, ShapeTag.KEY_RECORDS, "selectKeyRecords");
        r.register(SELECT, ShapeTag.KEY_RECORDS_TIME, "selectKeyRecordsTime");
        r.register(SELECT, ShapeTag.KEY_RECORDS_TIMESTR, "selectKeyRecordsTimestr");
        r.register(SELECT, ShapeTag.KEYS_CCL, "selectKeysCcl");
        r.register(SELECT, ShapeTag.KEYS_CCL_TIME, "selectKeysCclTime");
        r.register(SELECT, ShapeTag.KEYS_CCL_TIMESTR, "selectKeysCclTimestr");
        r.register(SELECT, ShapeTag.KEYS_RECORD, "selectKeysRecord");
        r.register(SELECT, ShapeTag.KEYS_RECORD_TIME, "selectKeysRecordTime");
        r.register(SELECT, ShapeTag.KEYS_RECORD_TIMESTR, "selectKeysRecordTimestr");
        r.register(SELECT, ShapeTag.KEYS_RECORDS, "selectKeysRecords");
        r.register(SELECT, ShapeTag.KEYS_RECORDS_TIME, "selectKeysRecordsTime");
        r.register(SELECT, ShapeTag.KEYS_RECORDS_TIMESTR, "selectKeysRecordsTimestr");

        r.register(AUDIT, ShapeTag.RECORD, "auditRecord");
        r.register(AUDIT, ShapeTag.RECORD_START, "auditRecordStart");
        r.register(AUDIT, ShapeTag.RECORD_STARTSTR, "auditRecordStartstr");
        r.register(AUDIT, ShapeTag.RECORD_START_END, "auditRecordStartEnd");
        r.register(AUDIT, ShapeTag.RECORD_STARTSTR_ENDSTR, "auditRecordStartstrEndstr");
        r.register(AUDIT, ShapeTag.KEY_RECORD, "auditKeyRecord");
        r.register(AUDIT, ShapeTag.KEY_RECORD_START, "auditKeyRecordStart");
        r.register(AUDIT, ShapeTag.KEY_RECORD_STARTSTR, "auditKeyRecordStartstr");
        r.register(AUDIT, ShapeTag.KEY_RECORD_START_END, "auditKeyRecordStartEnd");
        r.register(AUDIT, ShapeTag.KEY_RECORD_STARTSTR_ENDSTR, "auditKeyRecordStartstrEndstr");

        r.register(ADD, ShapeTag.KEY_VALUE, "addKeyValue");
        r.register(ADD, ShapeTag.KEY_VALUE_RECORD, "addKeyValueRecord");
        r.register(ADD, ShapeTag.KEY_VALUE_RECORDS, "addKeyValueRecords");

        r.register(SET, ShapeTag.KEY_VALUE, "setKeyValue");
        r.register(SET, ShapeTag.KEY_VALUE_RECORD, "setKeyValueRecord");
        r.register(SET, ShapeTag.KEY_VALUE_RECORDS, "setKeyValueRecords");

        r.register(TIME, ShapeTag.NONE, "time");
        r.register(TIME, ShapeTag.PHRASE, "timePhrase");

        r.register(STAGE, ShapeTag.NONE, "stage");
        r.register(COMMIT, ShapeTag.NONE, "commit");
        r.register(ABORT, ShapeTag.NONE, "abort");
        r.register(SERVER_ENVIRONMENT, ShapeTag.NONE, "getServerEnvironment");
        r.register(SERVER_VERSION, ShapeTag.NONE, "getServerVersion");

        return r.build();
    }

    private static final class Registrar {
        private final Map<OperationFamily, Map<ShapeTag, OperationDescriptor>> entries = new EnumMap<>(OperationFamily.class);

        void register(OperationFamily family, ShapeTag shape, String name) {
            Map<ShapeTag, OperationDescriptor> byShape = entries.computeIfAbsent(family, f -> new EnumMap<>(ShapeTag.class));
            if (byShape.containsKey(shape)) {
                throw new IllegalStateException("duplicate dispatch entry for " + family + " " + shape);
            }
            byShape.put(shape, OperationDescriptor.of(name, family, shape));
        }

        OperationDispatchTable build() {
            Map<OperationFamily, Map<ShapeTag, OperationDescriptor>> frozen = new EnumMap<>(OperationFamily.class);
            entries.forEach((family, byShape) -> frozen.put(family, Collections.unmodifiableMap(byShape)));
            return new OperationDispatchTable(Collections.unmodifiableMap(frozen));
        }
    }
}
