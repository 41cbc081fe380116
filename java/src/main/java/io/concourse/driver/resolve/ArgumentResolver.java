package io.concourse.driver.resolve;

import io.concourse.driver.AmbiguousArgumentsException;
import io.concourse.driver.MissingRequiredArgumentsException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies the arguments of a logical operation into exactly one {@link ShapeTag} and extracts type-normalized
 * values for each slot of that shape.
 *
 * <p>
 * Resolution is a pure function of its input: it performs no I/O and touches no session state, so a single instance
 * can be shared freely between threads. Every failure is raised before a remote call would be made.
 * </p>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>The shape of a supplied value decides the slot, not the parameter name: a list passed as {@code key} is
 *       treated as keys and a single number passed as {@code records} as one record.</li>
 *   <li>Singular and plural forms of a parameter are mutually exclusive, as are the selectors {@code record(s)} and
 *       {@code criteria}.</li>
 *   <li>An integer supplied as {@code criteria} selects a record; other numbers become criteria text.</li>
 *   <li>Numeric times are absolute instants in microseconds; text times are phrases resolved by the server.</li>
 *   <li>Parameters an operation never reads are ignored.</li>
 * </ul>
 */
public final class ArgumentResolver {

    static final String READ_REQUIRES_GET = "record or (key and criteria)";
    static final String READ_REQUIRES_SELECT = "criteria or record";
    static final String AUDIT_REQUIRES = "record";
    static final String WRITE_REQUIRES = "key and value";

    public ResolvedCall resolve(OperationFamily family, CallArguments arguments)
        throws MissingRequiredArgumentsException, AmbiguousArgumentsException {
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(arguments, "arguments");
        switch (family) {
            case GET:
            case SELECT:
                return resolveRead(family, arguments);
            case AUDIT:
                return resolveAudit(arguments);
            case ADD:
            case SET:
                return resolveWrite(family, arguments);
            case TIME:
                return resolveTime(arguments);
            default:
                return new ResolvedCall(family, ShapeTag.NONE, Map.of());
        }
    }

    private ResolvedCall resolveRead(OperationFamily family, CallArguments arguments)
        throws MissingRequiredArgumentsException, AmbiguousArgumentsException {
        String op = family.prefix();
        ShapeBuilder shape = new ShapeBuilder();

        ArgumentValue key = exclusive(op, arguments, Parameter.KEY, Parameter.KEYS);
        ArgumentValue record = exclusive(op, arguments, Parameter.RECORD, Parameter.RECORDS);
        ArgumentValue criteria = arguments.get(Parameter.CRITERIA).orElse(null);

        if (criteria != null && criteria.shape() == ArgumentValue.Shape.INTEGER) {
            if (record != null) {
                throw new AmbiguousArgumentsException(op, "record", "an integer criteria");
            }
            record = criteria;
            criteria = null;
        }
        if (record != null && criteria != null) {
            throw new AmbiguousArgumentsException(op, "record", "criteria");
        }
        if (record == null && criteria == null) {
            throw new MissingRequiredArgumentsException(op,
                family == OperationFamily.GET ? READ_REQUIRES_GET : READ_REQUIRES_SELECT);
        }

        if (key != null) {
            addKeys(op, key, shape);
        }
        if (record != null) {
            addRecords(op, record, shape);
        } else {
            addCriteria(op, criteria, shape);
        }

        ArgumentValue timestamp = arguments.get(Parameter.TIMESTAMP).orElse(null);
        if (timestamp != null) {
            TimeReference time = TimeReference.from(timestamp)
                .orElseThrow(() -> new MissingRequiredArgumentsException(op, "timestamp as a number or phrase"));
            addTime(time, Slot.TIME, Slot.TIMESTR, shape);
        }
        return shape.build(family);
    }

    private ResolvedCall resolveAudit(CallArguments arguments)
        throws MissingRequiredArgumentsException, AmbiguousArgumentsException {
        String op = OperationFamily.AUDIT.prefix();
        ShapeBuilder shape = new ShapeBuilder();

        ArgumentValue key = exclusive(op, arguments, Parameter.KEY, Parameter.KEYS);
        ArgumentValue record = exclusive(op, arguments, Parameter.RECORD, Parameter.RECORDS);

        // audit(1) audits the whole record
        if (key != null && key.shape() == ArgumentValue.Shape.INTEGER) {
            if (record != null) {
                throw new AmbiguousArgumentsException(op, "record", "an integer key");
            }
            record = key;
            key = null;
        }
        if (record == null || record.shape() != ArgumentValue.Shape.INTEGER) {
            throw new MissingRequiredArgumentsException(op, AUDIT_REQUIRES);
        }
        if (key != null) {
            if (key.shape() != ArgumentValue.Shape.TEXT) {
                throw new MissingRequiredArgumentsException(op, "a single key as text");
            }
            shape.add(Slot.KEY, key.asText());
        }
        shape.add(Slot.RECORD, record.asLong());

        ArgumentValue start = exclusive(op, arguments, Parameter.START, Parameter.TIMESTAMP);
        ArgumentValue end = arguments.get(Parameter.END).orElse(null);
        if (start == null) {
            if (end != null) {
                throw new MissingRequiredArgumentsException(op, "start when end is supplied");
            }
            return shape.build(OperationFamily.AUDIT);
        }
        TimeReference from = TimeReference.from(start)
            .orElseThrow(() -> new MissingRequiredArgumentsException(op, "start as a number or phrase"));
        addTime(from, Slot.START, Slot.STARTSTR, shape);
        if (end != null) {
            TimeReference to = TimeReference.from(end)
                .orElseThrow(() -> new MissingRequiredArgumentsException(op, "end as a number or phrase"));
            if (to.isAbsolute() != from.isAbsolute()) {
                throw new MissingRequiredArgumentsException(op, "start and end of the same kind");
            }
            addTime(to, Slot.END, Slot.ENDSTR, shape);
        }
        return shape.build(OperationFamily.AUDIT);
    }

    private ResolvedCall resolveWrite(OperationFamily family, CallArguments arguments)
        throws MissingRequiredArgumentsException, AmbiguousArgumentsException {
        String op = family.prefix();
        ShapeBuilder shape = new ShapeBuilder();

        ArgumentValue key = exclusive(op, arguments, Parameter.KEY, Parameter.KEYS);
        ArgumentValue value = arguments.get(Parameter.VALUE).orElse(null);
        ArgumentValue record = exclusive(op, arguments, Parameter.RECORD, Parameter.RECORDS);

        if (key == null || value == null || key.shape() != ArgumentValue.Shape.TEXT) {
            throw new MissingRequiredArgumentsException(op, WRITE_REQUIRES);
        }
        if (value.isCollection()) {
            throw new MissingRequiredArgumentsException(op, "a single value");
        }
        shape.add(Slot.KEY, key.asText());
        shape.add(Slot.VALUE, value.scalar());
        if (record != null) {
            addRecords(op, record, shape);
        }
        return shape.build(family);
    }

    private ResolvedCall resolveTime(CallArguments arguments) throws MissingRequiredArgumentsException {
        ArgumentValue phrase = arguments.get(Parameter.PHRASE).orElse(null);
        if (phrase == null) {
            return new ResolvedCall(OperationFamily.TIME, ShapeTag.NONE, Map.of());
        }
        if (phrase.shape() != ArgumentValue.Shape.TEXT) {
            throw new MissingRequiredArgumentsException(OperationFamily.TIME.prefix(), "phrase as text");
        }
        ShapeBuilder shape = new ShapeBuilder();
        shape.add(Slot.PHRASE, phrase.asText());
        return shape.build(OperationFamily.TIME);
    }

    private static ArgumentValue exclusive(String op, CallArguments arguments, Parameter first, Parameter second)
        throws AmbiguousArgumentsException {
        ArgumentValue a = arguments.get(first).orElse(null);
        ArgumentValue b = arguments.get(second).orElse(null);
        if (a != null && b != null) {
            throw new AmbiguousArgumentsException(op, first.paramName(), second.paramName());
        }
        return a != null ? a : b;
    }

    private static void addKeys(String op, ArgumentValue key, ShapeBuilder shape)
        throws MissingRequiredArgumentsException {
        if (key.isCollection()) {
            if (!key.isCollectionOf(ArgumentValue.Shape.TEXT)) {
                throw new MissingRequiredArgumentsException(op, "keys as text");
            }
            List<String> keys = new ArrayList<>(key.elements().size());
            for (ArgumentValue element : key.elements()) {
                keys.add(element.asText());
            }
            shape.add(Slot.KEYS, List.copyOf(keys));
        } else if (key.shape() == ArgumentValue.Shape.TEXT) {
            shape.add(Slot.KEY, key.asText());
        } else {
            throw new MissingRequiredArgumentsException(op, "key as text");
        }
    }

    private static void addRecords(String op, ArgumentValue record, ShapeBuilder shape)
        throws MissingRequiredArgumentsException {
        if (record.isCollection()) {
            if (!record.isCollectionOf(ArgumentValue.Shape.INTEGER)) {
                throw new MissingRequiredArgumentsException(op, "records as integers");
            }
            List<Long> records = new ArrayList<>(record.elements().size());
            for (ArgumentValue element : record.elements()) {
                records.add(element.asLong());
            }
            shape.add(Slot.RECORDS, List.copyOf(records));
        } else if (record.shape() == ArgumentValue.Shape.INTEGER) {
            shape.add(Slot.RECORD, record.asLong());
        } else {
            throw new MissingRequiredArgumentsException(op, "record as an integer");
        }
    }

    private static void addCriteria(String op, ArgumentValue criteria, ShapeBuilder shape)
        throws MissingRequiredArgumentsException {
        if (criteria.shape() != ArgumentValue.Shape.TEXT && criteria.shape() != ArgumentValue.Shape.DECIMAL) {
            throw new MissingRequiredArgumentsException(op, "criteria as text");
        }
        shape.add(Slot.CCL, criteria.asText());
    }

    private static void addTime(TimeReference time, Slot absolute, Slot phrase, ShapeBuilder shape) {
        if (time.isAbsolute()) {
            shape.add(absolute, ((TimeReference.Absolute) time).micros());
        } else {
            shape.add(phrase, ((TimeReference.Phrase) time).text());
        }
    }

    private static final class ShapeBuilder {
        private final List<Slot> slots = new ArrayList<>();
        private final Map<Slot, Object> values = new EnumMap<>(Slot.class);

        void add(Slot slot, Object value) {
            slots.add(slot);
            values.put(slot, value);
        }

        ResolvedCall build(OperationFamily family) {
            return new ResolvedCall(family, ShapeTag.forSlots(slots), values);
        }
    }
}
