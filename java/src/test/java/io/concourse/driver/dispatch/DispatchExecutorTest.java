package io.concourse.driver.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import io.concourse.driver.RecordingInvoker;
import io.concourse.driver.Tag;
import io.concourse.driver.resolve.OperationFamily;
import io.concourse.driver.resolve.ShapeTag;
import io.concourse.driver.resolve.Slot;
import io.concourse.driver.transaction.TransactionContext;
import io.concourse.driver.transaction.TransactionToken;
import io.concourse.driver.transport.Credential;
import io.concourse.driver.transport.JsonValueCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DispatchExecutorTest {

    private static final Credential CREDENTIAL = new Credential("session-token");

    private final OperationDispatchTable table = OperationDispatchTable.standard();
    private RecordingInvoker invoker;
    private TransactionContext transaction;
    private DispatchExecutor executor;

    @BeforeEach
    void setUp() {
        invoker = new RecordingInvoker();
        transaction = new TransactionContext(invoker, CREDENTIAL, table);
        executor = new DispatchExecutor(invoker, new JsonValueCodec(), transaction, CREDENTIAL);
    }

    @Test
    void sendsParametersInDescriptorOrder() throws Exception {
        Map<Slot, Object> values = new EnumMap<>(Slot.class);
        values.put(Slot.TIME, 1609459200000000L);
        values.put(Slot.RECORDS, List.of(1L, 2L, 3L));
        values.put(Slot.KEYS, List.of("name", "age"));

        executor.execute(table.lookup(OperationFamily.SELECT, ShapeTag.KEYS_RECORDS_TIME), values);

        RecordingInvoker.Call call = invoker.lastCall();
        assertEquals("selectKeysRecordsTime", call.name());
        assertEquals(3, call.params().size());
        assertEquals("[\"name\",\"age\"]", call.params().get(0).toString());
        assertEquals("[1,2,3]", call.params().get(1).toString());
        assertEquals(1609459200000000L, call.params().get(2).longValue());
        assertSame(CREDENTIAL, call.credential());
        assertNull(call.transaction());
    }

    @Test
    void encodesStoredValuesWithTheCodec() throws Exception {
        Map<Slot, Object> values = Map.of(Slot.KEY, "color", Slot.VALUE, Tag.of("blue"), Slot.RECORD, 4L);

        executor.execute(table.lookup(OperationFamily.ADD, ShapeTag.KEY_VALUE_RECORD), values);

        JsonNode value = invoker.lastCall().params().get(1);
        assertEquals("TAG", value.get("type").asText());
        assertEquals("blue", value.get("data").asText());
    }

    @Test
    void attachesStagedToken() throws Exception {
        invoker.respondWith("stage", TextNode.valueOf("txn-1"));
        transaction.stage();

        executor.execute(table.lookup(OperationFamily.GET, ShapeTag.RECORD), Map.of(Slot.RECORD, 1L));

        assertEquals(new TransactionToken("txn-1"), invoker.lastCall().transaction());
    }

    @Test
    void decodesResult() throws Exception {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        invoker.respondWith("getKeyRecord", nodes.objectNode().put("type", "STRING").put("data", "Jeff"));

        Object result = executor.execute(table.lookup(OperationFamily.GET, ShapeTag.KEY_RECORD),
            Map.of(Slot.KEY, "name", Slot.RECORD, 1L));

        assertEquals("Jeff", result);
    }

    @Test
    void missingSlotValueFailsBeforeInvoking() {
        assertThrows(IllegalArgumentException.class,
            () -> executor.execute(table.lookup(OperationFamily.GET, ShapeTag.KEY_RECORD), Map.of(Slot.KEY, "name")));
        assertTrue(invoker.calls().isEmpty());
    }
}
