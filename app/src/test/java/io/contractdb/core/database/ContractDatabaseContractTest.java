package io.contractdb.core.database;

import io.contractdb.core.value.TupleTypeSignature;
import io.contractdb.core.value.TypeSignature;
import io.contractdb.core.value.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every backend must share. Subclasses only supply the database.
 */
public abstract class ContractDatabaseContractTest {

    static final TupleTypeSignature OWNER = TupleTypeSignature.builder()
            .field("owner", TypeSignature.PRINCIPAL)
            .build();
    static final TupleTypeSignature AMOUNT = TupleTypeSignature.builder()
            .field("amount", TypeSignature.INT)
            .build();

    protected ContractDatabase db;

    protected abstract ContractDatabase newDatabase() throws Exception;

    @BeforeEach
    public void setUp() throws Exception {
        db = newDatabase();
        db.createMap("balances", OWNER, AMOUNT);
    }

    @AfterEach
    public void tearDown() {
        db.close();
    }

    static Value owner(String address) {
        return Value.tupleBuilder().putPrincipal("owner", address).build();
    }

    static Value amount(long v) {
        return Value.tupleBuilder().putInt("amount", v).build();
    }

    DataMap writable(String name) {
        return db.getMutDataMap(name).orElseThrow();
    }

    @Test
    public void balancesScenario() {
        try (DataMap map = writable("balances")) {
            Value a = owner("SP2J6ZY48GV1EZ5V2V5RB9MP66SW86PYKKNRV9EJ7");
            assertTrue(map.insertEntry(a, amount(100)));
            assertFalse(map.insertEntry(a, amount(5)));
            assertEquals(amount(100), map.fetchEntry(a));

            map.setEntry(a, amount(5));
            assertEquals(amount(5), map.fetchEntry(a));

            assertTrue(map.deleteEntry(a));
            assertTrue(map.fetchEntry(a).isVoid());
            assertFalse(map.deleteEntry(a));
        }
    }

    @Test
    public void setThenFetchReturnsStoredValue() {
        try (DataMap map = writable("balances")) {
            for (long v : new long[] {0, -1, 42, Long.MAX_VALUE}) {
                Value key = owner("alice" + v);
                map.setEntry(key, amount(v));
                assertEquals(amount(v), map.fetchEntry(key));
            }
        }
    }

    @Test
    public void fetchOfUnwrittenKeyIsVoid() {
        try (DataMapView map = db.getDataMap("balances").orElseThrow()) {
            assertEquals(Value.voidValue(), map.fetchEntry(owner("nobody")));
        }
    }

    @Test
    public void insertSucceedsAgainOnlyAfterDelete() {
        try (DataMap map = writable("balances")) {
            Value k = owner("alice");
            assertTrue(map.insertEntry(k, amount(1)));
            assertFalse(map.insertEntry(k, amount(2)));
            assertFalse(map.insertEntry(k, amount(1)));
            assertEquals(amount(1), map.fetchEntry(k));

            assertTrue(map.deleteEntry(k));
            assertTrue(map.insertEntry(k, amount(3)));
            assertEquals(amount(3), map.fetchEntry(k));
        }
    }

    @Test
    public void deleteReportsWhetherEntryExisted() {
        try (DataMap map = writable("balances")) {
            assertFalse(map.deleteEntry(owner("alice")));
            map.setEntry(owner("alice"), amount(9));
            map.setEntry(owner("bob"), amount(7));
            assertTrue(map.deleteEntry(owner("alice")));
            assertTrue(map.fetchEntry(owner("alice")).isVoid());
            assertEquals(amount(7), map.fetchEntry(owner("bob")));
            assertEquals(1, map.size());
        }
    }

    @Test
    public void rejectedKeyLeavesMapUnchanged() {
        try (DataMap map = writable("balances")) {
            map.setEntry(owner("alice"), amount(10));
            Value badKey = Value.tupleBuilder().putInt("owner", 1).build();

            TypeMismatchException ex = assertThrows(TypeMismatchException.class, () -> map.setEntry(badKey, amount(1)));
            assertEquals(OWNER.asType(), ex.expected());
            assertEquals(badKey, ex.actual());

            assertThrows(TypeMismatchException.class, () -> map.insertEntry(badKey, amount(1)));
            assertThrows(TypeMismatchException.class, () -> map.deleteEntry(badKey));
            assertThrows(TypeMismatchException.class, () -> map.fetchEntry(badKey));
            assertThrows(TypeMismatchException.class, () -> map.fetchEntry(Value.voidValue()));

            assertEquals(1, map.size());
            assertEquals(amount(10), map.fetchEntry(owner("alice")));
        }
    }

    @Test
    public void rejectedValueLeavesMapUnchanged() {
        try (DataMap map = writable("balances")) {
            map.setEntry(owner("alice"), amount(10));
            Value badValue = Value.tupleBuilder().putInt("amount", 1).putBool("frozen", true).build();

            TypeMismatchException ex = assertThrows(TypeMismatchException.class,
                    () -> map.setEntry(owner("alice"), badValue));
            assertEquals(AMOUNT.asType(), ex.expected());
            assertEquals(badValue, ex.actual());

            assertThrows(TypeMismatchException.class, () -> map.insertEntry(owner("bob"), badValue));

            assertEquals(amount(10), map.fetchEntry(owner("alice")));
            assertTrue(map.fetchEntry(owner("bob")).isVoid());
            assertEquals(1, map.size());
        }
    }

    @Test
    public void keyIsCheckedBeforeValue() {
        try (DataMap map = writable("balances")) {
            Value badKey = amount(1);
            TypeMismatchException ex = assertThrows(TypeMismatchException.class,
                    () -> map.setEntry(badKey, Value.bool(true)));
            assertEquals(badKey, ex.actual());
        }
    }

    @Test
    public void recreatingMapDiscardsItsEntriesOnly() {
        db.createMap("nonces", OWNER, AMOUNT);
        try (DataMap balances = writable("balances")) {
            balances.setEntry(owner("alice"), amount(100));
        }
        try (DataMap nonces = writable("nonces")) {
            nonces.setEntry(owner("alice"), amount(3));
        }

        TupleTypeSignature flagType = TupleTypeSignature.builder().field("flag", TypeSignature.BOOL).build();
        db.createMap("balances", OWNER, flagType);

        try (DataMap balances = writable("balances")) {
            assertEquals(0, balances.size());
            assertTrue(balances.fetchEntry(owner("alice")).isVoid());
            assertEquals(flagType, balances.valueType());
            assertThrows(TypeMismatchException.class, () -> balances.setEntry(owner("alice"), amount(1)));
        }
        try (DataMapView nonces = db.getDataMap("nonces").orElseThrow()) {
            assertEquals(amount(3), nonces.fetchEntry(owner("alice")));
        }
    }

    @Test
    public void missingMapIsAbsentNotError() {
        assertTrue(db.getDataMap("missing").isEmpty());
        assertTrue(db.getMutDataMap("missing").isEmpty());
        assertFalse(db.hasMap("missing"));
        assertTrue(db.hasMap("balances"));
    }

    @Test
    public void mapNamesAreSorted() {
        db.createMap("zeta", OWNER, AMOUNT);
        db.createMap("alpha", OWNER, AMOUNT);
        assertEquals(List.of("alpha", "balances", "zeta"), List.copyOf(db.mapNames()));
        assertEquals(Set.of("alpha", "balances", "zeta"), db.mapNames());
    }

    @Test
    public void schemasAreExposedOnHandles() {
        try (DataMapView map = db.getDataMap("balances").orElseThrow()) {
            assertEquals(OWNER, map.keyType());
            assertEquals(AMOUNT, map.valueType());
        }
    }

    @Test
    public void manyReadersOrOneWriter() {
        DataMapView r1 = db.getDataMap("balances").orElseThrow();
        DataMapView r2 = db.getDataMap("balances").orElseThrow();
        assertThrows(IllegalStateException.class, () -> db.getMutDataMap("balances"));
        r1.close();
        assertThrows(IllegalStateException.class, () -> db.getMutDataMap("balances"));
        r2.close();

        DataMap w = db.getMutDataMap("balances").orElseThrow();
        assertThrows(IllegalStateException.class, () -> db.getMutDataMap("balances"));
        assertThrows(IllegalStateException.class, () -> db.getDataMap("balances"));
        w.close();

        db.getDataMap("balances").orElseThrow().close();
    }

    @Test
    public void readHandleExposesNoMutators() {
        try (DataMapView view = db.getDataMap("balances").orElseThrow()) {
            assertFalse(view instanceof DataMap);
        }
    }

    @Test
    public void borrowsAreTrackedPerName() {
        db.createMap("other", OWNER, AMOUNT);
        try (DataMap a = writable("balances");
             DataMap b = writable("other")) {
            a.setEntry(owner("alice"), amount(1));
            b.setEntry(owner("alice"), amount(2));
        }
    }

    @Test
    public void closedHandleIsUnusable() {
        DataMap map = writable("balances");
        map.close();
        map.close();
        assertThrows(IllegalStateException.class, () -> map.fetchEntry(owner("alice")));
        assertThrows(IllegalStateException.class, () -> map.setEntry(owner("alice"), amount(1)));
    }

    @Test
    public void closingDatabaseInvalidatesOpenHandles() {
        DataMap writer = writable("balances");
        writer.setEntry(owner("alice"), amount(1));
        db.close();

        assertThrows(IllegalStateException.class, () -> writer.fetchEntry(owner("alice")));
        assertThrows(IllegalStateException.class, () -> writer.setEntry(owner("alice"), amount(2)));
        assertThrows(IllegalStateException.class, () -> writer.insertEntry(owner("bob"), amount(2)));
        assertThrows(IllegalStateException.class, () -> writer.deleteEntry(owner("alice")));
        assertThrows(IllegalStateException.class, writer::size);
        assertThrows(IllegalStateException.class, () -> writer.forEachEntry((k, v) -> { }));
        writer.close();
    }

    @Test
    public void cannotRecreateBorrowedMap() {
        try (DataMapView view = db.getDataMap("balances").orElseThrow()) {
            assertThrows(IllegalStateException.class, () -> db.createMap("balances", OWNER, AMOUNT));
            assertEquals(OWNER, view.keyType());
        }
        db.createMap("balances", OWNER, AMOUNT);
    }

    @Test
    public void createMapRejectsMissingArguments() {
        assertThrows(IllegalArgumentException.class, () -> db.createMap("", OWNER, AMOUNT));
        assertThrows(IllegalArgumentException.class, () -> db.createMap("x", null, AMOUNT));
        assertFalse(db.hasMap("x"));
    }

    @Test
    public void nestedTupleAndBufferValues() {
        TupleTypeSignature key = TupleTypeSignature.builder()
                .field("id", TypeSignature.buffer(4))
                .build();
        TupleTypeSignature meta = TupleTypeSignature.builder()
                .field("owner", OWNER.asType())
                .field("active", TypeSignature.BOOL)
                .build();
        db.createMap("tokens", key, meta);

        Value id = Value.tupleBuilder().put("id", Value.buffer(new byte[] {1, 2, 3})).build();
        Value entry = Value.tupleBuilder().put("owner", owner("alice")).putBool("active", true).build();
        try (DataMap map = writable("tokens")) {
            map.setEntry(id, entry);
            assertEquals(entry, map.fetchEntry(id));

            Value tooLong = Value.tupleBuilder().put("id", Value.buffer(new byte[5])).build();
            assertThrows(TypeMismatchException.class, () -> map.fetchEntry(tooLong));
        }
    }
}
