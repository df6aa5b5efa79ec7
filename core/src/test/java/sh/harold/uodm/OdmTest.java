package sh.harold.uodm;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sh.harold.uodm.schema.AttributeType;
import sh.harold.uodm.schema.ImmutableAttributeException;
import sh.harold.uodm.schema.InvalidValueException;
import sh.harold.uodm.schema.Schema;
import sh.harold.uodm.schema.UnknownAttributeException;
import sh.harold.uodm.store.DocumentKey;
import sh.harold.uodm.store.DocumentNotFoundException;
import sh.harold.uodm.store.DocumentSnapshot;
import sh.harold.uodm.store.DocumentStore;
import sh.harold.uodm.store.DuplicateNameException;
import sh.harold.uodm.store.impl.NitriteDocumentStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OdmTest {

    private static final Schema CITY = Schema.builder("cities")
        .immutable("name", AttributeType.STRING)
        .mutable("population", AttributeType.INTEGER)
        .immutable("ancient", AttributeType.BOOLEAN, false)
        .build();

    private static final Schema PERSON = Schema.builder("people")
        .immutable("name", AttributeType.STRING)
        .mutable("age", AttributeType.INTEGER)
        .reference("city", CITY, true)
        .immutable("is_cool", AttributeType.BOOLEAN, true)
        .build();

    private static final Schema CITIZEN = Schema.builder("citizens")
        .mutable("age", AttributeType.INTEGER)
        .immutable("ssn", AttributeType.STRING)
        .build();

    private NitriteDocumentStore store;
    private Odm odm;

    @BeforeEach
    void setUp() {
        store = NitriteDocumentStore.inMemory();
        odm = new Odm(StoreConnection.using(store));
    }

    @AfterEach
    void tearDown() {
        odm.close();
    }

    @Test
    void repeatedLookupsReturnTheSameInstance() {
        odm.create(CITIZEN, "alice-123", Map.of("age", 29, "ssn", "000-00-0000"));
        odm.releaseAll();

        MappedDocument first = odm.find(CITIZEN, "alice-123");
        MappedDocument second = odm.find(CITIZEN, "alice-123");
        MappedDocument third = odm.getOrCreate(CITIZEN, "alice-123", Map.of("age", 1, "ssn", "x"));

        assertThat(second).isSameAs(first);
        assertThat(third).isSameAs(first);
        assertThat(third.get("age")).isEqualTo(29);
        assertThat(odm.liveCount()).isEqualTo(1);
    }

    @Test
    void writesAreVisibleToAFreshLoad() {
        MappedDocument alice = odm.create(CITIZEN, "alice-123", Map.of("age", 29, "ssn", "000-00-0000"));

        alice.set("age", 30);

        Odm other = new Odm(StoreConnection.using(store));
        MappedDocument fresh = other.find(CITIZEN, "alice-123");
        assertThat(fresh).isNotSameAs(alice);
        assertThat(fresh.get("age")).isEqualTo(30);
    }

    @Test
    void immutableAttributeIsOnlySetAtCreation() {
        MappedDocument alice = odm.create(CITIZEN, "alice-123", Map.of("age", 29, "ssn", "000-00-0000"));

        alice.set("age", 30);
        assertThatThrownBy(() -> alice.set("ssn", "111-11-1111"))
            .isInstanceOf(ImmutableAttributeException.class);

        odm.release(alice);
        MappedDocument reloaded = odm.find(CITIZEN, "alice-123");
        assertThat(reloaded).isNotSameAs(alice);
        assertThat(reloaded.get("age")).isEqualTo(30);
        assertThat(reloaded.get("ssn")).isEqualTo("000-00-0000");
    }

    @Test
    void immutableAttributeLeftAtDefaultCanBeSetOnce() {
        Schema accounts = Schema.builder("accounts")
            .mutable("age", AttributeType.INTEGER)
            .immutable("ssn", AttributeType.STRING, null)
            .immutable("tier", AttributeType.STRING, "basic")
            .build();
        MappedDocument account = odm.create(accounts, "a", Map.of("age", 1));
        assertThat(account.get("ssn")).isNull();

        account.set("ssn", "000-00-0000");
        account.set("tier", "gold");

        assertThatThrownBy(() -> account.set("ssn", "111-11-1111"))
            .isInstanceOf(ImmutableAttributeException.class);
        assertThatThrownBy(() -> account.set("tier", "basic"))
            .isInstanceOf(ImmutableAttributeException.class);
        account.reload();
        assertThat(account.get("ssn")).isEqualTo("000-00-0000");
        assertThat(account.get("tier")).isEqualTo("gold");

        Odm other = new Odm(StoreConnection.using(store));
        MappedDocument fresh = other.find(accounts, "a");
        assertThat(fresh.get("ssn")).isEqualTo("000-00-0000");
        assertThatThrownBy(() -> fresh.set("ssn", "222-22-2222"))
            .isInstanceOf(ImmutableAttributeException.class);
    }

    @Test
    void immutableAttributeGivenAtCreationIsNeverWritable() {
        Schema accounts = Schema.builder("accounts")
            .immutable("tier", AttributeType.STRING, "basic")
            .build();
        MappedDocument account = odm.create(accounts, "b", Map.of("tier", "gold"));

        assertThatThrownBy(() -> account.set("tier", "platinum"))
            .isInstanceOf(ImmutableAttributeException.class);
        assertThat(odm.connection().load("accounts", "b").fields()).containsEntry("tier", "gold");
    }

    @Test
    void getOrCreateInsertsWhenMissing() {
        MappedDocument bob = odm.getOrCreate(CITIZEN, "bob", Map.of("age", 41, "ssn", "222-22-2222"));

        assertThat(bob.name()).isEqualTo("bob");
        assertThat(odm.connection().count("citizens")).isEqualTo(1);
        assertThat(odm.find(CITIZEN, "bob")).isSameAs(bob);
    }

    @Test
    void getOrCreateWithoutDefaultsFailsWhenMissing() {
        assertThatThrownBy(() -> odm.getOrCreate(CITIZEN, "nobody", null))
            .isInstanceOf(DocumentNotFoundException.class);
        assertThatThrownBy(() -> odm.find(CITIZEN, "nobody"))
            .isInstanceOf(DocumentNotFoundException.class);
        assertThat(odm.liveCount()).isZero();
    }

    @Test
    void createGeneratesUuidNames() {
        MappedDocument paris = odm.create(CITY, Map.of("name", "Paris", "population", 2_100_000));
        MappedDocument rome = odm.create(CITY, Map.of("name", "Rome", "population", 2_800_000, "ancient", true));

        assertThat(UUID.fromString(paris.name())).isNotNull();
        assertThat(rome.name()).isNotEqualTo(paris.name());
        assertThat(paris.get("ancient")).isEqualTo(false);
        assertThat(rome.get("ancient")).isEqualTo(true);
    }

    @Test
    void createRejectsTakenNames() {
        odm.create(CITIZEN, "alice-123", Map.of("age", 29, "ssn", "000-00-0000"));

        assertThatThrownBy(() -> odm.create(CITIZEN, "alice-123", Map.of("age", 1, "ssn", "1")))
            .isInstanceOf(DuplicateNameException.class);
    }

    @Test
    void createValidatesFields() {
        assertThatThrownBy(() -> odm.create(CITIZEN, Map.of("age", 3)))
            .isInstanceOf(InvalidValueException.class)
            .hasMessageContaining("ssn");
        assertThatThrownBy(() -> odm.create(CITIZEN, Map.of("age", 3, "ssn", "1", "nickname", "al")))
            .isInstanceOf(UnknownAttributeException.class);
        assertThatThrownBy(() -> odm.create(CITIZEN, Map.of("age", "three", "ssn", "1")))
            .isInstanceOf(InvalidValueException.class);
        assertThat(odm.connection().count("citizens")).isZero();
    }

    @Test
    void referencesResolveThroughTheRegistry() {
        MappedDocument paris = odm.create(CITY, Map.of("name", "Paris", "population", 2_100_000));
        MappedDocument alice = odm.create(PERSON, Map.of("name", "Alice", "age", 30, "city", paris));

        assertThat(alice.get("city")).isEqualTo(paris.name());
        assertThat(alice.reference("city")).containsSame(paris);

        odm.releaseAll();
        MappedDocument reloaded = odm.find(PERSON, alice.name());
        MappedDocument city = reloaded.reference("city").orElseThrow();
        assertThat(city.get("name")).isEqualTo("Paris");
        assertThat(reloaded.reference("city")).containsSame(city);
    }

    @Test
    void referenceCanBeReassigned() {
        MappedDocument paris = odm.create(CITY, Map.of("name", "Paris", "population", 2_100_000));
        MappedDocument rome = odm.create(CITY, Map.of("name", "Rome", "population", 2_800_000));
        MappedDocument alice = odm.create(PERSON, Map.of("name", "Alice", "age", 30, "city", paris));

        alice.set("city", rome);

        assertThat(alice.reference("city")).containsSame(rome);
        assertThatThrownBy(() -> alice.set("city", alice))
            .isInstanceOf(InvalidValueException.class);
    }

    @Test
    void danglingReferenceIsReported() {
        MappedDocument paris = odm.create(CITY, Map.of("name", "Paris", "population", 2_100_000));
        MappedDocument alice = odm.create(PERSON, Map.of("name", "Alice", "age", 30, "city", paris));

        assertThat(odm.delete(paris)).isTrue();

        assertThat(paris.isReleased()).isTrue();
        assertThatThrownBy(() -> alice.reference("city"))
            .isInstanceOf(DanglingReferenceException.class)
            .hasMessageContaining(paris.name());
    }

    @Test
    void nullReferenceIsEmpty() {
        MappedDocument alice = odm.create(PERSON, Map.of("name", "Alice", "age", 30, "city", "placeholder"));

        alice.set("city", null);

        assertThat(alice.reference("city")).isEmpty();
    }

    @Test
    void selfReferencingSchemasResolve() {
        Schema node = Schema.builder("nodes")
            .immutable("label", AttributeType.STRING)
            .reference("parent", "nodes", true)
            .build();
        MappedDocument root = odm.create(node, "root", Map.of("label", "root", "parent", "root"));
        MappedDocument leaf = odm.create(node, "leaf", Map.of("label", "leaf", "parent", root));

        assertThat(leaf.reference("parent")).containsSame(root);
        assertThat(root.reference("parent")).containsSame(root);
    }

    @Test
    void findAllMatchesCriteriaAndKeepsIdentity() {
        MappedDocument paris = odm.create(CITY, Map.of("name", "Paris", "population", 2_100_000));
        MappedDocument alice = odm.create(PERSON, Map.of("name", "Alice", "age", 30, "city", paris));
        odm.create(PERSON, Map.of("name", "Bob", "age", 41, "city", paris));
        odm.create(PERSON, Map.of("name", "Carol", "age", 30, "city", "elsewhere"));

        List<MappedDocument> thirty = odm.findAll(PERSON, Map.of("age", 30));
        List<MappedDocument> parisians = odm.findAll(PERSON, Map.of("city", paris));
        List<MappedDocument> everyone = odm.findAll(PERSON, Map.of());

        assertThat(thirty).extracting(doc -> doc.get("name")).containsExactlyInAnyOrder("Alice", "Carol");
        assertThat(thirty).anySatisfy(doc -> assertThat(doc).isSameAs(alice));
        assertThat(parisians).extracting(doc -> doc.get("name")).containsExactlyInAnyOrder("Alice", "Bob");
        assertThat(everyone).hasSize(3);
        assertThatThrownBy(() -> odm.findAll(PERSON, Map.of("height", 180)))
            .isInstanceOf(UnknownAttributeException.class);
    }

    @Test
    void releaseKeepsTheStoredDocument() {
        MappedDocument alice = odm.create(CITIZEN, "alice-123", Map.of("age", 29, "ssn", "000-00-0000"));

        assertThat(odm.release(CITIZEN, "alice-123")).isTrue();
        assertThat(odm.release(CITIZEN, "alice-123")).isFalse();

        assertThat(alice.isReleased()).isTrue();
        assertThat(odm.isLive(CITIZEN, "alice-123")).isFalse();
        assertThatThrownBy(() -> alice.set("age", 31)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> alice.get("age")).isInstanceOf(IllegalStateException.class);

        MappedDocument again = odm.find(CITIZEN, "alice-123");
        assertThat(again).isNotSameAs(alice);
        assertThat(again.get("age")).isEqualTo(29);
    }

    @Test
    void deleteRemovesTheStoredDocument() {
        odm.create(CITIZEN, "alice-123", Map.of("age", 29, "ssn", "000-00-0000"));

        assertThat(odm.delete(CITIZEN, "alice-123")).isTrue();
        assertThat(odm.delete(CITIZEN, "alice-123")).isFalse();

        assertThat(odm.isLive(CITIZEN, "alice-123")).isFalse();
        assertThatThrownBy(() -> odm.find(CITIZEN, "alice-123"))
            .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    void collectionCannotBeMappedTwiceDifferently() {
        odm.register(CITIZEN);
        Schema other = Schema.builder("citizens")
            .mutable("age", AttributeType.NUMBER)
            .build();
        Schema same = Schema.builder("citizens")
            .mutable("age", AttributeType.INTEGER)
            .immutable("ssn", AttributeType.STRING)
            .build();

        assertThatThrownBy(() -> odm.find(other, "alice-123"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(odm.schema("citizens")).contains(CITIZEN);
        assertThat(odm.getOrCreate(same, "x", Map.of("age", 1, "ssn", "1")).schema()).isEqualTo(CITIZEN);
    }

    @Test
    void staleCacheIsRefreshedByReload() {
        MappedDocument alice = odm.create(CITIZEN, "alice-123", Map.of("age", 29, "ssn", "000-00-0000"));
        odm.connection().update("citizens", "alice-123", "age", 35);

        assertThat(alice.get("age")).isEqualTo(29);
        alice.reload();
        assertThat(alice.get("age")).isEqualTo(35);

        odm.connection().delete("citizens", "alice-123");
        assertThatThrownBy(() -> alice.set("age", 36)).isInstanceOf(DocumentNotFoundException.class);
        assertThat(alice.get("age")).isEqualTo(35);
        assertThatThrownBy(alice::reload).isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    void closeReleasesEverything() {
        MappedDocument alice = odm.create(CITIZEN, "alice-123", Map.of("age", 29, "ssn", "000-00-0000"));

        odm.close();

        assertThat(alice.isReleased()).isTrue();
        assertThat(odm.connection().isOpen()).isFalse();
        assertThatThrownBy(() -> odm.find(CITIZEN, "alice-123")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void lostCreationRaceLoadsTheWinner() {
        DocumentStore racing = mock(DocumentStore.class);
        DocumentKey key = DocumentKey.of("citizens", "bob");
        when(racing.load(key)).thenReturn(
            Optional.empty(),
            Optional.of(new DocumentSnapshot(key, Map.of("age", 41, "ssn", "winner")))
        );
        doThrow(new DuplicateNameException(key)).when(racing).insert(eq(key), anyMap());
        Odm raced = new Odm(StoreConnection.using(racing), () -> "unused", Logger.getLogger("test"));

        MappedDocument bob = raced.getOrCreate(CITIZEN, "bob", Map.of("age", 1, "ssn", "loser"));

        assertThat(bob.get("ssn")).isEqualTo("winner");
        assertThat(raced.find(CITIZEN, "bob")).isSameAs(bob);
        verify(racing, times(2)).load(key);
    }

    @Test
    void concurrentGetOrCreateConvergesOnOneInstance() throws Exception {
        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MappedDocument>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                int age = i;
                results.add(executor.submit(() -> {
                    start.await();
                    return odm.getOrCreate(CITIZEN, "shared", Map.of("age", age, "ssn", "s-" + age));
                }));
            }
            start.countDown();
            MappedDocument first = results.get(0).get(10, TimeUnit.SECONDS);
            for (Future<MappedDocument> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(odm.connection().count("citizens")).isEqualTo(1);
    }

    @Test
    void generatedNamesComeFromTheSupplier() {
        Odm sequential = new Odm(StoreConnection.using(NitriteDocumentStore.inMemory()), () -> "fixed-name", null);
        try (sequential) {
            MappedDocument doc = sequential.create(CITIZEN, Map.of("age", 1, "ssn", "1"));

            assertThat(doc.name()).isEqualTo("fixed-name");
            assertThatThrownBy(() -> sequential.create(CITIZEN, Map.of("age", 2, "ssn", "2")))
                .isInstanceOf(DuplicateNameException.class);
        }
    }
}
