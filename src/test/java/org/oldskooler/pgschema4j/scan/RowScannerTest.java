package org.oldskooler.pgschema4j.scan;

import org.junit.jupiter.api.Test;
import org.oldskooler.pgschema4j.exceptions.ScanException;
import org.oldskooler.pgschema4j.mapping.PasswordHandler;
import org.oldskooler.pgschema4j.mapping.Schema;
import org.oldskooler.pgschema4j.mapping.Table;
import org.oldskooler.pgschema4j.models.Account;
import org.oldskooler.pgschema4j.models.Place;
import org.oldskooler.pgschema4j.models.Post;
import org.oldskooler.pgschema4j.operations.Rows;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RowScannerTest {

    private final Schema schema = new Schema()
            .register("posts", Post.class)
            .mustRegister("accounts", Account.class)
            .register("places", Place.class);

    @Test
    void planChoosesStrategies() {
        ScanPlan plan = RowScanner.plan(schema.get(Post.class),
                Arrays.asList("id", "title", "summary", "search", "not_a_column"));

        assertEquals(DecodeStrategy.DEFAULT, plan.strategyOf("id"));
        assertEquals(DecodeStrategy.DEFAULT, plan.strategyOf("title"));
        assertEquals(DecodeStrategy.NULLABLE, plan.strategyOf("summary"));
        assertEquals(DecodeStrategy.NO_OP, plan.strategyOf("search"));
        assertEquals(DecodeStrategy.NO_OP, plan.strategyOf("not_a_column"));
    }

    @Test
    void strictTableRejectsUnknownColumns() {
        assertThrows(ScanException.class,
                () -> RowScanner.plan(schema.get(Account.class), Arrays.asList("id", "nickname")));
    }

    @Test
    void decodesJsonArraysOptionalsAndEmbeddedFields() {
        LocalDateTime created = LocalDateTime.of(2024, 5, 6, 7, 8, 9);
        ScanPlan plan = RowScanner.plan(schema.get(Post.class),
                Arrays.asList("id", "created_at", "title", "tags", "metadata", "summary", "search"));

        Post post = RowScanner.scan(plan, Arrays.asList(
                5L, Timestamp.valueOf(created), "hello", Arrays.asList("a", "b"), "{\"k\":\"v\"}", "short", "'hello':1"));

        assertEquals(Long.valueOf(5L), post.getId());
        assertEquals(created, post.getAudit().getCreatedAt());
        assertEquals("hello", post.getTitle());
        assertEquals(Arrays.asList("a", "b"), post.getTags());
        assertEquals("v", post.getMetadata().get("k"));
        assertEquals(Optional.of("short"), post.getSummary());
        assertNull(post.getSearch());
    }

    @Test
    void nullableLeavesFieldUntouched() {
        ScanPlan plan = RowScanner.plan(schema.get(Place.class), Arrays.asList("id", "label"));
        Place place = new Place();
        place.setLabel("kept");

        RowScanner.scanInto(plan, place, Arrays.asList(1, null));
        assertEquals(1, place.getId());
        assertEquals("kept", place.getLabel());
    }

    @Test
    void nullableOptionalBecomesEmpty() {
        ScanPlan plan = RowScanner.plan(schema.get(Post.class), Arrays.asList("id", "summary"));
        Post post = new Post();
        post.setSummary(Optional.of("stale"));

        RowScanner.scanInto(plan, post, Arrays.asList(5L, null));
        assertEquals(5L, post.getId());
        assertEquals(Optional.empty(), post.getSummary());
    }

    @Test
    void nullIntoPrimitiveFails() {
        ScanPlan plan = RowScanner.plan(schema.get(Place.class), Collections.singletonList("id"));
        assertThrows(ScanException.class, () -> RowScanner.scan(plan, Collections.singletonList(null)));
    }

    @Test
    void valueScannerFields() {
        ScanPlan plan = RowScanner.plan(schema.get(Place.class), Arrays.asList("id", "location"));
        Place place = RowScanner.scan(plan, Arrays.asList(3, "1.5, 2.5"));

        assertEquals(1.5d, place.getLocation().getX());
        assertEquals(2.5d, place.getLocation().getY());
    }

    @Test
    void passwordDecryptHook() {
        Table accounts = schema.get(Account.class);
        accounts.setPasswordHandler(new PasswordHandler(null,
                (t, stored) -> stored.startsWith("enc:") ? stored.substring(4) : ""));

        ScanPlan plan = RowScanner.plan(accounts, Arrays.asList("id", "username", "password", "age"));
        assertEquals(DecodeStrategy.PASSWORD, plan.strategyOf("password"));
        assertEquals(DecodeStrategy.DEFAULT, plan.strategyOf("age"));

        Account decrypted = RowScanner.scan(plan, Arrays.asList(1, "bob", "enc:pw", 30));
        assertEquals("pw", decrypted.getPassword());
        assertEquals(Integer.valueOf(30), decrypted.getAge());

        Account verifyOnly = RowScanner.scan(plan, Arrays.asList(2, "amy", "$2a$hash", null));
        assertNull(verifyOnly.getPassword());
        assertNull(verifyOnly.getAge());

        assertThrows(ScanException.class, () -> RowScanner.scan(plan, Arrays.asList(3, "x", 42, null)));
    }

    @Test
    void conversionFailureIsScanException() {
        ScanPlan plan = RowScanner.plan(schema.get(Place.class), Collections.singletonList("id"));
        assertThrows(ScanException.class, () -> RowScanner.scan(plan, Collections.singletonList("not a number")));
    }

    @Test
    void scanAllReadsEveryRow() throws SQLException {
        Rows rows = mock(Rows.class);
        when(rows.columnNames()).thenReturn(Arrays.asList("id", "label"));
        when(rows.next()).thenReturn(true, true, false);
        when(rows.values()).thenReturn(Arrays.<Object>asList(1, "one"), Arrays.<Object>asList(2, "two"));

        List<Place> places = RowScanner.scanAll(schema.get(Place.class), rows);
        assertEquals(2, places.size());
        assertEquals("two", places.get(1).getLabel());
    }
}
