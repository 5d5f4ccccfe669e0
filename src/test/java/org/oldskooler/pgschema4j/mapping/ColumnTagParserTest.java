package org.oldskooler.pgschema4j.mapping;

import org.junit.jupiter.api.Test;
import org.oldskooler.pgschema4j.exceptions.AnnotationException;
import org.oldskooler.pgschema4j.util.Names;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ColumnTagParserTest {

    private static Column parse(String fieldName, Class<?> type, String tag) {
        return ColumnTagParser.parse("customers", fieldName, type, tag, Names::snakeCase);
    }

    @Test
    void tokenizeKeepsCommasInsideParenthesesAndQuotes() {
        List<ColumnTagParser.Option> options =
                ColumnTagParser.tokenize("type=numeric(10,2),check=price > 0,default='a,b',unique");

        assertEquals(4, options.size());
        assertEquals("type", options.get(0).key);
        assertEquals("numeric(10,2)", options.get(0).value);
        assertEquals("price > 0", options.get(1).value);
        assertEquals("'a,b'", options.get(2).value);
        assertTrue(options.get(3).bare);
    }

    @Test
    void primaryUuidGetsRandomDefault() {
        Column c = parse("id", UUID.class, "type=uuid,primary");

        assertEquals("id", c.getName());
        assertTrue(c.isPrimaryKey());
        assertEquals(Column.GEN_RANDOM_UUID, c.getDefaultValue());
        assertTrue(c.isGeneratedPrimaryUUID());
        assertTrue(c.isGenerated());
    }

    @Test
    void nameDefaultsToSnakeCaseAndBareWordRenames() {
        assertEquals("cognito_user_id", parse("cognitoUserId", String.class, "type=text").getName());
        assertEquals("sub", parse("cognitoUserId", String.class, "sub,type=text").getName());
        assertEquals("other", parse("cognitoUserId", String.class, "name=other").getName());
    }

    @Test
    void typeFallsBackToJavaType() {
        assertEquals(DataType.TEXT, parse("name", String.class, "unique").getType());
        assertEquals(DataType.TEXT, parse("secret", Object.class, "password").getType());
        assertThrows(AnnotationException.class, () -> parse("blob", Object.class, "unique"));
    }

    @Test
    void varcharDefaultGetsCastOnce() {
        Column c = parse("title", String.class, "type=varchar(255),default='x'");
        assertEquals("'x'::character varying", c.getDefaultValue());

        Column again = parse("title", String.class, "type=varchar(255),default='x'::character varying");
        assertEquals("'x'::character varying", again.getDefaultValue());
    }

    @Test
    void nullableSetsNullDefault() {
        Column c = parse("age", Integer.class, "type=int,nullable");
        assertTrue(c.isNullable());
        assertEquals("null", c.getDefaultValue());

        Column notNull = parse("age", Integer.class, "type=int,default=null,nullable=false");
        assertFalse(notNull.isNullable());
        assertEquals("", notNull.getDefaultValue());
    }

    @Test
    void tagStringRoundTrips() {
        String[] tags = {
                "type=uuid,primary",
                "type=varchar(255),default='x',unique",
                "type=int,nullable",
                "type=uuid,ref=users(id set null deferrable),index=btree",
                "type=text,unique_index=customer_unique_idx,check=length(email) > 3",
                "type=text,password",
                "type=timestamp,default=clock_timestamp()",
        };
        for (String tag : tags) {
            Column first = parse("field", String.class, tag);
            String rendered = first.tagString(true);
            Column second = parse("field", String.class, rendered);
            assertEquals(rendered, second.tagString(true), tag);
        }
    }

    @Test
    void uniqueAndUniqueIndexAreExclusive() {
        AnnotationException e = assertThrows(AnnotationException.class,
                () -> parse("email", String.class, "type=text,unique,unique_index=uq"));
        assertTrue(e.getMessage().contains("unique and unique_index"));
    }

    @Test
    void uniqueIndexWithoutNameUsesTableName() {
        assertEquals("customers_unique_idx", parse("email", String.class, "unique_index").getUniqueIndex());
    }

    @Test
    void indexMethods() {
        assertEquals(IndexType.BTREE, parse("email", String.class, "index").getIndex());
        assertEquals(IndexType.GIN, parse("email", String.class, "index=gin").getIndex());
        assertThrows(AnnotationException.class, () -> parse("email", String.class, "index=fancy"));
    }

    @Test
    void invalidTypes() {
        AnnotationException missing = assertThrows(AnnotationException.class,
                () -> parse("name", String.class, "type=varchar(255"));
        assertTrue(missing.getMessage().contains("missing right parenthesis"));
        assertThrows(AnnotationException.class, () -> parse("name", String.class, "type=nope"));
    }

    @Test
    void unknownOptionIsRejected() {
        assertThrows(AnnotationException.class, () -> parse("name", String.class, "type=text,colour=red"));
    }

    @Test
    void tsvectorIsUnscannable() {
        assertTrue(parse("search", String.class, "type=tsvector").isUnscannable());
    }

    @Test
    void references() {
        ColumnTagParser.Reference self = ColumnTagParser.parseReference("customers", "id");
        assertEquals("customers", self.tableName);
        assertEquals("id", self.columnName);
        assertEquals("CASCADE", self.onDelete);
        assertFalse(self.deferrable);

        ColumnTagParser.Reference selfAction = ColumnTagParser.parseReference("customers", "(id restrict)");
        assertEquals("customers", selfAction.tableName);
        assertEquals("RESTRICT", selfAction.onDelete);

        ColumnTagParser.Reference other = ColumnTagParser.parseReference("orders", "users(id no action)");
        assertEquals("users", other.tableName);
        assertEquals("NO ACTION", other.onDelete);

        ColumnTagParser.Reference deferred = ColumnTagParser.parseReference("orders", "users(id cascade deferrable)");
        assertTrue(deferred.deferrable);
    }

    @Test
    void invalidReferences() {
        assertThrows(AnnotationException.class,
                () -> ColumnTagParser.parseReference("orders", "users(id restrict deferrable)"));
        assertThrows(AnnotationException.class,
                () -> ColumnTagParser.parseReference("orders", "users(id bogus)"));
        assertThrows(AnnotationException.class,
                () -> ColumnTagParser.parseReference("orders", "users(id"));
    }

    @Test
    void isEnabled() {
        assertTrue(ColumnTagParser.isEnabled("type=text,presenter", "presenter"));
        assertTrue(ColumnTagParser.isEnabled("presenter=true", "presenter"));
        assertFalse(ColumnTagParser.isEnabled("presenter=false", "presenter"));
        assertFalse(ColumnTagParser.isEnabled("type=text", "presenter"));
    }
}
