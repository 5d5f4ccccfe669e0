package org.oldskooler.pgschema4j.operations;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.oldskooler.pgschema4j.mapping.DataType;
import org.oldskooler.pgschema4j.query.JsonParameter;
import org.oldskooler.pgschema4j.query.PgArray;
import org.postgresql.util.PGInterval;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class JdbcParamBinderTest {

    @Test
    void rewritesDollarPlaceholders() {
        JdbcParamBinder.Rewritten r = JdbcParamBinder.rewrite(
                "UPDATE t SET a = $1, b = $2 WHERE id = $1;", Arrays.asList("x", "y"));

        assertEquals("UPDATE t SET a = ?, b = ? WHERE id = ?;", r.sql);
        assertEquals(Arrays.asList("x", "y", "x"), r.params);
    }

    @Test
    void leavesLiteralsIdentifiersCommentsAndBodiesAlone() {
        String sql = "SELECT '$1', \"$2\" -- $2\n"
                + "FROM t WHERE c = $1 AND f = $body$ SELECT $1 $body$";
        JdbcParamBinder.Rewritten r = JdbcParamBinder.rewrite(sql, Collections.singletonList("v"));

        assertEquals("SELECT '$1', \"$2\" -- $2\n"
                + "FROM t WHERE c = ? AND f = $body$ SELECT $1 $body$", r.sql);
        assertEquals(Collections.singletonList("v"), r.params);
    }

    @Test
    void escapesQuestionMarkOperator() {
        JdbcParamBinder.Rewritten r = JdbcParamBinder.rewrite(
                "SELECT data ? 'k' FROM t WHERE id = $1", Collections.singletonList(1));
        assertEquals("SELECT data ?? 'k' FROM t WHERE id = ?", r.sql);
    }

    @Test
    void missingArgument() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JdbcParamBinder.rewrite("SELECT $2", Collections.singletonList(1)));
        assertTrue(e.getMessage().contains("$2"));
    }

    @Test
    void bindsPostgresParameters() throws SQLException {
        PreparedStatement ps = mock(PreparedStatement.class);
        Connection conn = mock(Connection.class);
        Array sqlArray = mock(Array.class);
        when(ps.getConnection()).thenReturn(conn);
        when(conn.createArrayOf(eq("int8"), any(Object[].class))).thenReturn(sqlArray);

        List<Object> params = Arrays.asList(
                new PgArray(DataType.BIG_INT, Arrays.<Object>asList(1L, 2L)),
                new JsonParameter("{\"a\":1}", true),
                LocalDate.of(2024, 2, 29),
                "plain");
        JdbcParamBinder.bindParams(ps, params);

        verify(ps).setArray(1, sqlArray);

        ArgumentCaptor<Object> json = ArgumentCaptor.forClass(Object.class);
        verify(ps).setObject(eq(2), json.capture());
        PGobject obj = (PGobject) json.getValue();
        assertEquals("jsonb", obj.getType());
        assertEquals("{\"a\":1}", obj.getValue());

        verify(ps).setDate(3, Date.valueOf(LocalDate.of(2024, 2, 29)));
        verify(ps).setObject(4, "plain");
    }

    @Test
    void durationsBecomeIntervals() {
        PGInterval iv = JdbcParamBinder.toInterval(Duration.ofDays(1).plusHours(2).plusMinutes(3).plusSeconds(4));
        assertEquals(1, iv.getDays());
        assertEquals(2, iv.getHours());
        assertEquals(3, iv.getMinutes());
        assertEquals(4.0d, iv.getSeconds(), 0.0001d);
    }
}
