package org.oldskooler.pgschema4j.operations;

import org.junit.jupiter.api.Test;
import org.postgresql.util.PGInterval;
import org.postgresql.util.PGobject;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

class RowMapperTest {

    @Test
    void arraysBecomeLists() throws SQLException {
        Array arr = mock(Array.class);
        when(arr.getArray()).thenReturn(new Object[]{"a", new Object[]{"b", "c"}});

        assertEquals(Arrays.asList("a", Arrays.asList("b", "c")), RowMapper.normalize(arr));
        verify(arr).free();
    }

    @Test
    void driverObjectsBecomeText() throws SQLException {
        PGobject json = new PGobject();
        json.setType("json");
        json.setValue("{\"k\":1}");
        assertEquals("{\"k\":1}", RowMapper.normalize(json));
    }

    @Test
    void intervalsBecomeDurations() throws SQLException {
        PGInterval iv = new PGInterval(0, 0, 2, 3, 0, 1.5d);
        assertEquals(Duration.ofDays(2).plusHours(3).plusMillis(1500), RowMapper.normalize(iv));

        PGInterval monthly = new PGInterval(0, 1, 0, 0, 0, 0);
        assertEquals(monthly.getValue(), RowMapper.normalize(monthly));
    }

    @Test
    void toMapListUsesLabels() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(2);
        when(md.getColumnLabel(1)).thenReturn("table_name");
        when(md.getColumnLabel(2)).thenReturn("is_nullable");
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn("customers");
        when(rs.getObject(2)).thenReturn(true);

        List<Map<String, Object>> rows = RowMapper.toMapList(rs);
        assertEquals(1, rows.size());
        assertEquals("customers", rows.get(0).get("table_name"));
        assertEquals(true, rows.get(0).get("is_nullable"));
    }
}
