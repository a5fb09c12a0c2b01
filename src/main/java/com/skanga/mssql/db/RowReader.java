package com.skanga.mssql.db;

import java.sql.Clob;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads JDBC rows into ordered column-to-value maps, keeping each value's semantic type.
 * Timestamps, dates and times become {@code java.time} values; SQL NULL becomes null.
 */
public final class RowReader {
    // microsoft.sql.Types.DATETIMEOFFSET
    static final int SQLSERVER_DATETIMEOFFSET = -155;

    private RowReader() {
    }

    /**
     * Reads every remaining row of the result set. The result set is not closed.
     */
    public static List<Map<String, Object>> readRows(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        int columnCount = metaData.getColumnCount();

        List<Map<String, Object>> resultRows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> currRow = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                currRow.put(metaData.getColumnLabel(i), readValue(resultSet, i, metaData.getColumnType(i)));
            }
            resultRows.add(currRow);
        }
        return resultRows;
    }

    static Object readValue(ResultSet resultSet, int columnIndex, int columnType) throws SQLException {
        if (columnType == SQLSERVER_DATETIMEOFFSET || columnType == Types.TIMESTAMP_WITH_TIMEZONE) {
            return resultSet.getObject(columnIndex, OffsetDateTime.class);
        }
        return materialize(resultSet.getObject(columnIndex));
    }

    /**
     * Converts driver-specific value classes into types that serialize by meaning.
     */
    public static Object materialize(Object columnValue) throws SQLException {
        if (columnValue instanceof Timestamp) {
            return ((Timestamp) columnValue).toLocalDateTime();
        } else if (columnValue instanceof Date) {
            return ((Date) columnValue).toLocalDate();
        } else if (columnValue instanceof Time) {
            return ((Time) columnValue).toLocalTime();
        } else if (columnValue instanceof Clob) {
            Clob clobValue = (Clob) columnValue;
            return clobValue.getSubString(1, (int) clobValue.length());
        }
        return columnValue;
    }
}
