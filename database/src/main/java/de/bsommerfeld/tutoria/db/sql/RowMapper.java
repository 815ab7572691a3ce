package de.bsommerfeld.tutoria.db.sql;

import java.sql.ResultSet;
import java.sql.SQLException;

@FunctionalInterface
public interface RowMapper<T> {

    /** Maps the current row; must not advance the cursor. */
    T map(ResultSet rs) throws SQLException;
}
