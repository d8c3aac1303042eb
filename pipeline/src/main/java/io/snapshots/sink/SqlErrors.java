package io.snapshots.sink;

import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTransientException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Classifies SQL failures. Transient ones (connection loss, deadlock, serialization failure) are worth a retry;
 * schema and data errors never succeed on retry.
 */
public final class SqlErrors {
    private SqlErrors() {}

    public static boolean isTransient(SQLException e) {
        for (SQLException cur : chain(e)) {
            if (isFatalOne(cur)) return false;
        }
        for (SQLException cur : chain(e)) {
            if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) return true;
            String cls = sqlStateClass(cur);
            if ("08".equals(cls) || "40".equals(cls)) return true;
        }
        return false;
    }

    public static boolean isFatal(SQLException e) {
        for (SQLException cur : chain(e)) {
            if (isFatalOne(cur)) return true;
        }
        return false;
    }

    private static boolean isFatalOne(SQLException e) {
        if (e instanceof SQLSyntaxErrorException || e instanceof SQLDataException) return true;
        String cls = sqlStateClass(e);
        return "42".equals(cls) || "22".equals(cls);
    }

    private static String sqlStateClass(SQLException e) {
        String state = e.getSQLState();
        return (state == null || state.length() < 2) ? null : state.substring(0, 2);
    }

    // the exception itself, its next-exception chain and SQLException causes
    private static List<SQLException> chain(SQLException e) {
        List<SQLException> out = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<SQLException> todo = new ArrayDeque<>();
        todo.add(e);
        while (!todo.isEmpty() && out.size() < 32) {
            SQLException cur = todo.poll();
            if (!seen.add(cur)) continue;
            out.add(cur);
            if (cur.getNextException() != null) todo.add(cur.getNextException());
            if (cur.getCause() instanceof SQLException c) todo.add(c);
        }
        return out;
    }
}
