package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.exception.RuleConstraintException;
import com.voltageems.alarmsrv.exception.RuleException;
import com.voltageems.alarmsrv.exception.StorageUnavailableException;
import java.util.EnumSet;
import java.util.Set;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.TransactionException;

public final class StorageErrorClassifier {

  private static final Set<SQLiteErrorCode> UNAVAILABLE_CODES = EnumSet.of(
      SQLiteErrorCode.SQLITE_BUSY,
      SQLiteErrorCode.SQLITE_LOCKED,
      SQLiteErrorCode.SQLITE_IOERR,
      SQLiteErrorCode.SQLITE_CANTOPEN,
      SQLiteErrorCode.SQLITE_FULL,
      SQLiteErrorCode.SQLITE_READONLY,
      SQLiteErrorCode.SQLITE_CORRUPT,
      SQLiteErrorCode.SQLITE_NOTADB,
      SQLiteErrorCode.SQLITE_NOMEM,
      SQLiteErrorCode.SQLITE_PROTOCOL,
      SQLiteErrorCode.SQLITE_INTERRUPT
  );

  private StorageErrorClassifier() {}

  public static RuntimeException classify(String operation, RuntimeException failure) {
    if (failure instanceof RuleException) {
      return failure;
    }

    SQLiteException sqlite = findSqliteCause(failure);
    if (sqlite != null) {
      SQLiteErrorCode primary = primaryCode(sqlite.getResultCode());
      if (primary == SQLiteErrorCode.SQLITE_CONSTRAINT) {
        return constraint(operation, sqlite, failure);
      }
      if (primary != null && UNAVAILABLE_CODES.contains(primary)) {
        return unavailable(operation, failure);
      }
    }

    if (failure instanceof DataIntegrityViolationException) {
      return constraint(operation, sqlite, failure);
    }
    if (failure instanceof TransientDataAccessException
        || failure instanceof DataAccessResourceFailureException
        || failure instanceof TransactionException) {
      return unavailable(operation, failure);
    }
    return failure;
  }

  static RuleConstraintException.Kind constraintKind(SQLiteException sqlite, String message) {
    if (sqlite != null && sqlite.getResultCode() != null) {
      switch (sqlite.getResultCode()) {
        case SQLITE_CONSTRAINT_UNIQUE:
          return RuleConstraintException.Kind.UNIQUE_TUPLE;
        case SQLITE_CONSTRAINT_CHECK:
          return RuleConstraintException.Kind.CHECK;
        case SQLITE_CONSTRAINT_NOTNULL:
          return RuleConstraintException.Kind.NOT_NULL;
        default:
          break;
      }
    }
    if (message == null) {
      return RuleConstraintException.Kind.OTHER;
    }
    if (message.contains("UNIQUE constraint failed") && message.contains("rule_name")) {
      return RuleConstraintException.Kind.UNIQUE_TUPLE;
    }
    if (message.contains("CHECK constraint failed")) {
      return RuleConstraintException.Kind.CHECK;
    }
    if (message.contains("NOT NULL constraint failed")) {
      return RuleConstraintException.Kind.NOT_NULL;
    }
    return RuleConstraintException.Kind.OTHER;
  }

  private static RuleConstraintException constraint(
      String operation, SQLiteException sqlite, RuntimeException failure) {
    String detail = sqlite != null ? sqlite.getMessage() : mostSpecificMessage(failure);
    RuleConstraintException.Kind kind = constraintKind(sqlite, detail);
    return new RuleConstraintException(kind, operation + " rejected by store: " + detail, failure);
  }

  private static StorageUnavailableException unavailable(String operation, RuntimeException failure) {
    return new StorageUnavailableException(
        operation + " failed, rule store unavailable: " + mostSpecificMessage(failure), failure);
  }

  private static SQLiteErrorCode primaryCode(SQLiteErrorCode code) {
    if (code == null) {
      return null;
    }
    int primary = code.code & 0xFF;
    for (SQLiteErrorCode candidate : SQLiteErrorCode.values()) {
      if (candidate.code == primary) {
        return candidate;
      }
    }
    return null;
  }

  private static SQLiteException findSqliteCause(Throwable failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof SQLiteException sqlite) {
        return sqlite;
      }
      if (current.getCause() == current) {
        return null;
      }
      current = current.getCause();
    }
    return null;
  }

  private static String mostSpecificMessage(Throwable failure) {
    Throwable current = failure;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current.getMessage() != null ? current.getMessage() : failure.getMessage();
  }
}
