package com.prestige.store.data;

/** リレーショナルストア操作の失敗。下位ドライバのメッセージをそのまま保持する。 */
public class StorageException extends RuntimeException {

  private final String table;
  private final String operation;

  public StorageException(String table, String operation, String message, Throwable cause) {
    super(operation + " on " + table + " failed: " + message, cause);
    this.table = table;
    this.operation = operation;
  }

  public String table() {
    return table;
  }

  public String operation() {
    return operation;
  }
}
