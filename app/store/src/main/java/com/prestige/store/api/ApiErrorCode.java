/*
 * どこで: Store API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.prestige.store.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  FORBIDDEN,
  NOT_FOUND,
  CONFLICT,
  NOTIFICATION_SEND_FAILED,
  STORAGE_ERROR
}
