package com.prestige.store.service;

/** 認証情報が一致しない、またはトークンの利用者が存在しない。 */
public class InvalidCredentialsException extends RuntimeException {

  public InvalidCredentialsException(String message) {
    super(message);
  }
}
