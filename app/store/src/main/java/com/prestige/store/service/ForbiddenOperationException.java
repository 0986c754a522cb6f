package com.prestige.store.service;

/** 認証済みだが権限が足りない操作。 */
public class ForbiddenOperationException extends RuntimeException {

  public ForbiddenOperationException(String message) {
    super(message);
  }
}
