package com.prestige.store.service;

/** 一意制約に反する登録要求。 */
public class ConflictException extends RuntimeException {

  public ConflictException(String message) {
    super(message);
  }
}
