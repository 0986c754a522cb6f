package com.prestige.store.service;

/** 要求されたリソースが存在しない。 */
public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String message) {
    super(message);
  }
}
