package com.intellifill.mapping.service.pipeline;

public enum Stage {
  CLASSIFY,
  MAP,
  QA,
  RECOVER,
  FINALIZE,
  FAILED;

  public boolean isTerminal() {
    return this == FINALIZE || this == FAILED;
  }
}
