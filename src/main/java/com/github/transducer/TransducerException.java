package com.github.transducer;

/**
 * Unified single exception that's thrown and handled by this transducer. The idea is to use the
 * code enum to encapsulate various error/exception conditions. Configuration problems are always
 * reported while building the automaton table, never while matching tokens.
 */
public final class TransducerException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public TransducerException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public TransducerException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public TransducerException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public TransducerException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_CONFIGURATION("Transducer configuration is invalid"),
    // 2.
    INVALID_STATE_NAME("State name cannot be null or blank"),
    // 3.
    DUPLICATE_STATE("State name is declared more than once"),
    // 4.
    UNRESOLVED_STATE("Referenced state is not declared in the configuration"),
    // 5.
    INVALID_PATTERN("Transition pattern is null or cannot be compiled"),
    // 6.
    UNSUPPORTED_PROCESS("Requested process type is not supported by the transducer"),
    // 7.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire the cursor lock to perform requested operation. This is retryable.");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
