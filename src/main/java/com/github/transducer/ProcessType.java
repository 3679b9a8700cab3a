package com.github.transducer;

import com.github.transducer.TransducerException.Code;

/**
 * The kinds of processing a transducer can be asked to run through
 * {@link Transducer#process(String, String)}.
 */
public enum ProcessType {
  // extract labeled spans, see Transducer.processText()
  NER;

  static ProcessType fromName(final String name) throws TransducerException {
    if (name != null) {
      for (final ProcessType type : values()) {
        if (type.name().equals(name)) {
          return type;
        }
      }
    }
    throw new TransducerException(Code.UNSUPPORTED_PROCESS,
        "Unsupported process type: " + name);
  }
}
