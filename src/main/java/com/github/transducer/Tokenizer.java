package com.github.transducer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text on whitespace and trims any run of leading and trailing dots from every token.
 * Internal dots are kept. A token made only of dots becomes the empty string and is still returned.
 */
public final class Tokenizer {
  private static final Pattern nonWhitespaceRun =
      Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);

  public static List<String> tokenize(final String text) {
    final List<String> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    final Matcher matcher = nonWhitespaceRun.matcher(text);
    while (matcher.find()) {
      tokens.add(stripDots(matcher.group()));
    }
    return tokens;
  }

  static String stripDots(final String token) {
    int begin = 0;
    int end = token.length();
    while (begin < end && token.charAt(begin) == '.') {
      begin++;
    }
    while (end > begin && token.charAt(end - 1) == '.') {
      end--;
    }
    return token.substring(begin, end);
  }

  private Tokenizer() {}
}
