package com.finalsentence.domain;

public record Phrase(String id, String text, String difficulty, String category) {

  /** Number of whitespace-separated words in the phrase. */
  public int wordCount() {
    String t = text == null ? "" : text.trim();
    return t.isEmpty() ? 0 : t.split("\\s+").length;
  }
}
