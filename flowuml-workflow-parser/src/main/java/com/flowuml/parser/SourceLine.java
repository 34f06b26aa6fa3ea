package com.flowuml.parser;

/** One significant, trimmed line of a diagram document with its 1-based position in the source text. */
record SourceLine(int number, String text) {
}
