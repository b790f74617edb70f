// This file is part of tsquery.
// Copyright (C) 2024  The tsquery Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsquery.storage;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.tsquery.data.MetricPath;
import net.tsquery.exceptions.InvalidPatternException;

/**
 * A compiled metric path glob. Each dot separated segment compiles to its
 * own matcher and a pattern with N segments only matches paths with
 * exactly N segments. Supported syntax within a segment:
 * <ul>
 * <li>{@code *} any run of characters, consecutive stars collapse</li>
 * <li>{@code ?} any single character</li>
 * <li>{@code [abc]}, {@code [a-z]} a character class, negated with a
 * leading {@code !} or {@code ^}</li>
 * <li>{@code {a,b,c}} alternation, alternatives may hold the above but
 * not another brace</li>
 * <li>{@code \x} the literal character x, except for the dot which
 * always separates segments</li>
 * </ul>
 * Compiling fails with an {@link InvalidPatternException} before any
 * backend is contacted.
 *
 * @since 3.0
 */
public final class GlobPattern {

  /** The original pattern. */
  private final String pattern;

  /** One matcher per segment, null for literal segments. */
  private final List<Pattern> matchers;

  /** The literal value per segment, null for wildcard segments. */
  private final List<String> literals;

  /**
   * Private ctor, use {@link #compile(String)}.
   */
  private GlobPattern(final String pattern,
                      final List<Pattern> matchers,
                      final List<String> literals) {
    this.pattern = pattern;
    this.matchers = matchers;
    this.literals = literals;
  }

  /**
   * Compiles the pattern.
   * @param pattern A non-null and non-empty glob.
   * @return The compiled pattern.
   * @throws InvalidPatternException if the pattern was malformed.
   */
  public static GlobPattern compile(final String pattern) {
    if (Strings.isNullOrEmpty(pattern)) {
      throw new InvalidPatternException(pattern, -1,
          "pattern cannot be null or empty");
    }
    final List<Pattern> matchers = Lists.newArrayList();
    final List<String> literals = Lists.newArrayList();
    int segment_start = 0;
    int depth_brace = 0;
    int depth_bracket = 0;
    for (int i = 0; i < pattern.length(); i++) {
      final char c = pattern.charAt(i);
      if (c == '\\') {
        if (i + 1 < pattern.length() && pattern.charAt(i + 1) == '.') {
          throw new InvalidPatternException(pattern, i,
              "a dot cannot be escaped, it always separates segments");
        }
        i++;
        continue;
      }
      if (depth_bracket > 0) {
        if (c == ']') {
          depth_bracket = 0;
        }
        continue;
      }
      switch (c) {
      case '[':
        depth_bracket = 1;
        break;
      case '{':
        depth_brace++;
        break;
      case '}':
        depth_brace--;
        break;
      case '.':
        if (depth_brace > 0) {
          throw new InvalidPatternException(pattern, i,
              "segment separator inside an alternation");
        }
        addSegment(pattern, segment_start, i, matchers, literals);
        segment_start = i + 1;
        break;
      default:
        break;
      }
    }
    addSegment(pattern, segment_start, pattern.length(), matchers, literals);
    return new GlobPattern(pattern,
        Collections.unmodifiableList(matchers),
        Collections.unmodifiableList(literals));
  }

  /** @return The original pattern. */
  public String pattern() {
    return pattern;
  }

  /** @return The number of segments. */
  public int segmentCount() {
    return matchers.size();
  }

  /**
   * @param index A segment index.
   * @return True if the segment has no wildcards.
   */
  public boolean isLiteral(final int index) {
    return literals.get(index) != null;
  }

  /**
   * @param index A segment index.
   * @return The literal text of the segment with escapes removed, or null
   * if the segment has wildcards.
   */
  public String literal(final int index) {
    return literals.get(index);
  }

  /**
   * Matches a single segment, used by finders that walk a tree.
   * @param index The segment index.
   * @param name The node name at that depth.
   * @return True if the name matches.
   */
  public boolean matchesSegment(final int index, final String name) {
    if (name == null || index < 0 || index >= matchers.size()) {
      return false;
    }
    final String literal = literals.get(index);
    if (literal != null) {
      return literal.equals(name);
    }
    return matchers.get(index).matcher(name).matches();
  }

  /**
   * @param path A metric path.
   * @return True if every segment matches and the counts are equal.
   */
  public boolean matches(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      return false;
    }
    int segment = 0;
    int start = 0;
    for (int i = 0; i <= path.length(); i++) {
      if (i == path.length() || path.charAt(i) == '.') {
        if (segment >= matchers.size()
            || !matchesSegment(segment, path.substring(start, i))) {
          return false;
        }
        segment++;
        start = i + 1;
      }
    }
    return segment == matchers.size();
  }

  /**
   * @param path A metric path.
   * @return True if the path matches.
   */
  public boolean matches(final MetricPath path) {
    return path != null && matches(path.toString());
  }

  @Override
  public String toString() {
    return pattern;
  }

  /**
   * Compiles one segment and appends it to the lists.
   */
  private static void addSegment(final String pattern,
                                 final int start,
                                 final int end,
                                 final List<Pattern> matchers,
                                 final List<String> literals) {
    if (start >= end) {
      throw new InvalidPatternException(pattern, start, "empty segment");
    }
    final StringBuilder regex = new StringBuilder();
    final StringBuilder literal = new StringBuilder();
    final boolean is_literal = compileRun(pattern, start, end, regex,
        literal, false);
    if (is_literal) {
      matchers.add(null);
      literals.add(literal.toString());
    } else {
      matchers.add(Pattern.compile(regex.toString()));
      literals.add(null);
    }
  }

  /**
   * Compiles the characters in {@code [start, end)} to a regex.
   * @return True if the run had no wildcard syntax.
   */
  private static boolean compileRun(final String pattern,
                                    final int start,
                                    final int end,
                                    final StringBuilder regex,
                                    final StringBuilder literal,
                                    final boolean in_alternation) {
    boolean is_literal = true;
    int i = start;
    while (i < end) {
      final char c = pattern.charAt(i);
      switch (c) {
      case '\\':
        if (i + 1 >= end) {
          throw new InvalidPatternException(pattern, i, "trailing escape");
        }
        appendLiteral(regex, pattern.charAt(i + 1));
        literal.append(pattern.charAt(i + 1));
        i += 2;
        continue;
      case '*':
        is_literal = false;
        regex.append("[^.]*");
        while (i + 1 < end && pattern.charAt(i + 1) == '*') {
          i++;
        }
        break;
      case '?':
        is_literal = false;
        regex.append("[^.]");
        break;
      case '[':
        is_literal = false;
        i = compileClass(pattern, i, end, regex);
        break;
      case '{':
        if (in_alternation) {
          throw new InvalidPatternException(pattern, i,
              "nested alternations are not supported");
        }
        is_literal = false;
        i = compileAlternation(pattern, i, end, regex);
        break;
      case '}':
        throw new InvalidPatternException(pattern, i, "unbalanced '}'");
      case ']':
        throw new InvalidPatternException(pattern, i, "unbalanced ']'");
      default:
        appendLiteral(regex, c);
        literal.append(c);
        break;
      }
      i++;
    }
    return is_literal;
  }

  /**
   * Compiles a bracket class starting at {@code open}.
   * @return The index of the closing bracket.
   */
  private static int compileClass(final String pattern,
                                  final int open,
                                  final int end,
                                  final StringBuilder regex) {
    int i = open + 1;
    regex.append('[');
    if (i < end && (pattern.charAt(i) == '!' || pattern.charAt(i) == '^')) {
      regex.append('^');
      i++;
    }
    final int first = i;
    while (i < end && pattern.charAt(i) != ']') {
      final char c = pattern.charAt(i);
      if (c == '-' && i > first && i + 1 < end && pattern.charAt(i + 1) != ']') {
        if (pattern.charAt(i - 1) > pattern.charAt(i + 1)) {
          throw new InvalidPatternException(pattern, i,
              "invalid character range");
        }
        regex.append('-');
      } else if (Character.isLetterOrDigit(c)) {
        regex.append(c);
      } else {
        regex.append('\\').append(c);
      }
      i++;
    }
    if (i >= end) {
      throw new InvalidPatternException(pattern, open, "unbalanced '['");
    }
    if (i == first) {
      throw new InvalidPatternException(pattern, open, "empty character class");
    }
    regex.append(']');
    return i;
  }

  /**
   * Compiles an alternation starting at {@code open}.
   * @return The index of the closing brace.
   */
  private static int compileAlternation(final String pattern,
                                        final int open,
                                        final int end,
                                        final StringBuilder regex) {
    int close = -1;
    final List<Integer> commas = Lists.newArrayList();
    for (int i = open + 1; i < end; i++) {
      final char c = pattern.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == '[') {
        while (i < end && pattern.charAt(i) != ']') {
          i++;
        }
      } else if (c == '{') {
        throw new InvalidPatternException(pattern, i,
            "nested alternations are not supported");
      } else if (c == ',') {
        commas.add(i);
      } else if (c == '}') {
        close = i;
        break;
      }
    }
    if (close < 0) {
      throw new InvalidPatternException(pattern, open, "unbalanced '{'");
    }
    regex.append("(?:");
    int from = open + 1;
    final List<Integer> bounds = ImmutableList.<Integer>builder()
        .addAll(commas).add(close).build();
    for (int b = 0; b < bounds.size(); b++) {
      if (b > 0) {
        regex.append('|');
      }
      compileRun(pattern, from, bounds.get(b), regex, new StringBuilder(), true);
      from = bounds.get(b) + 1;
    }
    regex.append(')');
    return close;
  }

  private static void appendLiteral(final StringBuilder regex, final char c) {
    if (Character.isLetterOrDigit(c) || c == '_') {
      regex.append(c);
    } else {
      regex.append(Pattern.quote(String.valueOf(c)));
    }
  }
}
