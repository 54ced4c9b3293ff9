// Copyright 2024 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.examples.neg.controller.labels;

import com.google.examples.neg.controller.labels.LabelSelector.Operator;
import com.google.examples.neg.controller.labels.LabelSelector.Requirement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;

/** Recursive descent parser for the string form of Kubernetes label selectors. */
class LabelSelectorParser {

  private static final int MAX_NAME_LENGTH = 63;
  private static final int MAX_PREFIX_LENGTH = 253;

  private static final Pattern NAME_PATTERN =
      Pattern.compile("([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9]");

  private static final Pattern DNS_SUBDOMAIN_PATTERN =
      Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");

  private static final String SPECIAL_CHARACTERS = "!=<>(),";

  private final String selector;
  private final List<Token> tokens;
  private int position;

  LabelSelectorParser(@NotNull String selector) {
    this.selector = selector;
    this.tokens = tokenize(selector);
    this.position = 0;
  }

  @NotNull
  LabelSelector parse() {
    var requirements = new ArrayList<Requirement>();
    if (peek().type() == TokenType.END) {
      return new LabelSelector(requirements);
    }
    while (true) {
      requirements.add(parseRequirement());
      Token token = next();
      if (token.type() == TokenType.END) {
        return new LabelSelector(requirements);
      }
      if (token.type() != TokenType.COMMA) {
        throw error("found '" + token.text() + "', expected ',' or end of selector");
      }
      if (peek().type() == TokenType.END) {
        throw error("found end of selector after ','");
      }
    }
  }

  private Requirement parseRequirement() {
    if (peek().type() == TokenType.NOT) {
      next();
      String key = expectIdentifier("label key");
      validateKey(key);
      return new Requirement(key, Operator.DOES_NOT_EXIST, Set.of());
    }
    String key = expectIdentifier("label key");
    validateKey(key);
    TokenType lookahead = peek().type();
    if (lookahead == TokenType.END || lookahead == TokenType.COMMA) {
      return new Requirement(key, Operator.EXISTS, Set.of());
    }
    Operator operator = parseOperator();
    Set<String> values;
    if (operator == Operator.IN || operator == Operator.NOT_IN) {
      values = parseValueList();
    } else {
      values = Set.of(parseExactValue());
    }
    for (String value : values) {
      validateValue(value);
    }
    if (operator == Operator.GREATER_THAN || operator == Operator.LESS_THAN) {
      String value = values.iterator().next();
      try {
        Long.parseLong(value);
      } catch (NumberFormatException e) {
        throw error("value '" + value + "' for operator " + operator + " must be an integer");
      }
    }
    return new Requirement(key, operator, values);
  }

  private Operator parseOperator() {
    Token token = next();
    switch (token.type()) {
      case EQUALS:
      case DOUBLE_EQUALS:
        return Operator.EQUALS;
      case NOT_EQUALS:
        return Operator.NOT_EQUALS;
      case GREATER_THAN:
        return Operator.GREATER_THAN;
      case LESS_THAN:
        return Operator.LESS_THAN;
      case IDENTIFIER:
        if ("in".equals(token.text())) {
          return Operator.IN;
        }
        if ("notin".equals(token.text())) {
          return Operator.NOT_IN;
        }
        throw error("found '" + token.text() + "', expected an operator");
      default:
        throw error("found '" + token.text() + "', expected an operator");
    }
  }

  /** A missing value, as in <code>key=</code>, is the empty string. */
  private String parseExactValue() {
    TokenType lookahead = peek().type();
    if (lookahead == TokenType.END || lookahead == TokenType.COMMA) {
      return "";
    }
    return expectIdentifier("label value");
  }

  /** Parses <code>(v1, v2)</code>. Empty list elements are empty strings. */
  private Set<String> parseValueList() {
    Token open = next();
    if (open.type() != TokenType.OPEN_PAR) {
      throw error("found '" + open.text() + "', expected '('");
    }
    Set<String> values = new LinkedHashSet<>();
    boolean expectValue = true;
    while (true) {
      Token token = next();
      switch (token.type()) {
        case IDENTIFIER:
          if (!expectValue) {
            throw error("found '" + token.text() + "', expected ',' or ')'");
          }
          values.add(token.text());
          expectValue = false;
          break;
        case COMMA:
          if (expectValue) {
            values.add("");
          }
          expectValue = true;
          break;
        case CLOSED_PAR:
          if (expectValue) {
            values.add("");
          }
          return values;
        default:
          throw error("found '" + token.text() + "', expected a value, ',' or ')'");
      }
    }
  }

  private String expectIdentifier(String what) {
    Token token = next();
    if (token.type() != TokenType.IDENTIFIER) {
      throw error("found '" + token.text() + "', expected " + what);
    }
    return token.text();
  }

  private Token peek() {
    return tokens.get(position);
  }

  private Token next() {
    Token token = tokens.get(position);
    if (token.type() != TokenType.END) {
      position++;
    }
    return token;
  }

  private LabelSelectorException error(String message) {
    return new LabelSelectorException(
        "unable to parse label selector [" + selector + "]: " + message);
  }

  private void validateKey(String key) {
    String name = key;
    int slash = key.indexOf('/');
    if (slash >= 0) {
      String prefix = key.substring(0, slash);
      name = key.substring(slash + 1);
      if (prefix.isEmpty()
          || prefix.length() > MAX_PREFIX_LENGTH
          || !DNS_SUBDOMAIN_PATTERN.matcher(prefix).matches()) {
        throw error("invalid label key prefix '" + prefix + "'");
      }
    }
    if (name.length() > MAX_NAME_LENGTH || !NAME_PATTERN.matcher(name).matches()) {
      throw error("invalid label key '" + key + "'");
    }
  }

  private void validateValue(String value) {
    if (value.isEmpty()) {
      return;
    }
    if (value.length() > MAX_NAME_LENGTH || !NAME_PATTERN.matcher(value).matches()) {
      throw error("invalid label value '" + value + "'");
    }
  }

  private static List<Token> tokenize(String selector) {
    var tokens = new ArrayList<Token>();
    int i = 0;
    int length = selector.length();
    while (i < length) {
      char c = selector.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
        continue;
      }
      switch (c) {
        case ',':
          tokens.add(new Token(TokenType.COMMA, ","));
          i++;
          continue;
        case '(':
          tokens.add(new Token(TokenType.OPEN_PAR, "("));
          i++;
          continue;
        case ')':
          tokens.add(new Token(TokenType.CLOSED_PAR, ")"));
          i++;
          continue;
        case '>':
          tokens.add(new Token(TokenType.GREATER_THAN, ">"));
          i++;
          continue;
        case '<':
          tokens.add(new Token(TokenType.LESS_THAN, "<"));
          i++;
          continue;
        case '=':
          if (i + 1 < length && selector.charAt(i + 1) == '=') {
            tokens.add(new Token(TokenType.DOUBLE_EQUALS, "=="));
            i += 2;
          } else {
            tokens.add(new Token(TokenType.EQUALS, "="));
            i++;
          }
          continue;
        case '!':
          if (i + 1 < length && selector.charAt(i + 1) == '=') {
            tokens.add(new Token(TokenType.NOT_EQUALS, "!="));
            i += 2;
          } else {
            tokens.add(new Token(TokenType.NOT, "!"));
            i++;
          }
          continue;
        default:
          int start = i;
          while (i < length
              && !Character.isWhitespace(selector.charAt(i))
              && SPECIAL_CHARACTERS.indexOf(selector.charAt(i)) < 0) {
            i++;
          }
          tokens.add(new Token(TokenType.IDENTIFIER, selector.substring(start, i)));
      }
    }
    tokens.add(new Token(TokenType.END, "<end>"));
    return tokens;
  }

  private enum TokenType {
    IDENTIFIER,
    NOT,
    EQUALS,
    DOUBLE_EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    LESS_THAN,
    COMMA,
    OPEN_PAR,
    CLOSED_PAR,
    END
  }

  private record Token(TokenType type, String text) {}
}
