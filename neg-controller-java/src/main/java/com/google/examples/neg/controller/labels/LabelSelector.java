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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A Kubernetes label selector, parsed from its string form, e.g., <code>
 * environment in (production, qa),tier!=frontend,track</code>.
 *
 * <p>A selector is a conjunction of requirements. The empty selector matches all label sets.
 *
 * @see <a
 *     href="https://kubernetes.io/docs/concepts/overview/working-with-objects/labels/#label-selectors">Label
 *     selectors</a>
 */
public class LabelSelector {

  private final List<Requirement> requirements;

  LabelSelector(@NotNull Collection<Requirement> requirements) {
    this.requirements = List.copyOf(requirements);
  }

  /**
   * Parses a label selector.
   *
   * @throws LabelSelectorException if the selector is not valid
   */
  @NotNull
  public static LabelSelector parse(@Nullable String selector) {
    return new LabelSelectorParser(selector == null ? "" : selector).parse();
  }

  /** Returns true if the labels satisfy every requirement of this selector. */
  public boolean matches(@Nullable Map<String, String> labels) {
    Map<String, String> labelSet = labels == null ? Map.of() : labels;
    return requirements.stream().allMatch(requirement -> requirement.matches(labelSet));
  }

  public boolean isEmpty() {
    return requirements.isEmpty();
  }

  @NotNull
  public List<Requirement> requirements() {
    return requirements;
  }

  @Override
  public String toString() {
    return requirements.stream().map(Requirement::toString).collect(Collectors.joining(","));
  }

  /** Selector operators. */
  public enum Operator {
    EXISTS,
    DOES_NOT_EXIST,
    EQUALS,
    NOT_EQUALS,
    IN,
    NOT_IN,
    GREATER_THAN,
    LESS_THAN
  }

  /**
   * A single requirement of a selector.
   *
   * @param key label key
   * @param operator how to compare the label value
   * @param values empty for {@link Operator#EXISTS} and {@link Operator#DOES_NOT_EXIST}, exactly
   *     one integer for {@link Operator#GREATER_THAN} and {@link Operator#LESS_THAN}
   */
  public record Requirement(@NotNull String key, @NotNull Operator operator, Set<String> values) {

    public Requirement {
      values = Set.copyOf(values);
    }

    boolean matches(@NotNull Map<String, String> labels) {
      boolean hasLabel = labels.containsKey(key);
      String value = labels.get(key);
      switch (operator) {
        case EXISTS:
          return hasLabel;
        case DOES_NOT_EXIST:
          return !hasLabel;
        case EQUALS:
        case IN:
          return hasLabel && values.contains(value);
        case NOT_EQUALS:
        case NOT_IN:
          return !hasLabel || !values.contains(value);
        case GREATER_THAN:
        case LESS_THAN:
          if (!hasLabel || value == null) {
            return false;
          }
          long labelValue;
          try {
            labelValue = Long.parseLong(value);
          } catch (NumberFormatException e) {
            return false;
          }
          long bound = Long.parseLong(values.iterator().next());
          return operator == Operator.GREATER_THAN ? labelValue > bound : labelValue < bound;
        default:
          throw new IllegalStateException("Unknown selector operator " + operator);
      }
    }

    @Override
    public String toString() {
      String sortedValues = values.stream().sorted().collect(Collectors.joining(","));
      switch (operator) {
        case EXISTS:
          return key;
        case DOES_NOT_EXIST:
          return "!" + key;
        case EQUALS:
          return key + "=" + sortedValues;
        case NOT_EQUALS:
          return key + "!=" + sortedValues;
        case IN:
          return key + " in (" + sortedValues + ")";
        case NOT_IN:
          return key + " notin (" + sortedValues + ")";
        case GREATER_THAN:
          return key + ">" + sortedValues;
        case LESS_THAN:
          return key + "<" + sortedValues;
        default:
          throw new IllegalStateException("Unknown selector operator " + operator);
      }
    }
  }
}
