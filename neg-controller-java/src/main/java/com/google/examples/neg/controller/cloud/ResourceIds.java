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

package com.google.examples.neg.controller.cloud;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Compares Compute Engine resource references that may be given in different forms.
 *
 * <p>Supported forms, for the network <code>default</code> in project <code>my-project</code>:
 *
 * <ul>
 *   <li><code>https://www.googleapis.com/compute/v1/projects/my-project/global/networks/default
 *       </code>
 *   <li><code>projects/my-project/global/networks/default</code>
 *   <li><code>default</code>
 * </ul>
 */
public final class ResourceIds {

  /**
   * Matches the path of full and partial resource URLs. Groups: project, scope (<code>global
   * </code>, <code>regions/[region]</code> or <code>zones/[zone]</code>), resource type, name.
   */
  private static final Pattern RESOURCE_PATH_PATTERN =
      Pattern.compile(
          "^(?:https?://[^/]+/compute/[^/]+/)?projects/([^/]+)/"
              + "(global|regions/[^/]+|zones/[^/]+)/([^/]+)/([^/]+)/?$");

  private static final Pattern SHORT_NAME_PATTERN = Pattern.compile("^[^/]+$");

  private ResourceIds() {}

  /**
   * Parsed resource reference.
   *
   * @param project project ID
   * @param scope <code>global</code>, <code>regions/[region]</code> or <code>zones/[zone]</code>
   * @param resourceType plural resource type, e.g., <code>subnetworks</code>
   * @param name resource name
   */
  public record ResourceId(
      @NotNull String project,
      @NotNull String scope,
      @NotNull String resourceType,
      @NotNull String name) {

    /** Returns the partial URL, e.g., <code>projects/p/global/networks/default</code>. */
    @NotNull
    public String relativeUrl() {
      return "projects/%s/%s/%s/%s".formatted(project, scope, resourceType, name);
    }
  }

  /** Parses a full or partial resource URL. Returns an empty Optional for other strings. */
  @NotNull
  public static Optional<ResourceId> parse(@Nullable String url) {
    if (url == null) {
      return Optional.empty();
    }
    Matcher matcher = RESOURCE_PATH_PATTERN.matcher(url.trim());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(
        new ResourceId(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4)));
  }

  /**
   * Returns true if both strings refer to the same resource.
   *
   * <p>Two URLs are equal if their project, scope, resource type and name are equal. If either
   * string is a short name, only the names are compared. Two null or blank strings are equal.
   */
  public static boolean equalResourceIds(@Nullable String a, @Nullable String b) {
    String left = a == null ? "" : a.trim();
    String right = b == null ? "" : b.trim();
    if (left.isEmpty() || right.isEmpty()) {
      return left.isEmpty() && right.isEmpty();
    }
    Optional<ResourceId> leftId = parse(left);
    Optional<ResourceId> rightId = parse(right);
    if (leftId.isPresent() && rightId.isPresent()) {
      return leftId.get().equals(rightId.get());
    }
    Optional<String> leftName = name(left, leftId);
    Optional<String> rightName = name(right, rightId);
    return leftName.isPresent() && leftName.equals(rightName);
  }

  private static Optional<String> name(String value, Optional<ResourceId> id) {
    if (id.isPresent()) {
      return Optional.of(id.get().name());
    }
    if (SHORT_NAME_PATTERN.matcher(value).matches()) {
      return Optional.of(value);
    }
    return Optional.empty();
  }
}
