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

package com.google.examples.neg.controller.types;

import org.jetbrains.annotations.NotNull;

/**
 * Identity of a network endpoint in a NEG.
 *
 * @param ip IPv4 or IPv6 address of the pod
 * @param port serving port, in its decimal string form, e.g., <code>"8080"</code>
 * @param node name of the Kubernetes Node (VM instance) that runs the pod
 */
public record NetworkEndpoint(@NotNull String ip, @NotNull String port, @NotNull String node) {}
