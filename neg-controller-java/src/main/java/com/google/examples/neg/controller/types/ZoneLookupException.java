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

/** The zone of a node could not be determined, or the known zones could not be listed. */
public class ZoneLookupException extends NegException {

  public ZoneLookupException(String message) {
    super(message);
  }

  public ZoneLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
